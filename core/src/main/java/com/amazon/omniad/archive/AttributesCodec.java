/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.omniad.archive;

import static com.amazon.omniad.CommonUtils.checkArgument;
import static com.amazon.omniad.CommonUtils.checkNotNull;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;

import com.amazon.omniad.AttributeType;
import com.amazon.omniad.Attributes;
import com.amazon.omniad.state.Version;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Encodes {@link Attributes} as JSON in which every entry carries its type:
 *
 * <pre>
 * {"version":"1.0","entries":{"dimensions":{"type":"INT","value":5}, ...}}
 * </pre>
 *
 * The type tag keeps an {@code int[]} an {@code int[]} and a {@code long} a
 * {@code long} after decoding, and lets the segment be read without the
 * backend. Doubles that are not finite are written as the strings
 * {@code "NaN"}, {@code "Infinity"} and {@code "-Infinity"}.
 */
public class AttributesCodec {

    private static final String VERSION = "version";
    private static final String ENTRIES = "entries";
    private static final String TYPE = "type";
    private static final String VALUE = "value";

    private final ObjectMapper mapper;

    public AttributesCodec() {
        this(new ObjectMapper());
    }

    public AttributesCodec(ObjectMapper mapper) {
        this.mapper = checkNotNull(mapper, "mapper must not be null");
    }

    public byte[] toBytes(Attributes attributes) throws IOException {
        checkNotNull(attributes, "attributes must not be null");
        ObjectNode root = mapper.createObjectNode();
        root.put(VERSION, Version.ATTRIBUTES_V1_0);
        root.set(ENTRIES, toNode(attributes));
        return mapper.writeValueAsBytes(root);
    }

    /**
     * @param bytes an encoded attributes segment
     * @return the decoded attributes
     * @throws IOException              if the bytes are not JSON
     * @throws IllegalArgumentException if the JSON does not describe attributes
     */
    public Attributes fromBytes(byte[] bytes) throws IOException {
        checkNotNull(bytes, "bytes must not be null");
        JsonNode root = mapper.readTree(bytes);
        checkArgument(root != null && root.isObject(), "attributes must be a JSON object");
        String version = root.path(VERSION).asText(null);
        checkArgument(Version.ATTRIBUTES_V1_0.equals(version), "unsupported attributes version " + version);
        JsonNode entries = root.get(ENTRIES);
        checkArgument(entries != null && entries.isObject(), "attributes must contain an entries object");
        return fromNode(entries);
    }

    private ObjectNode toNode(Attributes attributes) {
        ObjectNode entries = mapper.createObjectNode();
        for (String name : attributes.getNames()) {
            Object value = attributes.getRaw(name);
            AttributeType type = AttributeType.of(value);
            ObjectNode entry = entries.putObject(name);
            entry.put(TYPE, type.name());
            entry.set(VALUE, toValueNode(type, value));
        }
        return entries;
    }

    private JsonNode toValueNode(AttributeType type, Object value) {
        ArrayNode array;
        switch (type) {
        case INT:
            return mapper.getNodeFactory().numberNode((Integer) value);
        case LONG:
            return mapper.getNodeFactory().numberNode((Long) value);
        case DOUBLE:
            return doubleNode((Double) value);
        case BOOLEAN:
            return mapper.getNodeFactory().booleanNode((Boolean) value);
        case STRING:
            return mapper.getNodeFactory().textNode((String) value);
        case DOUBLE_ARRAY:
            return doubleArrayNode((double[]) value);
        case INT_ARRAY:
            array = mapper.createArrayNode();
            for (int element : (int[]) value) {
                array.add(element);
            }
            return array;
        case STRING_ARRAY:
            array = mapper.createArrayNode();
            for (String element : (String[]) value) {
                array.add(element);
            }
            return array;
        case DOUBLE_MATRIX:
            array = mapper.createArrayNode();
            for (double[] row : (double[][]) value) {
                array.add(doubleArrayNode(row));
            }
            return array;
        case NESTED:
            return toNode((Attributes) value);
        default:
            throw new IllegalStateException("unhandled attribute type " + type);
        }
    }

    private JsonNode doubleNode(double value) {
        if (Double.isFinite(value)) {
            return mapper.getNodeFactory().numberNode(value);
        }
        return mapper.getNodeFactory().textNode(Double.toString(value));
    }

    private ArrayNode doubleArrayNode(double[] values) {
        ArrayNode array = mapper.createArrayNode();
        for (double value : values) {
            array.add(doubleNode(value));
        }
        return array;
    }

    private Attributes fromNode(JsonNode entries) {
        Attributes.Builder builder = Attributes.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = entries.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode entry = field.getValue();
            checkArgument(entry.isObject(), "attribute " + name + " must be an object");
            AttributeType type = AttributeType.valueOf(entry.path(TYPE).asText(""));
            JsonNode value = entry.get(VALUE);
            checkArgument(value != null && !value.isNull(), "attribute " + name + " has no value");
            builder.putRaw(name, fromValueNode(name, type, value));
        }
        return builder.build();
    }

    private Object fromValueNode(String name, AttributeType type, JsonNode value) {
        switch (type) {
        case INT:
            checkArgument(value.isIntegralNumber() && value.canConvertToInt(), "attribute " + name + " is not an int");
            return value.intValue();
        case LONG:
            checkArgument(value.isIntegralNumber() && value.canConvertToLong(), "attribute " + name + " is not a long");
            return value.longValue();
        case DOUBLE:
            return readDouble(name, value);
        case BOOLEAN:
            checkArgument(value.isBoolean(), "attribute " + name + " is not a boolean");
            return value.booleanValue();
        case STRING:
            checkArgument(value.isTextual(), "attribute " + name + " is not a string");
            return value.textValue();
        case DOUBLE_ARRAY:
            return readDoubleArray(name, value);
        case INT_ARRAY: {
            checkArgument(value.isArray(), "attribute " + name + " is not an array");
            int[] result = new int[value.size()];
            for (int i = 0; i < result.length; i++) {
                JsonNode element = value.get(i);
                checkArgument(element.isIntegralNumber() && element.canConvertToInt(),
                        "attribute " + name + " holds a non-int element");
                result[i] = element.intValue();
            }
            return result;
        }
        case STRING_ARRAY: {
            checkArgument(value.isArray(), "attribute " + name + " is not an array");
            String[] result = new String[value.size()];
            for (int i = 0; i < result.length; i++) {
                JsonNode element = value.get(i);
                checkArgument(element.isTextual(), "attribute " + name + " holds a non-string element");
                result[i] = element.textValue();
            }
            return result;
        }
        case DOUBLE_MATRIX: {
            checkArgument(value.isArray(), "attribute " + name + " is not an array");
            double[][] result = new double[value.size()][];
            for (int i = 0; i < result.length; i++) {
                result[i] = readDoubleArray(name, value.get(i));
            }
            return result;
        }
        case NESTED:
            checkArgument(value.isObject(), "attribute " + name + " is not an object");
            return fromNode(value);
        default:
            throw new IllegalStateException("unhandled attribute type " + type);
        }
    }

    private static double readDouble(String name, JsonNode value) {
        if (value.isNumber()) {
            return value.doubleValue();
        }
        checkArgument(value.isTextual(), "attribute " + name + " is not a double");
        switch (value.textValue()) {
        case "NaN":
            return Double.NaN;
        case "Infinity":
            return Double.POSITIVE_INFINITY;
        case "-Infinity":
            return Double.NEGATIVE_INFINITY;
        default:
            throw new IllegalArgumentException("attribute " + name + " is not a double");
        }
    }

    private static double[] readDoubleArray(String name, JsonNode value) {
        checkArgument(value != null && value.isArray(), "attribute " + name + " is not an array");
        double[] result = new double[value.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = readDouble(name, value.get(i));
        }
        return result;
    }
}
