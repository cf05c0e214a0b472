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

package com.amazon.omniad;

import static com.amazon.omniad.CommonUtils.checkArgument;
import static com.amazon.omniad.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Statistics derived from the training data that a detector needs again at
 * scoring time: the input dimensionality, feature names, scalers and similar.
 * Instances are immutable; arrays are copied on the way in and on the way out.
 * Attributes are written to their own archive segment and can be read back
 * without the backend that produced them.
 */
public final class Attributes {

    /**
     * Number of columns seen at fit time.
     */
    public static final String DIMENSIONS = "dimensions";

    /**
     * Number of rows seen at fit time.
     */
    public static final String TRAINING_ROWS = "trainingRows";

    /**
     * Column names seen at fit time, when the training matrix had them.
     */
    public static final String FEATURE_NAMES = "featureNames";

    private static final Attributes EMPTY = new Attributes(Collections.emptyMap());

    private final Map<String, Object> values;

    private Attributes(Map<String, Object> values) {
        this.values = values;
    }

    public static Attributes empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Set<String> getNames() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    public AttributeType getType(String name) {
        return AttributeType.of(require(name));
    }

    public int getInt(String name) {
        return get(name, AttributeType.INT, Integer.class);
    }

    public long getLong(String name) {
        return get(name, AttributeType.LONG, Long.class);
    }

    public double getDouble(String name) {
        return get(name, AttributeType.DOUBLE, Double.class);
    }

    public boolean getBoolean(String name) {
        return get(name, AttributeType.BOOLEAN, Boolean.class);
    }

    public String getString(String name) {
        return get(name, AttributeType.STRING, String.class);
    }

    public double[] getDoubleArray(String name) {
        return get(name, AttributeType.DOUBLE_ARRAY, double[].class).clone();
    }

    public int[] getIntArray(String name) {
        return get(name, AttributeType.INT_ARRAY, int[].class).clone();
    }

    public String[] getStringArray(String name) {
        return get(name, AttributeType.STRING_ARRAY, String[].class).clone();
    }

    public double[][] getDoubleMatrix(String name) {
        return CommonUtils.deepCopy(get(name, AttributeType.DOUBLE_MATRIX, double[][].class));
    }

    public Attributes getNested(String name) {
        return get(name, AttributeType.NESTED, Attributes.class);
    }

    /**
     * Returns the stored value without copying. Only meant for encoders that
     * need to walk every entry.
     *
     * @param name attribute name
     * @return the stored value
     */
    public Object getRaw(String name) {
        return require(name);
    }

    /**
     * @return a builder that starts from the entries of this instance
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.values.putAll(values);
        return builder;
    }

    private Object require(String name) {
        Object value = values.get(name);
        checkArgument(value != null, "no attribute named " + name);
        return value;
    }

    private <T> T get(String name, AttributeType type, Class<T> clazz) {
        Object value = require(name);
        checkArgument(clazz.isInstance(value),
                String.format("attribute %s is of type %s, not %s", name, AttributeType.of(value), type));
        return clazz.cast(value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Attributes)) {
            return false;
        }
        Map<String, Object> otherValues = ((Attributes) other).values;
        if (!values.keySet().equals(otherValues.keySet())) {
            return false;
        }
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (!Objects.deepEquals(entry.getValue(), otherValues.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            hash += entry.getKey().hashCode() ^ Arrays.deepHashCode(new Object[] { entry.getValue() });
        }
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("Attributes{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (!first) {
                builder.append(", ");
            }
            first = false;
            builder.append(entry.getKey()).append('=').append(Arrays.deepToString(new Object[] { entry.getValue() }));
        }
        return builder.append('}').toString();
    }

    public static class Builder {

        private final Map<String, Object> values = new LinkedHashMap<>();

        public Builder put(String name, int value) {
            return store(name, value);
        }

        public Builder put(String name, long value) {
            return store(name, value);
        }

        public Builder put(String name, double value) {
            return store(name, value);
        }

        public Builder put(String name, boolean value) {
            return store(name, value);
        }

        public Builder put(String name, String value) {
            return store(name, checkNotNull(value, "value must not be null"));
        }

        public Builder put(String name, double[] value) {
            return store(name, checkNotNull(value, "value must not be null").clone());
        }

        public Builder put(String name, int[] value) {
            return store(name, checkNotNull(value, "value must not be null").clone());
        }

        public Builder put(String name, String[] value) {
            checkNotNull(value, "value must not be null");
            for (String element : value) {
                checkNotNull(element, "string array elements must not be null");
            }
            return store(name, value.clone());
        }

        public Builder put(String name, double[][] value) {
            checkNotNull(value, "value must not be null");
            for (double[] row : value) {
                checkNotNull(row, "matrix rows must not be null");
            }
            return store(name, CommonUtils.deepCopy(value));
        }

        public Builder put(String name, Attributes value) {
            return store(name, checkNotNull(value, "value must not be null"));
        }

        /**
         * Stores an already typed value, as produced by a decoder.
         *
         * @param name  attribute name
         * @param value a value of one of the {@link AttributeType} classes
         * @return this builder
         */
        public Builder putRaw(String name, Object value) {
            switch (AttributeType.of(value)) {
            case DOUBLE_ARRAY:
                return put(name, (double[]) value);
            case INT_ARRAY:
                return put(name, (int[]) value);
            case STRING_ARRAY:
                return put(name, (String[]) value);
            case DOUBLE_MATRIX:
                return put(name, (double[][]) value);
            default:
                return store(name, value);
            }
        }

        public boolean contains(String name) {
            return values.containsKey(name);
        }

        private Builder store(String name, Object value) {
            checkNotNull(name, "name must not be null");
            checkArgument(!name.isEmpty(), "name must not be empty");
            values.put(name, value);
            return this;
        }

        public Attributes build() {
            return new Attributes(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
