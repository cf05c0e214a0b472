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

/**
 * The value types an {@link Attributes} entry may hold.
 */
public enum AttributeType {

    INT(Integer.class),
    LONG(Long.class),
    DOUBLE(Double.class),
    BOOLEAN(Boolean.class),
    STRING(String.class),
    DOUBLE_ARRAY(double[].class),
    INT_ARRAY(int[].class),
    STRING_ARRAY(String[].class),
    DOUBLE_MATRIX(double[][].class),
    NESTED(Attributes.class);

    private final Class<?> valueClass;

    AttributeType(Class<?> valueClass) {
        this.valueClass = valueClass;
    }

    public Class<?> getValueClass() {
        return valueClass;
    }

    /**
     * @param value a stored attribute value
     * @return the type of the value
     * @throws IllegalArgumentException if the value is not of a supported type
     */
    public static AttributeType of(Object value) {
        for (AttributeType type : values()) {
            if (type.valueClass.isInstance(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unsupported attribute value type "
                + (value == null ? "null" : value.getClass().getName()));
    }
}
