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

import static com.amazon.omniad.CommonUtils.checkNotNull;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.amazon.omniad.common.exception.ConfigException;

/**
 * Construction parameters of a detector, keyed by name. Values are numbers,
 * booleans or strings so that they can be written to the archive metadata and
 * used to rebuild an identical detector on load.
 */
public final class Hyperparameters {

    public static final Hyperparameters EMPTY = new Hyperparameters(Collections.emptySortedMap());

    private final Map<String, Object> values;

    private Hyperparameters(Map<String, Object> values) {
        this.values = values;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param values parameter values; each must be a {@link Number},
     *               {@link Boolean} or {@link String}
     * @return hyperparameters holding a copy of the map
     * @throws ConfigException if a value has an unsupported type
     */
    public static Hyperparameters of(Map<String, ?> values) {
        checkNotNull(values, "values must not be null");
        Builder builder = new Builder();
        values.forEach(builder::put);
        return builder.build();
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public int getInt(String name, int defaultValue) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        long longValue = integral(name, value);
        if (longValue < Integer.MIN_VALUE || longValue > Integer.MAX_VALUE) {
            throw new ConfigException(String.format("parameter %s is out of integer range: %s", name, value));
        }
        return (int) longValue;
    }

    public long getLong(String name, long defaultValue) {
        return findLong(name).orElse(defaultValue);
    }

    public Optional<Long> findLong(String name) {
        Object value = values.get(name);
        return value == null ? Optional.empty() : Optional.of(integral(name, value));
    }

    public double getDouble(String name, double defaultValue) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Number)) {
            throw new ConfigException(String.format("parameter %s must be a number, got %s", name, value));
        }
        return ((Number) value).doubleValue();
    }

    public boolean getBoolean(String name, boolean defaultValue) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Boolean)) {
            throw new ConfigException(String.format("parameter %s must be a boolean, got %s", name, value));
        }
        return (Boolean) value;
    }

    public String getString(String name, String defaultValue) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof String)) {
            throw new ConfigException(String.format("parameter %s must be a string, got %s", name, value));
        }
        return (String) value;
    }

    /**
     * Rejects parameters that the algorithm does not understand, so that a typo
     * is not silently ignored.
     *
     * @param algorithmId  the algorithm being configured
     * @param allowedNames parameters the algorithm accepts
     * @throws ConfigException listing every unknown parameter
     */
    public void checkKnown(String algorithmId, Collection<String> allowedNames) {
        Set<String> unknown = new TreeSet<>(values.keySet());
        unknown.removeAll(allowedNames);
        if (!unknown.isEmpty()) {
            throw new ConfigException(algorithmId, String.format("unknown parameters %s for algorithm %s, accepted: %s",
                    unknown, algorithmId, new TreeSet<>(allowedNames)));
        }
    }

    /**
     * @param name  parameter name
     * @param value new value
     * @return a copy with the parameter set
     */
    public Hyperparameters with(String name, Object value) {
        Builder builder = new Builder();
        values.forEach(builder::put);
        return builder.put(name, value).build();
    }

    private static long integral(String name, Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number) {
            double doubleValue = ((Number) value).doubleValue();
            if (doubleValue == Math.rint(doubleValue) && !Double.isInfinite(doubleValue)) {
                return (long) doubleValue;
            }
        }
        throw new ConfigException(String.format("parameter %s must be an integer, got %s", name, value));
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Hyperparameters && values.equals(((Hyperparameters) other).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    public static class Builder {

        private final TreeMap<String, Object> values = new TreeMap<>();

        public Builder put(String name, Object value) {
            checkNotNull(name, "name must not be null");
            if (!(value instanceof Number || value instanceof Boolean || value instanceof String)) {
                throw new ConfigException(String.format("parameter %s has unsupported value %s", name, value));
            }
            // integral values are kept as Long and Float as Double so equality survives a JSON round trip
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                value = ((Number) value).longValue();
            } else if (value instanceof Float) {
                value = ((Number) value).doubleValue();
            }
            values.put(name, value);
            return this;
        }

        public Builder contamination(double contamination) {
            return put(Detector.CONTAMINATION, contamination);
        }

        public Builder randomSeed(long randomSeed) {
            return put(Detector.RANDOM_SEED, randomSeed);
        }

        public Hyperparameters build() {
            return new Hyperparameters(Collections.unmodifiableSortedMap(new TreeMap<>(values)));
        }
    }
}
