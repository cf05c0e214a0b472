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

package com.amazon.omniad.state;

import static com.amazon.omniad.CommonUtils.checkNotNull;

import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;

/**
 * Writes state objects with the
 * <a href="https://github.com/protostuff/protostuff">protostuff</a> runtime
 * schema. Backends use this for their part of an archive.
 *
 * @param <State> the state class
 */
public class ProtostuffStateSerializer<State> {

    private static final int BUFFER_SIZE = 512;

    private final Schema<State> schema;

    public ProtostuffStateSerializer(Class<State> stateClass) {
        checkNotNull(stateClass, "stateClass must not be null");
        this.schema = RuntimeSchema.getSchema(stateClass);
    }

    public byte[] toBytes(State state) {
        checkNotNull(state, "state must not be null");
        LinkedBuffer buffer = LinkedBuffer.allocate(BUFFER_SIZE);
        try {
            return ProtostuffIOUtil.toByteArray(state, schema, buffer);
        } finally {
            buffer.clear();
        }
    }

    /**
     * @param bytes bytes produced by {@link #toBytes}
     * @return the decoded state
     * @throws IllegalArgumentException if the bytes cannot be decoded
     */
    public State fromBytes(byte[] bytes) {
        checkNotNull(bytes, "bytes must not be null");
        State state = schema.newMessage();
        try {
            ProtostuffIOUtil.mergeFrom(bytes, state, schema);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("unable to decode " + schema.messageName(), e);
        }
        return state;
    }
}
