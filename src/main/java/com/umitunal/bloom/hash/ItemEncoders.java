/*
 * Copyright (c) 2023-2025 Umit Unal
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.umitunal.bloom.hash;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Encoders for common item types.
 */
public final class ItemEncoders {

    private ItemEncoders() {
    }

    /**
     * Encodes strings as UTF-8.
     *
     * @return the string encoder
     */
    public static ItemEncoder<String> strings() {
        return item -> item.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Encodes integers as 4 big-endian bytes.
     *
     * @return the integer encoder
     */
    public static ItemEncoder<Integer> integers() {
        return item -> ByteBuffer.allocate(Integer.BYTES).putInt(item).array();
    }

    /**
     * Encodes longs as 8 big-endian bytes.
     *
     * @return the long encoder
     */
    public static ItemEncoder<Long> longs() {
        return item -> ByteBuffer.allocate(Long.BYTES).putLong(item).array();
    }

    /**
     * Uses byte arrays as they are.
     *
     * @return the identity encoder
     */
    public static ItemEncoder<byte[]> bytes() {
        return item -> item;
    }
}
