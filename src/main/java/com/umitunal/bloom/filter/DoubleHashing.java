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

package com.umitunal.bloom.filter;

/**
 * Derives probe positions from two base hashes: {@code (h1 + i * h2) mod m}.
 * All arithmetic is unsigned 64-bit; overflow wraps.
 */
public final class DoubleHashing {

    private DoubleHashing() {
    }

    /**
     * Computes the bit index probed in the given round.
     *
     * @param h1 first base hash, unsigned
     * @param h2 second base hash, unsigned
     * @param round the probe round, from 0 to k - 1
     * @param length the bit array length, positive
     * @return an index in {@code [0, length)}
     */
    public static int index(long h1, long h2, int round, int length) {
        long combined = h1 + round * h2;
        return (int) Long.remainderUnsigned(combined, length);
    }
}
