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

import org.apache.commons.codec.digest.MurmurHash3;

/**
 * {@link SeededHasher} backed by the x64 variant of 128-bit MurmurHash3.
 * Only the first 64 bits of the digest are returned.
 */
public class MurmurHash3Hasher implements SeededHasher {
    private final int seed;

    /**
     * Creates a new MurmurHash3Hasher.
     *
     * @param seed the seed mixed into every hash
     */
    public MurmurHash3Hasher(int seed) {
        this.seed = seed;
    }

    @Override
    public long hash(byte[] data) {
        return MurmurHash3.hash128x64(data, 0, data.length, seed)[0];
    }

    /**
     * Gets the seed of this hasher.
     *
     * @return the seed
     */
    public int getSeed() {
        return seed;
    }
}
