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

/**
 * Builds a {@link SeededHasher} for a given seed.
 * Lets the hash algorithm be swapped without touching the filter.
 */
@FunctionalInterface
public interface SeededHasherFactory {

    /**
     * Creates a hasher bound to the specified seed.
     *
     * @param seed the seed
     * @return the hasher
     */
    SeededHasher create(int seed);

    /**
     * Returns the default factory, backed by 128-bit MurmurHash3.
     *
     * @return the default factory
     */
    static SeededHasherFactory murmur3() {
        return MurmurHash3Hasher::new;
    }
}
