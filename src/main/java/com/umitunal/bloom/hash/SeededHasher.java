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
 * A non-cryptographic hash function bound to a fixed seed.
 * Two hashers built from independent seeds supply the base values for double hashing.
 */
@FunctionalInterface
public interface SeededHasher {

    /**
     * Hashes a byte sequence.
     *
     * @param data the bytes to hash
     * @return a 64-bit hash, to be treated as unsigned
     */
    long hash(byte[] data);
}
