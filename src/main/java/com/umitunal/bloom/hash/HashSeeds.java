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

import java.security.SecureRandom;

/**
 * The pair of seeds for the two base hashers of a filter.
 * A filter keeps its seeds for its whole lifetime; inserted items are only findable
 * under the seeds they were inserted with.
 *
 * @param first seed of the hasher producing h1
 * @param second seed of the hasher producing h2
 */
public record HashSeeds(int first, int second) {
    private static final SecureRandom RANDOM = new SecureRandom();

    /**
     * Draws two independent random seeds.
     *
     * @return freshly drawn seeds
     */
    public static HashSeeds random() {
        int first = RANDOM.nextInt();
        int second;
        do {
            second = RANDOM.nextInt();
        } while (second == first);
        return new HashSeeds(first, second);
    }

    /**
     * Creates fixed seeds, for reproducible filters.
     *
     * @param first seed of the hasher producing h1
     * @param second seed of the hasher producing h2
     * @return the seeds
     */
    public static HashSeeds of(int first, int second) {
        return new HashSeeds(first, second);
    }
}
