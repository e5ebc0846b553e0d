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

import com.umitunal.bloom.exception.InvalidParameterException;

/**
 * Sizing math for Bloom filters.
 */
public final class BloomFilterSizing {
    private static final double LN2 = Math.log(2);
    private static final double LN2_SQUARED = LN2 * LN2;

    private BloomFilterSizing() {
    }

    /**
     * Calculates the optimal number of bits for a Bloom filter:
     * {@code ceil(-(n * ln p) / (ln 2)^2)}.
     *
     * @param n the expected number of entries
     * @param p the desired false positive rate
     * @return the optimal number of bits, at least 1
     * @throws InvalidParameterException if the result does not fit a bit array
     */
    public static int optimalNumOfBits(int n, double p) {
        double bits = Math.ceil(-(n * Math.log(p)) / LN2_SQUARED);
        if (bits > Integer.MAX_VALUE) {
            throw new InvalidParameterException(String.format(
                "A filter for %d items at false positive rate %s needs %.0f bits, more than %d",
                n, p, bits, Integer.MAX_VALUE));
        }
        return Math.max(1, (int) bits);
    }

    /**
     * Calculates the optimal number of hash functions for a Bloom filter:
     * {@code ceil(-ln p / ln 2)}.
     *
     * @param p the desired false positive rate
     * @return the optimal number of hash functions, at least 1
     */
    public static int optimalNumOfHashFunctions(double p) {
        return Math.max(1, (int) Math.ceil(-Math.log(p) / LN2));
    }
}
