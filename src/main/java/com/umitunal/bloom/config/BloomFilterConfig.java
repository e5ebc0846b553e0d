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

package com.umitunal.bloom.config;

import com.umitunal.bloom.exception.InvalidParameterException;

/**
 * Configuration record for a Bloom filter.
 * Holds the two parameters the filter is sized from.
 *
 * @param expectedItemCount number of distinct items the filter is expected to hold
 * @param falsePositiveRate target false positive probability at that load, strictly between 0 and 1
 */
public record BloomFilterConfig(
    int expectedItemCount,
    double falsePositiveRate
) {

    /**
     * Creates a new BloomFilterConfig with the specified parameters.
     * Validates that all parameters are valid.
     *
     * @throws InvalidParameterException if any parameter is invalid
     */
    public BloomFilterConfig {
        if (expectedItemCount <= 0) {
            throw new InvalidParameterException("expectedItemCount must be greater than 0");
        }
        // Written this way so NaN is rejected too
        if (!(falsePositiveRate > 0.0 && falsePositiveRate < 1.0)) {
            throw new InvalidParameterException(
                "falsePositiveRate must be between 0 and 1 (exclusive), was " + falsePositiveRate);
        }
    }

    /**
     * Creates a default configuration with:
     * - 1000 expected items
     * - 1% false positive rate
     *
     * @return a default configuration
     */
    public static BloomFilterConfig getDefault() {
        return new BloomFilterConfig(1000, 0.01);
    }

    /**
     * Creates a new configuration with a custom expected item count.
     *
     * @param expectedItemCount number of distinct items the filter is expected to hold
     * @return a new configuration with the specified item count
     */
    public BloomFilterConfig withExpectedItemCount(int expectedItemCount) {
        return new BloomFilterConfig(expectedItemCount, this.falsePositiveRate);
    }

    /**
     * Creates a new configuration with a custom false positive rate.
     *
     * @param falsePositiveRate target false positive probability
     * @return a new configuration with the specified rate
     */
    public BloomFilterConfig withFalsePositiveRate(double falsePositiveRate) {
        return new BloomFilterConfig(this.expectedItemCount, falsePositiveRate);
    }
}
