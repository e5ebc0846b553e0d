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

import com.umitunal.bloom.api.MembershipFilter;
import com.umitunal.bloom.config.BloomFilterConfig;
import com.umitunal.bloom.hash.HashSeeds;
import com.umitunal.bloom.hash.ItemEncoder;
import com.umitunal.bloom.hash.ItemEncoders;
import com.umitunal.bloom.hash.SeededHasher;
import com.umitunal.bloom.hash.SeededHasherFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.BitSet;
import java.util.Objects;

/**
 * Bloom filter implementation for efficient negative lookups.
 * A Bloom filter is a space-efficient probabilistic data structure that is used to test
 * whether an element is a member of a set. False positives are possible, but false negatives are not.
 *
 * <p>Every operation hashes the item twice, once under each of two independently seeded hashers,
 * and derives all probe positions from those two values with {@link DoubleHashing}.
 * The bit array length and the number of probe rounds are fixed at construction.</p>
 *
 * <p>This class is not thread-safe. Concurrent inserts may lose bits and a concurrent
 * insert and lookup may observe a partial update; callers must synchronize externally.</p>
 *
 * @param <T> the type of items tracked by the filter
 */
public class BloomFilter<T> implements MembershipFilter<T> {
    private static final Logger logger = LoggerFactory.getLogger(BloomFilter.class);

    private final BitSet bits;
    private final int numBits;
    private final int numHashFunctions;
    private final HashSeeds seeds;
    private final SeededHasher hasher1;
    private final SeededHasher hasher2;
    private final ItemEncoder<T> encoder;

    /**
     * Creates a new Bloom filter with the specified expected number of entries and false positive rate.
     * Hash seeds are drawn at random.
     *
     * @param encoder converts items to the bytes that get hashed
     * @param expectedItemCount the expected number of entries
     * @param falsePositiveRate the desired false positive rate (e.g., 0.01 for 1%)
     * @throws com.umitunal.bloom.exception.InvalidParameterException if either parameter is out of range
     */
    public BloomFilter(ItemEncoder<T> encoder, int expectedItemCount, double falsePositiveRate) {
        this(encoder, new BloomFilterConfig(expectedItemCount, falsePositiveRate));
    }

    /**
     * Creates a new Bloom filter from a configuration. Hash seeds are drawn at random.
     *
     * @param encoder converts items to the bytes that get hashed
     * @param config the sizing configuration
     */
    public BloomFilter(ItemEncoder<T> encoder, BloomFilterConfig config) {
        this(encoder, config, SeededHasherFactory.murmur3(), HashSeeds.random());
    }

    /**
     * Creates a new Bloom filter with an explicit hash algorithm and seeds.
     *
     * @param encoder converts items to the bytes that get hashed
     * @param config the sizing configuration
     * @param hasherFactory builds the two base hashers
     * @param seeds the seeds of the two base hashers
     */
    public BloomFilter(ItemEncoder<T> encoder, BloomFilterConfig config,
                       SeededHasherFactory hasherFactory, HashSeeds seeds) {
        this.encoder = Objects.requireNonNull(encoder, "encoder must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(hasherFactory, "hasherFactory must not be null");
        this.seeds = Objects.requireNonNull(seeds, "seeds must not be null");

        this.numBits = BloomFilterSizing.optimalNumOfBits(config.expectedItemCount(), config.falsePositiveRate());
        this.numHashFunctions = BloomFilterSizing.optimalNumOfHashFunctions(config.falsePositiveRate());
        this.hasher1 = hasherFactory.create(seeds.first());
        this.hasher2 = hasherFactory.create(seeds.second());
        this.bits = new BitSet(numBits);

        logger.debug("Created Bloom filter for {} items at rate {}: {} bits, {} hash functions",
            config.expectedItemCount(), config.falsePositiveRate(), numBits, numHashFunctions);
    }

    /**
     * Creates a Bloom filter for strings, hashed as UTF-8.
     *
     * @param expectedItemCount the expected number of entries
     * @param falsePositiveRate the desired false positive rate
     * @return the filter
     */
    public static BloomFilter<String> forStrings(int expectedItemCount, double falsePositiveRate) {
        return new BloomFilter<>(ItemEncoders.strings(), expectedItemCount, falsePositiveRate);
    }

    /**
     * Creates a Bloom filter for integers.
     *
     * @param expectedItemCount the expected number of entries
     * @param falsePositiveRate the desired false positive rate
     * @return the filter
     */
    public static BloomFilter<Integer> forIntegers(int expectedItemCount, double falsePositiveRate) {
        return new BloomFilter<>(ItemEncoders.integers(), expectedItemCount, falsePositiveRate);
    }

    /**
     * Creates a Bloom filter for longs.
     *
     * @param expectedItemCount the expected number of entries
     * @param falsePositiveRate the desired false positive rate
     * @return the filter
     */
    public static BloomFilter<Long> forLongs(int expectedItemCount, double falsePositiveRate) {
        return new BloomFilter<>(ItemEncoders.longs(), expectedItemCount, falsePositiveRate);
    }

    /**
     * Creates a Bloom filter for raw byte keys.
     *
     * @param expectedItemCount the expected number of entries
     * @param falsePositiveRate the desired false positive rate
     * @return the filter
     */
    public static BloomFilter<byte[]> forBytes(int expectedItemCount, double falsePositiveRate) {
        return new BloomFilter<>(ItemEncoders.bytes(), expectedItemCount, falsePositiveRate);
    }

    /**
     * Adds an item to the Bloom filter. Null items are ignored.
     *
     * @param item the item to add
     */
    @Override
    public void insert(T item) {
        if (item == null) {
            return;
        }

        byte[] data = encoder.encode(item);
        long h1 = hasher1.hash(data);
        long h2 = hasher2.hash(data);

        for (int i = 0; i < numHashFunctions; i++) {
            bits.set(DoubleHashing.index(h1, h2, i, numBits));
        }
    }

    /**
     * Checks if an item might be in the set.
     *
     * @param item the item to check
     * @return true if the item might be in the set, false if it definitely isn't or is null
     */
    @Override
    public boolean contains(T item) {
        if (item == null) {
            return false;
        }

        byte[] data = encoder.encode(item);
        long h1 = hasher1.hash(data);
        long h2 = hasher2.hash(data);

        for (int i = 0; i < numHashFunctions; i++) {
            if (!bits.get(DoubleHashing.index(h1, h2, i, numBits))) {
                return false; // Definitely not in the set
            }
        }

        return true; // Might be in the set
    }

    @Override
    public void clear() {
        bits.clear();
        logger.debug("Cleared Bloom filter of {} bits", numBits);
    }

    @Override
    public int size() {
        return numBits;
    }

    @Override
    public boolean isEmpty() {
        return bits.isEmpty();
    }

    @Override
    public int hashCount() {
        return numHashFunctions;
    }

    @Override
    public int cardinality() {
        return bits.cardinality();
    }

    /**
     * Estimates the probability that a lookup of a never-inserted item returns true,
     * given the bits set so far: {@code (setBits / m)^k}.
     *
     * @return the current false positive rate estimate
     */
    public double expectedFalsePositiveRate() {
        double fill = (double) bits.cardinality() / numBits;
        if (fill <= 0) return 0.0;
        if (fill >= 1) return 1.0;
        return Math.pow(fill, numHashFunctions);
    }

    /**
     * Estimates the number of distinct items inserted so far: {@code -(m / k) * ln(1 - setBits / m)}.
     *
     * @return the estimate, or {@link Long#MAX_VALUE} if every bit is set
     */
    public long approximateItemCount() {
        double fill = (double) bits.cardinality() / numBits;
        if (fill <= 0) return 0;
        if (fill >= 1) return Long.MAX_VALUE;
        return Math.round(-((double) numBits / numHashFunctions) * Math.log(1.0 - fill));
    }

    /**
     * Returns a copy of the bit array. Together with {@link #size()}, {@link #hashCount()} and
     * {@link #seeds()} it is everything needed to rebuild an equivalent filter.
     *
     * @return a copy of the bits
     */
    public BitSet toBitSet() {
        return (BitSet) bits.clone();
    }

    /**
     * Gets the seeds of the two base hashers.
     *
     * @return the seeds
     */
    public HashSeeds seeds() {
        return seeds;
    }

    @Override
    public String toString() {
        return String.format("BloomFilter[m=%d, k=%d, set=%d]", numBits, numHashFunctions, bits.cardinality());
    }
}
