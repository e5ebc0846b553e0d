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

import com.umitunal.bloom.config.BloomFilterConfig;
import com.umitunal.bloom.hash.HashSeeds;
import com.umitunal.bloom.hash.ItemEncoders;
import com.umitunal.bloom.hash.SeededHasher;
import com.umitunal.bloom.hash.SeededHasherFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.BitSet;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Pins the base hashes with mocks to check which bits the filter probes.
 */
@ExtendWith(MockitoExtension.class)
class BloomFilterProbeTest {

    @Mock
    private SeededHasherFactory hasherFactory;

    @Mock
    private SeededHasher hasher1;

    @Mock
    private SeededHasher hasher2;

    private BloomFilter<String> filter;

    @BeforeEach
    void setUp() {
        when(hasherFactory.create(1)).thenReturn(hasher1);
        when(hasherFactory.create(2)).thenReturn(hasher2);

        // 959 bits, 7 hash functions
        filter = new BloomFilter<>(ItemEncoders.strings(), new BloomFilterConfig(100, 0.01),
            hasherFactory, HashSeeds.of(1, 2));
    }

    @Test
    void testInsertSetsDoubleHashingPositions() {
        when(hasher1.hash(any(byte[].class))).thenReturn(5L);
        when(hasher2.hash(any(byte[].class))).thenReturn(3L);

        filter.insert("item");

        BitSet expected = new BitSet();
        for (int i = 0; i < 7; i++) {
            expected.set(5 + 3 * i);
        }
        assertEquals(expected, filter.toBitSet());
        verify(hasher1).hash(any(byte[].class));
        verify(hasher2).hash(any(byte[].class));
    }

    @Test
    void testContainsShortCircuitsOnFirstUnsetBit() {
        when(hasher1.hash(any(byte[].class))).thenReturn(5L);
        when(hasher2.hash(any(byte[].class))).thenReturn(3L);

        assertFalse(filter.contains("item"));
        filter.insert("item");
        assertTrue(filter.contains("item"));
    }

    @Test
    void testSharedPrefixOfProbesIsNotEnough() {
        // Both items start at bit 10 but stride differently
        when(hasher1.hash(any(byte[].class))).thenReturn(10L);
        when(hasher2.hash(any(byte[].class))).thenReturn(1L, 2L);

        filter.insert("first");

        assertFalse(filter.contains("second"));
    }

    @Test
    void testWrappingHashesStayInRange() {
        when(hasher1.hash(any(byte[].class))).thenReturn(-1L);
        when(hasher2.hash(any(byte[].class))).thenReturn(Long.MIN_VALUE + 12345L);

        filter.insert("item");

        BitSet bits = filter.toBitSet();
        assertTrue(bits.cardinality() >= 1);
        assertTrue(bits.length() <= filter.size());
        assertTrue(filter.contains("item"));
    }

    @Test
    void testNullItemIsNotHashed() {
        filter.insert(null);
        assertFalse(filter.contains(null));

        verifyNoInteractions(hasher1, hasher2);
    }

    @Test
    void testHashersAreBuiltFromBothSeeds() {
        verify(hasherFactory).create(1);
        verify(hasherFactory).create(2);
        verifyNoMoreInteractions(hasherFactory);
    }
}
