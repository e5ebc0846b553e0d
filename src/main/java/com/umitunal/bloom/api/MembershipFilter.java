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

package com.umitunal.bloom.api;

/**
 * Interface for approximate set-membership structures.
 * Answers "possibly a member" or "definitely not a member"; false positives are
 * possible, false negatives are not.
 *
 * <p>Implementations are not thread-safe. Callers sharing an instance between threads
 * must synchronize externally.</p>
 *
 * @param <T> the type of items tracked by the filter
 */
public interface MembershipFilter<T> {

    /**
     * Records an item in the filter.
     *
     * @param item the item to insert
     */
    void insert(T item);

    /**
     * Checks if an item might have been inserted.
     *
     * @param item the item to check
     * @return true if the item might be in the set, false if it definitely isn't
     */
    boolean contains(T item);

    /**
     * Forgets every inserted item. Sizing and hashing parameters are retained.
     */
    void clear();

    /**
     * Gets the length of the underlying bit array.
     *
     * @return the number of bits in the filter
     */
    int size();

    /**
     * Checks whether no bit is currently set.
     *
     * @return true if the filter is empty
     */
    boolean isEmpty();

    /**
     * Gets the number of probe rounds performed per insert or lookup.
     *
     * @return the number of hash rounds
     */
    int hashCount();

    /**
     * Gets the number of bits currently set.
     *
     * @return the count of set bits
     */
    int cardinality();
}
