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
 * Converts an item to the canonical byte representation that gets hashed.
 * Equal items must encode to equal bytes.
 *
 * @param <T> the item type
 */
@FunctionalInterface
public interface ItemEncoder<T> {

    /**
     * Encodes an item.
     *
     * @param item the item, never null
     * @return the canonical bytes of the item
     */
    byte[] encode(T item);
}
