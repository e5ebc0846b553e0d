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

package com.umitunal.bloom.exception;

/**
 * Thrown when a Bloom filter is constructed with parameters that cannot describe a valid filter:
 * a non-positive expected item count, a false positive rate outside the open interval (0, 1),
 * or a combination whose bit array would be too large to address.
 *
 * <p>Raised before any allocation takes place, so a failed construction leaves nothing behind.</p>
 */
public class InvalidParameterException extends IllegalArgumentException {

    /**
     * Creates a new InvalidParameterException.
     *
     * @param message description of the offending parameter
     */
    public InvalidParameterException(String message) {
        super(message);
    }
}
