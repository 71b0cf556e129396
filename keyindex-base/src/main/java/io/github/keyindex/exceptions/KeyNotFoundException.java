/*
 * Copyright DataStax, Inc.
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

package io.github.keyindex.exceptions;

import java.util.NoSuchElementException;

/**
 * Thrown by the hash map indexer when a queried key was never added.
 */
public class KeyNotFoundException extends NoSuchElementException {
    private static final long serialVersionUID = 1L;

    private final int key;

    public KeyNotFoundException(int key) {
        super("Key " + key + " was never added to this indexer");
        this.key = key;
    }

    /**
     * @return the first key of the query that could not be resolved
     */
    public int getKey() {
        return key;
    }
}
