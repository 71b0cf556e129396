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
package io.github.keyindex.index;

/**
 * The available indexer backends. The ordinal is written into snapshots, so new entries go at the end.
 */
public enum KeyIndexerType {
    /** {@link HashKeyIndexer}: caller-supplied keys, last write wins */
    HASH_MAP,
    /** {@link ListKeyIndexer}: positional keys over two append-only lists */
    APPEND_LIST,
    /** {@link CachedListKeyIndexer}: append-only lists plus a lazily rebuilt primitive cache */
    CACHED_LIST,
    /** {@link ColumnarKeyIndexer}: positional keys over a growable columnar buffer */
    COLUMNAR;

    static KeyIndexerType fromOrdinal(int ordinal) {
        var values = values();
        if (ordinal < 0 || ordinal >= values.length) {
            throw new IllegalArgumentException("Unknown indexer type " + ordinal);
        }
        return values[ordinal];
    }
}
