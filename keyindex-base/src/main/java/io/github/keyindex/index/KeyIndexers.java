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

import java.io.DataInput;
import java.io.IOException;

/**
 * Entry points for choosing a backend at construction time and for reading snapshots back.
 */
public final class KeyIndexers {
    private KeyIndexers() {
    }

    /**
     * Creates an empty indexer of the given type with default settings.
     */
    public static KeyIndexer create(KeyIndexerType type) {
        switch (type) {
            case HASH_MAP:
                return new HashKeyIndexer();
            case APPEND_LIST:
                return new ListKeyIndexer();
            case CACHED_LIST:
                return new CachedListKeyIndexer();
            case COLUMNAR:
                return new ColumnarKeyIndexer();
            default:
                throw new IllegalArgumentException("Unsupported indexer type " + type);
        }
    }

    /**
     * Reads a snapshot written by {@link KeyIndexer#write} and rebuilds an indexer of the type that wrote it.
     *
     * @throws IllegalArgumentException if the input is not a snapshot or was written by a newer version
     * @throws IOException if the input cannot be read, including when it ends early
     */
    public static KeyIndexer load(DataInput in) throws IOException {
        var type = AbstractKeyIndexer.readHeader(in);
        switch (type) {
            case HASH_MAP:
                return HashKeyIndexer.loadPayload(in);
            case APPEND_LIST: {
                var indexer = new ListKeyIndexer();
                indexer.readPayload(in);
                return indexer;
            }
            case CACHED_LIST: {
                var indexer = new CachedListKeyIndexer();
                indexer.readPayload(in);
                return indexer;
            }
            case COLUMNAR:
                return ColumnarKeyIndexer.loadPayload(in);
            default:
                throw new IllegalArgumentException("Unsupported indexer type " + type);
        }
    }
}
