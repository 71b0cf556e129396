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

import java.util.Objects;

/**
 * The identity of one indexed chunk: the document it belongs to and its offset within that document.
 * This is what a writer hands to {@link KeyIndexer#add}; the weight travels alongside in a parallel array.
 */
public final class ChunkKey {
    /** The id of the document containing the chunk */
    public final int docId;
    /** The position of the chunk within its document */
    public final int offset;

    public ChunkKey(int docId, int offset) {
        this.docId = docId;
        this.offset = offset;
    }

    @Override
    public String toString() {
        return String.format("ChunkKey(%d, %d)", docId, offset);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        ChunkKey that = (ChunkKey) o;
        return docId == that.docId && offset == that.offset;
    }

    @Override
    public int hashCode() {
        return Objects.hash(docId, offset);
    }
}
