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
 * A record returned by {@link KeyIndexer#query}: a chunk identity together with its relevance weight.
 * Records are immutable once written and are identified solely by the key they were assigned.
 */
public final class KeyRecord {
    // object header + three 4-byte fields, padded
    static final long RAM_BYTES = 32;

    /** The id of the document containing the chunk */
    public final int docId;
    /** The position of the chunk within its document */
    public final int offset;
    /** The relevance weight supplied when the chunk was added */
    public final float weight;

    public KeyRecord(int docId, int offset, float weight) {
        this.docId = docId;
        this.offset = offset;
        this.weight = weight;
    }

    @Override
    public String toString() {
        return String.format("KeyRecord(%d, %d, %s)", docId, offset, weight);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        KeyRecord that = (KeyRecord) o;
        return docId == that.docId && offset == that.offset && Float.compare(weight, that.weight) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(docId, offset, weight);
    }
}
