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

import io.github.keyindex.exceptions.LengthMismatchException;
import org.agrona.collections.IntHashSet;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Running statistics shared by the indexers, and the snapshot header they all write.
 * <p>
 * Subclasses call {@link #updateCounter} once per successfully applied batch.
 */
public abstract class AbstractKeyIndexer implements KeyIndexer {
    static final int MAGIC = 0x4B657949; // "KeyI"
    /** The newest snapshot format this library writes and reads */
    public static final int CURRENT_VERSION = 1;

    protected final IntHashSet documentIds = new IntHashSet();
    protected int chunkCount;

    protected AbstractKeyIndexer() {
    }

    /**
     * Records the chunks of an applied batch in the statistics.
     */
    protected void updateCounter(List<ChunkKey> keys) {
        for (ChunkKey key : keys) {
            documentIds.add(key.docId);
        }
        chunkCount += keys.size();
    }

    @Override
    public int chunkCount() {
        return chunkCount;
    }

    @Override
    public int documentCount() {
        return documentIds.size();
    }

    /**
     * Throws before any mutation if a batch is mis-sized or holds a null key.
     */
    static void checkBatch(List<ChunkKey> keys, float[] weights) {
        if (keys.size() != weights.length) {
            throw new LengthMismatchException(keys.size(), weights.length);
        }
        checkNoNulls(keys, keys.size());
    }

    /**
     * Throws if any of the first {@code count} keys is null.
     */
    static void checkNoNulls(List<ChunkKey> keys, int count) {
        for (int i = 0; i < count; i++) {
            int index = i;
            Objects.requireNonNull(keys.get(i), () -> "Null key at index " + index + " of batch");
        }
    }

    /** bytes held by the document id set */
    protected long documentIdsBytesUsed() {
        return (long) documentIds.capacity() * Integer.BYTES;
    }

    void writeHeader(DataOutput out) throws IOException {
        out.writeInt(MAGIC);
        out.writeInt(CURRENT_VERSION);
        out.writeInt(type().ordinal());
    }

    /**
     * Reads a snapshot header and returns the backend it was written by.
     */
    static KeyIndexerType readHeader(DataInput in) throws IOException {
        int magic = in.readInt();
        if (magic != MAGIC) {
            throw new IllegalArgumentException(String.format("Invalid snapshot magic: 0x%08X", magic));
        }
        int version = in.readInt();
        if (version > CURRENT_VERSION) {
            throw new IllegalArgumentException("Unsupported snapshot version " + version);
        }
        return KeyIndexerType.fromOrdinal(in.readInt());
    }

    static void readHeader(DataInput in, KeyIndexerType expected) throws IOException {
        var actual = readHeader(in);
        if (actual != expected) {
            throw new IllegalArgumentException("Snapshot was written by " + actual + ", expected " + expected);
        }
    }

    @Override
    public String toString() {
        return String.format("%s(chunks=%d, documents=%d)", getClass().getSimpleName(), chunkCount(), documentCount());
    }
}
