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
import java.io.DataOutput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A KeyIndexer backed by two append-only lists kept in lock step, one of chunk keys and one of weights.
 * The key of a chunk is its position in the lists.
 * <p>
 * Queries resolve one key at a time. See {@link CachedListKeyIndexer} for a variant that gathers
 * from primitive arrays instead.
 */
public class ListKeyIndexer extends AbstractKeyIndexer {
    protected final List<ChunkKey> keys = new ArrayList<>();
    protected final List<Float> weights = new ArrayList<>();

    public ListKeyIndexer() {
    }

    @Override
    public int add(List<ChunkKey> keys, float[] weights) {
        checkBatch(keys, weights);
        this.keys.addAll(keys);
        for (float weight : weights) {
            this.weights.add(weight);
        }
        updateCounter(keys);
        return this.keys.size();
    }

    @Override
    public List<KeyRecord> query(int[] keys) {
        var result = new ArrayList<KeyRecord>(keys.length);
        for (int key : keys) {
            Objects.checkIndex(key, this.keys.size());
            var chunk = this.keys.get(key);
            result.add(new KeyRecord(chunk.docId, chunk.offset, weights.get(key)));
        }
        return result;
    }

    /**
     * @return the number of records held; equal to {@link #chunkCount()}
     */
    public int size() {
        return keys.size();
    }

    @Override
    public KeyIndexerType type() {
        return KeyIndexerType.APPEND_LIST;
    }

    @Override
    public long ramBytesUsed() {
        // per entry: two list slots, a ChunkKey and a boxed Float
        long perEntry = 2L * Long.BYTES + 24 + 16;
        return keys.size() * perEntry + documentIdsBytesUsed();
    }

    @Override
    public void write(DataOutput out) throws IOException {
        writeHeader(out);
        out.writeInt(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            var chunk = keys.get(i);
            out.writeInt(chunk.docId);
            out.writeInt(chunk.offset);
            out.writeFloat(weights.get(i));
        }
    }

    /**
     * Reads an indexer written by {@link #write}.
     */
    public static ListKeyIndexer load(DataInput in) throws IOException {
        readHeader(in, KeyIndexerType.APPEND_LIST);
        var indexer = new ListKeyIndexer();
        indexer.readPayload(in);
        return indexer;
    }

    /**
     * Replays a snapshot payload through {@link #add} so that statistics are re-derived.
     */
    void readPayload(DataInput in) throws IOException {
        int count = in.readInt();
        var chunks = new ArrayList<ChunkKey>(count);
        var chunkWeights = new float[count];
        for (int i = 0; i < count; i++) {
            chunks.add(new ChunkKey(in.readInt(), in.readInt()));
            chunkWeights[i] = in.readFloat();
        }
        add(chunks, chunkWeights);
    }
}
