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

import io.github.keyindex.exceptions.KeyNotFoundException;
import org.agrona.collections.Int2ObjectHashMap;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * A KeyIndexer backed by a hash map from key to record, where the key of a chunk is its document id.
 * <p>
 * Adding a chunk whose document id is already present replaces the earlier record: last write wins.
 * Collisions are not preserved, so {@link #chunkCount()} and {@link #documentCount()} are both the
 * number of distinct keys currently held. The other backends count distinct document ids across
 * every chunk ever added instead; the two definitions agree only when each document contributes a
 * single chunk.
 * <p>
 * Lengths are not checked. A batch whose keys and weights differ in length is truncated to the
 * shorter of the two.
 * <p>
 * Both statistics are read from the map, so the chunk counter and document id set inherited from
 * {@link AbstractKeyIndexer} stay empty in this class.
 */
public class HashKeyIndexer extends AbstractKeyIndexer {
    private static final Logger LOG = Logger.getLogger(HashKeyIndexer.class.getName());

    private final Int2ObjectHashMap<KeyRecord> records = new Int2ObjectHashMap<>();

    public HashKeyIndexer() {
    }

    @Override
    public int add(List<ChunkKey> keys, float[] weights) {
        int n = Math.min(keys.size(), weights.length);
        if (n != keys.size() || n != weights.length) {
            LOG.warning(String.format("Truncating batch of %d keys and %d weights to %d records",
                                      keys.size(), weights.length, n));
        }
        checkNoNulls(keys, n);
        for (int i = 0; i < n; i++) {
            var key = keys.get(i);
            records.put(key.docId, new KeyRecord(key.docId, key.offset, weights[i]));
        }
        return records.size();
    }

    @Override
    public List<KeyRecord> query(int[] keys) {
        var result = new ArrayList<KeyRecord>(keys.length);
        for (int key : keys) {
            var record = records.get(key);
            if (record == null) {
                throw new KeyNotFoundException(key);
            }
            result.add(record);
        }
        return result;
    }

    @Override
    public int chunkCount() {
        return records.size();
    }

    @Override
    public int documentCount() {
        return records.size();
    }

    /**
     * @return true if a record is held for the given key
     */
    public boolean containsKey(int key) {
        return records.containsKey(key);
    }

    @Override
    public KeyIndexerType type() {
        return KeyIndexerType.HASH_MAP;
    }

    @Override
    public long ramBytesUsed() {
        // key slot + value reference per map slot, plus the records themselves
        return (long) records.capacity() * (Integer.BYTES + Long.BYTES) + records.size() * KeyRecord.RAM_BYTES;
    }

    @Override
    public void write(DataOutput out) throws IOException {
        writeHeader(out);
        out.writeInt(records.size());
        for (var record : records.values()) {
            out.writeInt(record.docId);
            out.writeInt(record.offset);
            out.writeFloat(record.weight);
        }
    }

    /**
     * Reads an indexer written by {@link #write}.
     */
    public static HashKeyIndexer load(DataInput in) throws IOException {
        readHeader(in, KeyIndexerType.HASH_MAP);
        return loadPayload(in);
    }

    static HashKeyIndexer loadPayload(DataInput in) throws IOException {
        var indexer = new HashKeyIndexer();
        int count = in.readInt();
        for (int i = 0; i < count; i++) {
            int key = in.readInt();
            int offset = in.readInt();
            float weight = in.readFloat();
            indexer.records.put(key, new KeyRecord(key, offset, weight));
        }
        return indexer;
    }
}
