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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link ListKeyIndexer} that answers queries from primitive arrays rebuilt lazily from the lists.
 * <p>
 * Every add marks the cache {@link CacheState#DIRTY}. The next query rebuilds the arrays from the
 * full lists, marks the cache {@link CacheState#CLEAN}, and gathers the requested rows; later
 * queries reuse the arrays until the next add. Writes stay O(1) amortized, the first query after a
 * write pays O(n), and the rest pay O(k).
 * <p>
 * The arrays are derived state. They are never written to a snapshot and a loaded indexer starts dirty.
 */
public class CachedListKeyIndexer extends ListKeyIndexer {
    private static final Logger LOG = Logger.getLogger(CachedListKeyIndexer.class.getName());

    /**
     * Whether the cached arrays reflect every added chunk.
     */
    public enum CacheState {
        /** the arrays may be reused as is */
        CLEAN,
        /** the arrays must be rebuilt before the next read */
        DIRTY
    }

    private CacheState cacheState = CacheState.DIRTY;
    // docId and offset interleaved, two ints per chunk
    private int[] cachedKeys;
    private float[] cachedWeights;
    private int rebuildCount;

    public CachedListKeyIndexer() {
    }

    @Override
    public int add(List<ChunkKey> keys, float[] weights) {
        int size = super.add(keys, weights);
        cacheState = CacheState.DIRTY;
        return size;
    }

    @Override
    public List<KeyRecord> query(int[] keys) {
        if (cacheState == CacheState.DIRTY || cachedKeys == null) {
            rebuildCache();
        }
        int size = cachedWeights.length;
        for (int key : keys) {
            Objects.checkIndex(key, size);
        }

        var result = new ArrayList<KeyRecord>(keys.length);
        for (int key : keys) {
            result.add(new KeyRecord(cachedKeys[2 * key], cachedKeys[2 * key + 1], cachedWeights[key]));
        }
        return result;
    }

    private void rebuildCache() {
        int size = this.keys.size();
        var newKeys = new int[2 * size];
        var newWeights = new float[size];
        for (int i = 0; i < size; i++) {
            var chunk = this.keys.get(i);
            newKeys[2 * i] = chunk.docId;
            newKeys[2 * i + 1] = chunk.offset;
            newWeights[i] = this.weights.get(i);
        }
        cachedKeys = newKeys;
        cachedWeights = newWeights;
        cacheState = CacheState.CLEAN;
        rebuildCount++;
        LOG.log(Level.FINE, "Rebuilt query cache over {0} chunks", size);
    }

    /**
     * @return the current state of the query cache
     */
    public CacheState cacheState() {
        return cacheState;
    }

    /**
     * @return how many times the query cache has been rebuilt
     */
    public int cacheRebuildCount() {
        return rebuildCount;
    }

    @Override
    public KeyIndexerType type() {
        return KeyIndexerType.CACHED_LIST;
    }

    @Override
    public long ramBytesUsed() {
        long cacheBytes = cachedKeys == null ? 0 : (long) cachedKeys.length * Integer.BYTES + (long) cachedWeights.length * Float.BYTES;
        return super.ramBytesUsed() + cacheBytes;
    }

    /**
     * Reads an indexer written by {@link #write}. The cache is rebuilt by the first query.
     */
    public static CachedListKeyIndexer load(DataInput in) throws IOException {
        readHeader(in, KeyIndexerType.CACHED_LIST);
        var indexer = new CachedListKeyIndexer();
        indexer.readPayload(in);
        return indexer;
    }
}
