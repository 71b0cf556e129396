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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.Arrays;

import static io.github.keyindex.index.TestUtil.randomKeys;
import static io.github.keyindex.index.TestUtil.randomWeights;
import static io.github.keyindex.index.TestUtil.range;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestKeyIndexerSnapshots extends RandomizedTest {
    private static byte[] snapshot(KeyIndexer indexer) throws IOException {
        var bytes = new ByteArrayOutputStream();
        try (var out = new DataOutputStream(bytes)) {
            indexer.write(out);
        }
        return bytes.toByteArray();
    }

    private static DataInputStream input(byte[] bytes) {
        return new DataInputStream(new ByteArrayInputStream(bytes));
    }

    private void fill(KeyIndexer indexer) {
        for (int b = 0; b < 5; b++) {
            int batchSize = randomIntBetween(1, 30);
            indexer.add(randomKeys(getRandom(), batchSize, 20), randomWeights(getRandom(), batchSize));
        }
    }

    private static int[] assignedKeys(KeyIndexer indexer) {
        if (indexer instanceof HashKeyIndexer) {
            // hash map keys are document ids, bounded by the fill above
            return Arrays.stream(range(0, 20)).filter(((HashKeyIndexer) indexer)::containsKey).toArray();
        }
        return range(0, indexer.chunkCount());
    }

    @Test
    public void testEveryBackendRoundTrips() throws IOException {
        for (var type : KeyIndexerType.values()) {
            var original = KeyIndexers.create(type);
            fill(original);

            var loaded = KeyIndexers.load(input(snapshot(original)));
            assertEquals(type, loaded.type());
            assertEquals(original.chunkCount(), loaded.chunkCount());
            assertEquals(original.documentCount(), loaded.documentCount());
            var keys = assignedKeys(original);
            assertEquals(type.toString(), original.query(keys), loaded.query(keys));
        }
    }

    @Test
    public void testColumnarLayoutIsRestored() throws IOException {
        var original = ColumnarKeyIndexer.builder().withColumns(4).withInitialCapacity(3).withGrowthChunk(7).build();
        fill(original);

        var loaded = ColumnarKeyIndexer.load(input(snapshot(original)));
        assertEquals(original.capacity(), loaded.capacity());
        assertEquals(original.size(), loaded.size());
        assertEquals(4, loaded.columns());
        assertEquals(7, loaded.growthChunk());

        // the loaded indexer keeps appending where the original left off
        int start = loaded.size();
        var keys = randomKeys(getRandom(), 10, 5);
        var weights = randomWeights(getRandom(), 10);
        loaded.add(keys, weights);
        assertEquals(TestUtil.records(keys, weights), loaded.query(range(start, start + 10)));
    }

    @Test
    public void testCacheIsNotSnapshotted() throws IOException {
        var cached = new CachedListKeyIndexer();
        var plain = new ListKeyIndexer();
        var keys = randomKeys(getRandom(), 25, 10);
        var weights = randomWeights(getRandom(), 25);
        cached.add(keys, weights);
        plain.add(keys, weights);
        cached.query(range(0, 25));

        var cachedBytes = snapshot(cached);
        var plainBytes = snapshot(plain);
        // identical apart from the type ordinal in the header
        assertEquals(plainBytes.length, cachedBytes.length);
        assertTrue(Arrays.equals(plainBytes, 12, plainBytes.length, cachedBytes, 12, cachedBytes.length));

        var loaded = CachedListKeyIndexer.load(input(cachedBytes));
        assertEquals(CachedListKeyIndexer.CacheState.DIRTY, loaded.cacheState());
        assertEquals(plain.query(range(0, 25)), loaded.query(range(0, 25)));
        assertEquals(1, loaded.cacheRebuildCount());
    }

    @Test
    public void testTypedLoadRejectsOtherBackend() throws IOException {
        var bytes = snapshot(KeyIndexers.create(KeyIndexerType.APPEND_LIST));
        try {
            HashKeyIndexer.load(input(bytes));
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testBadMagic() throws IOException {
        var bytes = snapshot(new ListKeyIndexer());
        bytes[0] ^= 0x7F;
        try {
            KeyIndexers.load(input(bytes));
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("magic"));
        }
    }

    @Test
    public void testNewerVersion() throws IOException {
        var bytes = snapshot(new ListKeyIndexer());
        // version is the second int, big-endian
        bytes[7] = (byte) (AbstractKeyIndexer.CURRENT_VERSION + 1);
        try {
            KeyIndexers.load(input(bytes));
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("version"));
        }
    }

    @Test(expected = EOFException.class)
    public void testTruncatedSnapshot() throws IOException {
        var indexer = new ColumnarKeyIndexer();
        fill(indexer);
        var bytes = snapshot(indexer);
        KeyIndexers.load(input(Arrays.copyOf(bytes, bytes.length - 3)));
    }
}
