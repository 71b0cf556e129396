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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public class TestUtil {
    /** the three-chunk, two-document batch used across the backend tests */
    public static final List<ChunkKey> SAMPLE_KEYS = List.of(new ChunkKey(0, 0), new ChunkKey(0, 1), new ChunkKey(1, 0));
    public static final float[] SAMPLE_WEIGHTS = {0.5f, 0.4f, 0.9f};

    public static List<ChunkKey> randomKeys(Random random, int count, int maxDocId) {
        var keys = new ArrayList<ChunkKey>(count);
        for (int i = 0; i < count; i++) {
            keys.add(new ChunkKey(random.nextInt(maxDocId), random.nextInt(1000)));
        }
        return keys;
    }

    public static float[] randomWeights(Random random, int count) {
        var weights = new float[count];
        for (int i = 0; i < count; i++) {
            weights[i] = random.nextFloat();
        }
        return weights;
    }

    public static int[] range(int from, int to) {
        var keys = new int[to - from];
        for (int i = 0; i < keys.length; i++) {
            keys[i] = from + i;
        }
        return keys;
    }

    public static List<KeyRecord> records(List<ChunkKey> keys, float[] weights) {
        var records = new ArrayList<KeyRecord>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            records.add(new KeyRecord(keys.get(i).docId, keys.get(i).offset, weights[i]));
        }
        return records;
    }
}
