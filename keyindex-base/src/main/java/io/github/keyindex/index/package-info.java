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
/**
 * Key-record indexers: structures that assign integer keys to batches of
 * (document id, offset, weight) chunks and look them up again by key.
 *
 * <p>All backends implement {@link io.github.keyindex.index.KeyIndexer} and differ only in
 * representation and cost:
 *
 * <ul>
 *   <li>{@link io.github.keyindex.index.HashKeyIndexer} keys chunks by document id, last write wins.
 *   <li>{@link io.github.keyindex.index.ListKeyIndexer} appends to two parallel lists; a key is a
 *       list position.
 *   <li>{@link io.github.keyindex.index.CachedListKeyIndexer} adds a primitive-array cache that is
 *       rebuilt on the first query after a write.
 *   <li>{@link io.github.keyindex.index.ColumnarKeyIndexer} writes straight into a growable
 *       columnar buffer and needs no cache.
 * </ul>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * KeyIndexer indexer = KeyIndexers.create(KeyIndexerType.COLUMNAR);
 * indexer.add(List.of(new ChunkKey(0, 0), new ChunkKey(0, 1), new ChunkKey(1, 0)),
 *             new float[] {0.5f, 0.4f, 0.9f});                   // returns 3
 * List<KeyRecord> records = indexer.query(new int[] {0, 2});     // (0, 0, 0.5), (1, 0, 0.9)
 * double avg = indexer.averageChunksPerDocument();               // 1.5
 * }</pre>
 *
 * <p>None of the indexers is threadsafe; callers provide a single writer.
 */
package io.github.keyindex.index;
