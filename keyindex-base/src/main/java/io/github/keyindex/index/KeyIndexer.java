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

import io.github.keyindex.exceptions.DivisionUndefinedException;
import io.github.keyindex.exceptions.KeyNotFoundException;
import io.github.keyindex.exceptions.LengthMismatchException;
import io.github.keyindex.util.Accountable;

import java.io.DataOutput;
import java.io.IOException;
import java.util.List;

/**
 * Assigns integer keys to batches of chunks and looks the chunks up again by key.
 * <p>
 * Positional implementations assign the i-th chunk ever added the key i; {@link HashKeyIndexer}
 * instead keys each chunk by its document id. Every implementation keeps the same running
 * statistics: chunks added, distinct documents, and the average number of chunks per document.
 * <p>
 * Implementations are not threadsafe. A single writer calls {@link #add}; readers may call
 * {@link #query} once the writer's call has returned. Callers with several producers must
 * serialize their writes.
 */
public interface KeyIndexer extends Accountable {
    /**
     * Adds a batch of chunks. {@code weights[i]} is the weight of {@code keys.get(i)}.
     *
     * @param keys the chunk identities, in key-assignment order
     * @param weights the weight of each chunk
     * @return the number of records held by the indexer after the batch
     * @throws LengthMismatchException if the implementation checks lengths and they differ;
     *         the indexer is unchanged in that case
     */
    int add(List<ChunkKey> keys, float[] weights);

    /**
     * Looks up records by key.
     *
     * @param keys previously assigned keys, in any order and possibly repeated
     * @return one record per key, in the order of {@code keys}
     * @throws KeyNotFoundException if a hash map key was never added
     * @throws IndexOutOfBoundsException if a positional key was never assigned
     */
    List<KeyRecord> query(int[] keys);

    /**
     * @return the number of chunks added so far; never decreases
     */
    int chunkCount();

    /**
     * @return the number of distinct documents seen so far
     */
    int documentCount();

    /**
     * @return {@code chunkCount() / documentCount()}
     * @throws DivisionUndefinedException if no document has been seen yet
     */
    default double averageChunksPerDocument() {
        int documents = documentCount();
        if (documents == 0) {
            throw new DivisionUndefinedException("Average chunks per document is undefined for an empty indexer");
        }
        return (double) chunkCount() / documents;
    }

    /**
     * @return the backend this indexer implements
     */
    KeyIndexerType type();

    /**
     * Writes a snapshot of the indexer's authoritative state. Derived state such as caches is
     * not written. {@link KeyIndexers#load} reads the snapshot back.
     *
     * @param out the DataOutput into which to write the snapshot
     * @throws IOException if there is a problem writing to out
     */
    void write(DataOutput out) throws IOException;
}
