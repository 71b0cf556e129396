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
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A KeyIndexer that writes chunks straight into a preallocated columnar buffer.
 * The key of a chunk is its row.
 * <p>
 * The buffer is a row-major {@code double[]} of {@link #capacity()} rows by {@link #columns()}
 * columns. Column 0 holds the document id and the last column holds the weight. With three or more
 * columns, column 1 holds the offset and any columns between the offset and the weight are
 * reserved and stay zero. With two columns there is nowhere to put an offset, so batches carrying a
 * non-zero offset are rejected and queries report offset 0. Rows from {@link #size()} up to the
 * capacity are zero and are never read.
 * <p>
 * When a batch does not fit, the buffer grows by {@code max(batchLength, growthChunk)} rows: a new
 * buffer is allocated, the old rows are copied into its prefix, and the new rows are left zero.
 * The floor is fixed rather than proportional to the current capacity. Inserts stay amortized
 * O(1) while batches are small next to the growth chunk; a stream of batches at least as large
 * as the growth chunk forces a copy on nearly every add, and total copy work approaches O(n^2).
 * <p>
 * The buffer is never handed out. Queries and {@link #copyRows} return copies.
 */
public class ColumnarKeyIndexer extends AbstractKeyIndexer {
    private static final Logger LOG = Logger.getLogger(ColumnarKeyIndexer.class.getName());

    /** Growth chunk used when neither the builder nor {@code jkeyindex.growth_chunk} sets one */
    public static final int DEFAULT_GROWTH_CHUNK = 10000;
    /** System property overriding {@link #DEFAULT_GROWTH_CHUNK} */
    public static final String GROWTH_CHUNK_PROPERTY = "jkeyindex.growth_chunk";
    /** Column count used when the builder does not set one: doc id, offset, weight */
    public static final int DEFAULT_COLUMNS = 3;
    // largest array the JVM will reliably allocate
    private static final int MAX_BUFFER_LENGTH = Integer.MAX_VALUE - 8;

    private final int columns;
    private final int growthChunk;
    private double[] buffer;
    private int capacity;
    private int size;
    private int reallocationCount;

    private ColumnarKeyIndexer(int initialCapacity, int growthChunk, int columns) {
        this.columns = columns;
        this.growthChunk = growthChunk;
        this.capacity = initialCapacity;
        this.buffer = new double[checkedLength(initialCapacity, columns)];
    }

    /**
     * Creates an indexer with the default column layout, growth chunk, and initial capacity.
     */
    public ColumnarKeyIndexer() {
        this(defaultGrowthChunk(), defaultGrowthChunk(), DEFAULT_COLUMNS);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws IllegalArgumentException if {@value #GROWTH_CHUNK_PROPERTY} is set to a value below 1
     */
    static int defaultGrowthChunk() {
        int growthChunk = Integer.getInteger(GROWTH_CHUNK_PROPERTY, DEFAULT_GROWTH_CHUNK);
        return checkGrowthChunk(growthChunk, GROWTH_CHUNK_PROPERTY);
    }

    private static int checkGrowthChunk(int growthChunk, String source) {
        if (growthChunk < 1) {
            throw new IllegalArgumentException(source + " must be positive, got " + growthChunk);
        }
        return growthChunk;
    }

    @Override
    public int add(List<ChunkKey> keys, float[] weights) {
        checkBatch(keys, weights);
        if (columns == 2) {
            for (ChunkKey key : keys) {
                if (key.offset != 0) {
                    throw new IllegalArgumentException("A two-column buffer cannot store offset " + key.offset
                                                       + " of document " + key.docId);
                }
            }
        }

        int n = keys.size();
        if ((long) size + n > capacity) {
            grow(n);
        }

        int weightColumn = columns - 1;
        for (int i = 0; i < n; i++) {
            var key = keys.get(i);
            int base = (size + i) * columns;
            buffer[base] = key.docId;
            if (columns > 2) {
                buffer[base + 1] = key.offset;
            }
            buffer[base + weightColumn] = weights[i];
        }
        size += n;
        updateCounter(keys);
        return size;
    }

    private void grow(int batchLength) {
        int extend = Math.max(batchLength, growthChunk);
        long newCapacity = (long) capacity + extend;
        if (newCapacity > Integer.MAX_VALUE) {
            throw new IllegalStateException("Cannot grow buffer beyond " + Integer.MAX_VALUE + " rows");
        }
        var newBuffer = new double[checkedLength((int) newCapacity, columns)];
        System.arraycopy(buffer, 0, newBuffer, 0, capacity * columns);
        buffer = newBuffer;
        capacity = (int) newCapacity;
        reallocationCount++;
        LOG.log(Level.FINE, "Grew columnar buffer by {0} rows to {1} rows", new Object[] {extend, capacity});
    }

    private static int checkedLength(int rows, int columns) {
        long length = (long) rows * columns;
        if (length > MAX_BUFFER_LENGTH) {
            throw new IllegalStateException(String.format("%d rows of %d columns exceed the maximum buffer length", rows, columns));
        }
        return (int) length;
    }

    @Override
    public List<KeyRecord> query(int[] keys) {
        for (int key : keys) {
            Objects.checkIndex(key, size);
        }

        int weightColumn = columns - 1;
        var result = new ArrayList<KeyRecord>(keys.length);
        for (int key : keys) {
            int base = key * columns;
            int offset = columns > 2 ? (int) buffer[base + 1] : 0;
            result.add(new KeyRecord((int) buffer[base], offset, (float) buffer[base + weightColumn]));
        }
        return result;
    }

    /**
     * Copies the rows for keys {@code fromKey} (inclusive) to {@code toKey} (exclusive).
     *
     * @return a row-major array of {@code (toKey - fromKey) * columns()} values
     */
    public double[] copyRows(int fromKey, int toKey) {
        Objects.checkFromToIndex(fromKey, toKey, size);
        return Arrays.copyOfRange(buffer, fromKey * columns, toKey * columns);
    }

    /**
     * @return the number of rows currently allocated; never decreases
     */
    public int capacity() {
        return capacity;
    }

    /**
     * @return the number of rows holding chunks; equal to {@link #chunkCount()}
     */
    public int size() {
        return size;
    }

    public int columns() {
        return columns;
    }

    public int growthChunk() {
        return growthChunk;
    }

    /**
     * @return how many times the buffer has been reallocated to grow
     */
    public int reallocationCount() {
        return reallocationCount;
    }

    @Override
    public KeyIndexerType type() {
        return KeyIndexerType.COLUMNAR;
    }

    @Override
    public long ramBytesUsed() {
        return (long) buffer.length * Double.BYTES + documentIdsBytesUsed();
    }

    @Override
    public void write(DataOutput out) throws IOException {
        writeHeader(out);
        out.writeInt(columns);
        out.writeInt(growthChunk);
        out.writeInt(capacity);
        out.writeInt(size);
        for (int i = 0; i < size * columns; i++) {
            out.writeDouble(buffer[i]);
        }
    }

    /**
     * Reads an indexer written by {@link #write}. Capacity, growth chunk, and layout are restored as written.
     */
    public static ColumnarKeyIndexer load(DataInput in) throws IOException {
        readHeader(in, KeyIndexerType.COLUMNAR);
        return loadPayload(in);
    }

    static ColumnarKeyIndexer loadPayload(DataInput in) throws IOException {
        int columns = in.readInt();
        int growthChunk = in.readInt();
        int capacity = in.readInt();
        int size = in.readInt();
        if (size < 0 || size > capacity) {
            throw new IllegalArgumentException(String.format("Invalid snapshot: size %d, capacity %d", size, capacity));
        }

        var indexer = builder().withColumns(columns).withGrowthChunk(growthChunk).withInitialCapacity(capacity).build();
        for (int i = 0; i < size * columns; i++) {
            indexer.buffer[i] = in.readDouble();
        }
        for (int row = 0; row < size; row++) {
            indexer.documentIds.add((int) indexer.buffer[row * columns]);
        }
        indexer.size = size;
        indexer.chunkCount = size;
        return indexer;
    }

    /**
     * Configures a {@link ColumnarKeyIndexer}. Unset values fall back to the defaults; the initial
     * capacity defaults to the growth chunk.
     */
    public static class Builder {
        private int columns = DEFAULT_COLUMNS;
        private int growthChunk = -1;
        private int initialCapacity = -1;

        private Builder() {
        }

        /**
         * @param columns values per row, at least 2: doc id and weight, plus offset from 3 on
         */
        public Builder withColumns(int columns) {
            if (columns < 2) {
                throw new IllegalArgumentException("columns must be at least 2, got " + columns);
            }
            this.columns = columns;
            return this;
        }

        /**
         * @param growthChunk the minimum number of rows added when the buffer grows
         */
        public Builder withGrowthChunk(int growthChunk) {
            this.growthChunk = checkGrowthChunk(growthChunk, "growthChunk");
            return this;
        }

        /**
         * @param initialCapacity rows to preallocate, may be zero
         */
        public Builder withInitialCapacity(int initialCapacity) {
            if (initialCapacity < 0) {
                throw new IllegalArgumentException("initialCapacity must not be negative, got " + initialCapacity);
            }
            this.initialCapacity = initialCapacity;
            return this;
        }

        public ColumnarKeyIndexer build() {
            int chunk = growthChunk < 0 ? defaultGrowthChunk() : growthChunk;
            int capacity = initialCapacity < 0 ? chunk : initialCapacity;
            return new ColumnarKeyIndexer(capacity, chunk, columns);
        }
    }
}
