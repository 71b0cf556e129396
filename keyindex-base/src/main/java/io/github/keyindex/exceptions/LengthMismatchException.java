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

package io.github.keyindex.exceptions;

/**
 * Thrown when the keys and weights of a batch passed to {@code add} differ in length.
 * The indexer is left unchanged.
 */
public class LengthMismatchException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final int keyCount;
    private final int weightCount;

    public LengthMismatchException(int keyCount, int weightCount) {
        super(String.format("keys and weights must have the same length, got %d keys and %d weights",
                            keyCount, weightCount));
        this.keyCount = keyCount;
        this.weightCount = weightCount;
    }

    public int getKeyCount() {
        return keyCount;
    }

    public int getWeightCount() {
        return weightCount;
    }
}
