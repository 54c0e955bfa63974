/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.logpress.utils;

import java.util.Arrays;

/**
 * 基于原始 int 数组的可增长列表。
 *
 * <p>编码器用它收集字典下标、词元池下标和行号等整数流。
 */
public class IntArrayList {

    private int size;

    private int[] array;

    public IntArrayList(final int capacity) {
        this.size = 0;
        this.array = new int[capacity];
    }

    public int size() {
        return size;
    }

    public boolean add(final int number) {
        grow(size + 1);
        array[size++] = number;
        return true;
    }

    public void clear() {
        size = 0;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    private void grow(final int length) {
        if (length > array.length) {
            final int newLength =
                    (int) Math.max(Math.min(2L * array.length, Integer.MAX_VALUE - 8), length);
            final int[] t = new int[newLength];
            System.arraycopy(array, 0, t, 0, size);
            array = t;
        }
    }

    public int[] toArray() {
        return Arrays.copyOf(array, size);
    }

    public int get(int i) {
        if (i >= size) {
            throw new IndexOutOfBoundsException("Index: " + i + ", Size: " + size);
        }
        return array[i];
    }
}
