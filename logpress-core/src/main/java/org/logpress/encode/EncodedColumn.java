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

package org.logpress.encode;

import java.util.Arrays;
import java.util.Objects;

/** 一个编码后的列,不可变。{@code payload} 的开头总是例外列表。 */
public final class EncodedColumn {

    private final ColumnCodec codec;
    private final byte[] payload;
    private final int valueCount;

    public EncodedColumn(ColumnCodec codec, byte[] payload, int valueCount) {
        this.codec = codec;
        this.payload = payload;
        this.valueCount = valueCount;
    }

    public ColumnCodec codec() {
        return codec;
    }

    public byte[] payload() {
        return payload;
    }

    public int valueCount() {
        return valueCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        EncodedColumn that = (EncodedColumn) o;
        return valueCount == that.valueCount
                && codec == that.codec
                && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(codec, valueCount) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "EncodedColumn{"
                + codec
                + ", "
                + valueCount
                + " values, "
                + payload.length
                + " bytes}";
    }
}
