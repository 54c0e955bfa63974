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

import org.logpress.io.DataInputDeserializer;
import org.logpress.io.DataOutputSerializer;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link ExceptionList} and {@link TokenPool}. */
public class ExceptionListTest {

    private static byte[] write(ExceptionList exceptions) throws IOException {
        DataOutputSerializer out = new DataOutputSerializer(16);
        exceptions.write(out);
        return out.getCopyOfBuffer();
    }

    @Test
    public void testWriteAndRead() throws IOException {
        ExceptionList exceptions =
                new ExceptionList.Builder().add(2, "N/A").add(5, "").add(9, "-").build();
        ExceptionList read = ExceptionList.read(new DataInputDeserializer(write(exceptions)), 10);

        assertThat(read.size()).isEqualTo(3);
        assertThat(read.row(1)).isEqualTo(5);
        assertThat(read.value(0)).isEqualTo("N/A");
        assertThat(read.value(1)).isEmpty();
        assertThat(read.indexOfRow(9)).isEqualTo(2);
        assertThat(read.containsRow(3)).isFalse();
        assertThat(read.indexOfRow(3)).isNegative();
    }

    @Test
    public void testEmptyBuilderYieldsSharedEmptyList() throws IOException {
        assertThat(new ExceptionList.Builder().build()).isSameAs(ExceptionList.EMPTY);
        assertThat(ExceptionList.read(new DataInputDeserializer(write(ExceptionList.EMPTY)), 0))
                .isSameAs(ExceptionList.EMPTY);
    }

    @Test
    public void testRowsMustAscend() {
        ExceptionList.Builder builder = new ExceptionList.Builder().add(3, "x");
        assertThatThrownBy(() -> builder.add(3, "y")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.add(1, "y")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testRowsOutsideColumnAreRejected() throws IOException {
        byte[] bytes = write(new ExceptionList.Builder().add(2, "a").add(9, "b").build());
        assertThatThrownBy(() -> ExceptionList.read(new DataInputDeserializer(bytes), 9))
                .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> ExceptionList.read(new DataInputDeserializer(bytes), 1))
                .isInstanceOf(IOException.class);
    }

    @Test
    public void testTokenPoolDeduplicates() throws IOException {
        TokenPool pool = new TokenPool();
        assertThat(pool.add("alpha")).isZero();
        assertThat(pool.add("beta")).isEqualTo(1);
        assertThat(pool.add("alpha")).isZero();
        assertThat(pool.indexOf("gamma")).isEqualTo(-1);

        DataOutputSerializer out = new DataOutputSerializer(16);
        pool.write(out);
        TokenPool read = TokenPool.read(new DataInputDeserializer(out.getCopyOfBuffer()));
        assertThat(read.values()).containsExactly("alpha", "beta");
        assertThat(read.indexOf("beta")).isEqualTo(1);
    }

    @Test
    public void testTokenPoolRejectsDuplicates() throws IOException {
        DataOutputSerializer out = new DataOutputSerializer(16);
        out.writeVarInt(2);
        out.writeString("same");
        out.writeString("same");
        assertThatThrownBy(() -> TokenPool.read(new DataInputDeserializer(out.getCopyOfBuffer())))
                .isInstanceOf(IOException.class);
    }
}
