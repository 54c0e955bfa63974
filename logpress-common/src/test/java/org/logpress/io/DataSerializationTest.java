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

package org.logpress.io;

import org.junit.jupiter.api.Test;

import java.io.EOFException;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link DataOutputSerializer} and {@link DataInputDeserializer}. */
public class DataSerializationTest {

    @Test
    public void testPrimitivesAreBigEndian() throws IOException {
        DataOutputSerializer out = new DataOutputSerializer(1);
        out.writeInt(0x01020304);
        out.writeLong(0x0102030405060708L);
        out.writeShort(0x0a0b);

        byte[] bytes = out.getCopyOfBuffer();
        assertThat(bytes).isEqualTo(new byte[] {1, 2, 3, 4, 1, 2, 3, 4, 5, 6, 7, 8, 10, 11});

        DataInputDeserializer in = new DataInputDeserializer(bytes);
        assertThat(in.readInt()).isEqualTo(0x01020304);
        assertThat(in.readLong()).isEqualTo(0x0102030405060708L);
        assertThat(in.readShort()).isEqualTo((short) 0x0a0b);
        assertThatThrownBy(in::readByte).isInstanceOf(EOFException.class);
    }

    @Test
    public void testStringsBeyondUtfLimit() throws IOException {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < 70_000; i++) {
            builder.append((char) ('a' + i % 26));
        }
        String longLine = builder.toString();

        DataOutputSerializer out = new DataOutputSerializer(16);
        out.writeString(longLine);
        out.writeString("日志 [ERROR] ✓");
        out.writeString("");
        out.writeDouble(0.25);

        DataInputDeserializer in = new DataInputDeserializer(out.getCopyOfBuffer());
        assertThat(in.readString()).isEqualTo(longLine);
        assertThat(in.readString()).isEqualTo("日志 [ERROR] ✓");
        assertThat(in.readString()).isEmpty();
        assertThat(in.readDouble()).isEqualTo(0.25);
    }

    @Test
    public void testTruncatedString() throws IOException {
        DataOutputSerializer out = new DataOutputSerializer(16);
        out.writeString("connection refused");
        byte[] bytes = out.getCopyOfBuffer();

        DataInputDeserializer in = new DataInputDeserializer(bytes, 0, bytes.length - 3);
        assertThatThrownBy(in::readString).isInstanceOf(EOFException.class);
    }

    @Test
    public void testUtf() throws IOException {
        DataOutputSerializer out = new DataOutputSerializer(2);
        out.writeUTF("severity=WARN");
        assertThat(new DataInputDeserializer(out.getCopyOfBuffer()).readUTF())
                .isEqualTo("severity=WARN");
    }

    @Test
    public void testSetPosition() throws IOException {
        DataOutputSerializer out = new DataOutputSerializer(8);
        out.writeInt(1);
        out.writeInt(2);
        out.setPosition(4);
        assertThat(out.length()).isEqualTo(4);
        assertThatThrownBy(() -> out.setPosition(5)).isInstanceOf(IllegalArgumentException.class);
    }
}
