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

import org.logpress.io.DataInputDeserializer;
import org.logpress.io.DataOutputSerializer;

import org.junit.jupiter.api.Test;

import java.io.EOFException;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link VarLengthIntUtils}. */
public class VarLengthIntUtilsTest {

    @Test
    public void testEncodedSizes() throws IOException {
        assertThat(encodeLong(0)).hasSize(1);
        assertThat(encodeLong(127)).hasSize(1);
        assertThat(encodeLong(128)).hasSize(2);
        assertThat(encodeLong(16383)).hasSize(2);
        assertThat(encodeLong(16384)).hasSize(3);
        assertThat(encodeLong(Long.MAX_VALUE)).hasSize(9);
        assertThat(VarLengthIntUtils.encodedLongSize(16384)).isEqualTo(3);
    }

    @Test
    public void testZigZag() {
        assertThat(VarLengthIntUtils.zigZagEncode(0)).isEqualTo(0);
        assertThat(VarLengthIntUtils.zigZagEncode(-1)).isEqualTo(1);
        assertThat(VarLengthIntUtils.zigZagEncode(1)).isEqualTo(2);
        assertThat(VarLengthIntUtils.zigZagEncode(-2)).isEqualTo(3);
        for (long v : new long[] {Long.MIN_VALUE, Long.MAX_VALUE, -123456789L, 42}) {
            assertThat(VarLengthIntUtils.zigZagDecode(VarLengthIntUtils.zigZagEncode(v)))
                    .isEqualTo(v);
        }
    }

    @Test
    public void testSignedValuesThroughStreams() throws IOException {
        DataOutputSerializer out = new DataOutputSerializer(4);
        out.writeZigZagLong(Long.MIN_VALUE);
        out.writeZigZagLong(-5);
        out.writeVarInt(300);

        DataInputDeserializer in = new DataInputDeserializer(out.getCopyOfBuffer());
        assertThat(in.readZigZagLong()).isEqualTo(Long.MIN_VALUE);
        assertThat(in.readZigZagLong()).isEqualTo(-5);
        assertThat(in.readVarInt()).isEqualTo(300);
        assertThat(in.available()).isZero();
    }

    @Test
    public void testNegativeUnsignedRejected() {
        DataOutputSerializer out = new DataOutputSerializer(4);
        assertThatThrownBy(() -> VarLengthIntUtils.encodeInt(out, -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> VarLengthIntUtils.encodeLong(out, -1L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testTruncatedInput() {
        // continuation bit set but no following byte
        DataInputDeserializer in = new DataInputDeserializer(new byte[] {(byte) 0x80});
        assertThatThrownBy(in::readVarLong).isInstanceOf(EOFException.class);
    }

    @Test
    public void testMalformedInteger() {
        byte[] tooLong =
                new byte[] {(byte) 0xff, (byte) 0xff, (byte) 0xff, (byte) 0xff, (byte) 0xff, 1};
        assertThatThrownBy(() -> new DataInputDeserializer(tooLong).readVarInt())
                .isInstanceOf(IOException.class);
    }

    private static byte[] encodeLong(long value) throws IOException {
        DataOutputSerializer out = new DataOutputSerializer(16);
        VarLengthIntUtils.encodeLong(out, value);
        return out.getCopyOfBuffer();
    }
}
