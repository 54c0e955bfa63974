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

package org.logpress.container;

import org.logpress.LogCompressor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link LogContainerFiles}. */
public class LogContainerFilesTest {

    @TempDir Path tempDir;

    private static List<Path> list(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.collect(Collectors.toList());
        }
    }

    @Test
    public void testWriteAndRead() throws IOException {
        List<String> lines = Arrays.asList("job 1 done", "job 2 done", "job 3 done");
        LogCompressor compressor = new LogCompressor();
        byte[] container = compressor.compress(lines).container();

        Path file = tempDir.resolve("app.lsc");
        LogContainerFiles.write(file, container);

        assertThat(LogContainerFiles.read(file)).isEqualTo(container);
        assertThat(compressor.decompress(LogContainerFiles.read(file))).isEqualTo(lines);
        assertThat(list(tempDir)).containsExactly(file);
    }

    @Test
    public void testOverwrite() throws IOException {
        Path file = tempDir.resolve("app.lsc");
        LogContainerFiles.write(file, new byte[] {1, 2, 3});
        LogContainerFiles.write(file, new byte[] {4, 5});

        assertThat(LogContainerFiles.read(file)).containsExactly(4, 5);
        assertThat(list(tempDir)).containsExactly(file);
    }

    @Test
    public void testWriteIntoMissingDirectory() {
        Path file = tempDir.resolve("missing").resolve("app.lsc");

        assertThatThrownBy(() -> LogContainerFiles.write(file, new byte[] {1}))
                .isInstanceOf(IOException.class);
        assertThat(Files.exists(file)).isFalse();
    }

    @Test
    public void testReadMissingFile() {
        assertThatThrownBy(() -> LogContainerFiles.read(tempDir.resolve("absent.lsc")))
                .isInstanceOf(IOException.class);
    }
}
