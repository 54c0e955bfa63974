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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/** 容器文件的读写。 */
public class LogContainerFiles {

    private static final Logger LOG = LoggerFactory.getLogger(LogContainerFiles.class);

    private LogContainerFiles() {}

    /**
     * 原子性地写入容器文件。
     *
     * <p>先写入同目录下的临时隐藏文件,成功后再原子重命名为目标文件,已存在的目标文件会被替换。
     * 写入失败时删除临时文件,不会留下不完整的容器。
     */
    public static void write(Path path, byte[] container) throws IOException {
        Path target = path.toAbsolutePath();
        Path tmp =
                target.resolveSibling(
                        "." + target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        boolean success = false;
        try {
            Files.write(tmp, container);
            Files.move(
                    tmp,
                    target,
                    StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
            success = true;
        } finally {
            if (!success) {
                deleteQuietly(tmp);
            }
        }
        LOG.debug("Wrote container of {} bytes to {}", container.length, target);
    }

    public static byte[] read(Path path) throws IOException {
        return Files.readAllBytes(path);
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Exception occurs when deleting file " + file, e);
        }
    }
}
