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

package org.logpress;

import org.logpress.annotation.Public;
import org.logpress.container.ContainerSerializer;
import org.logpress.container.LogContainer;
import org.logpress.encode.ColumnarEncoder;
import org.logpress.encode.EncodedTemplate;
import org.logpress.encode.TokenPool;
import org.logpress.options.Options;
import org.logpress.query.LogQueryEngine;
import org.logpress.template.TemplateExtraction;
import org.logpress.template.TemplateGenerator;
import org.logpress.template.TemplateRows;
import org.logpress.utils.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 压缩入口: 模板提取、按列编码、写出容器。
 *
 * <p>每次 {@link #compress} 使用独立的词元池,同一个实例可以被多次调用,但不是线程安全的。
 */
@Public
public class LogCompressor {

    private static final Logger LOG = LoggerFactory.getLogger(LogCompressor.class);

    private final TemplateGenerator generator;
    private final ColumnarEncoder encoder;
    private final ContainerSerializer serializer;

    public LogCompressor() {
        this(new LogPressOptions(new Options()));
    }

    public LogCompressor(LogPressOptions options) {
        Preconditions.checkNotNull(options);
        this.generator = new TemplateGenerator(options);
        this.encoder = new ColumnarEncoder(options);
        this.serializer = new ContainerSerializer(options.containerCompressOptions());
    }

    public CompressionResult compress(List<String> lines) throws IOException {
        Preconditions.checkNotNull(lines, "lines must not be null");
        long start = System.nanoTime();

        TemplateExtraction extraction = generator.extractTemplates(lines);
        TokenPool pool = new TokenPool();
        List<EncodedTemplate> encoded = new ArrayList<>(extraction.matchedRows().size() + 1);
        for (TemplateRows rows : extraction.matchedRows()) {
            encoded.add(encoder.encode(rows, pool));
        }
        TemplateRows unmatched = extraction.unmatchedRows();
        if (unmatched.size() > 0) {
            encoded.add(encoder.encode(unmatched, pool));
        }
        byte[] container = serializer.serialize(encoded, pool);

        CompressionStats stats =
                new CompressionStats(
                        lines.size(),
                        extraction.matchedRows().size(),
                        unmatched.size(),
                        originalSize(lines),
                        container.length,
                        Duration.ofNanos(System.nanoTime() - start));
        LOG.info("Compressed {} lines: {}", lines.size(), stats);
        return new CompressionResult(container, stats);
    }

    public List<String> decompress(byte[] container) throws IOException {
        return serializer.deserialize(container).decodeAll();
    }

    public LogQueryEngine open(byte[] container) throws IOException {
        LogContainer loaded = serializer.deserialize(container);
        LOG.debug(
                "Opened container with {} lines in {} templates",
                loaded.totalLines(),
                loaded.descriptors().size());
        return new LogQueryEngine(loaded);
    }

    private static long originalSize(List<String> lines) {
        long size = 0;
        for (String line : lines) {
            size += line.getBytes(StandardCharsets.UTF_8).length + 1;
        }
        return size;
    }
}
