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

import org.logpress.annotation.VisibleForTesting;
import org.logpress.compression.BlockCompressionFactory;
import org.logpress.compression.BlockDecompressor;
import org.logpress.compression.BlockCompressionType;
import org.logpress.compression.BufferDecompressionException;
import org.logpress.encode.CodecContext;
import org.logpress.encode.DecodedColumn;
import org.logpress.encode.EncodedColumn;
import org.logpress.encode.TokenPool;
import org.logpress.encode.ValueCodecs;
import org.logpress.io.DataInputDeserializer;
import org.logpress.template.LogTemplate;
import org.logpress.utils.DeltaVarintCompressor;

import javax.annotation.concurrent.ThreadSafe;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.zip.CRC32;

/**
 * 已加载的容器。
 *
 * <p>加载时只解析 footer 和元数据段;行号、列和词元池在第一次使用时才解压解码,并缓存结果。
 * 除缓存外不可变,缓存的访问通过 {@code synchronized} 保护。
 */
@ThreadSafe
public class LogContainer {

    private final byte[] bytes;
    private final Map<String, SectionDescriptor> sections;
    private final Map<BlockCompressionType, BlockCompressionFactory> factories;
    private final Set<String> decodedSections;
    private final int totalLines;
    private final List<TemplateDescriptor> descriptors;
    private final CodecContext codecContext;

    private final Map<String, DecodedColumn> columns = new HashMap<>();
    private final Map<Integer, int[]> rowPositions = new HashMap<>();
    private final Map<Integer, LogTemplate> templates = new HashMap<>();
    private TokenPool pool;

    LogContainer(byte[] bytes, Map<String, SectionDescriptor> sections)
            throws CorruptContainerException {
        this.bytes = bytes;
        this.sections = sections;
        this.factories = new EnumMap<>(BlockCompressionType.class);
        this.decodedSections = new LinkedHashSet<>();
        ContainerSerializer.Metadata meta =
                ContainerSerializer.readMeta(readSection(ContainerFormat.META_SECTION));
        this.totalLines = meta.totalLines;
        this.descriptors = Collections.unmodifiableList(meta.templates);
        // the RLE threshold only matters when encoding
        this.codecContext = new CodecContext(this::poolUnchecked, 2);
    }

    public int totalLines() {
        return totalLines;
    }

    /** 全部模板的描述,含 UNMATCHED。不需要加载词元池。 */
    public List<TemplateDescriptor> descriptors() {
        return descriptors;
    }

    /** 不含 UNMATCHED 的模板个数。 */
    public int templateCount() {
        int count = 0;
        for (TemplateDescriptor descriptor : descriptors) {
            if (!descriptor.isUnmatched()) {
                count++;
            }
        }
        return count;
    }

    public int unmatchedCount() {
        for (TemplateDescriptor descriptor : descriptors) {
            if (descriptor.isUnmatched()) {
                return descriptor.matchCount();
            }
        }
        return 0;
    }

    /** 完整的模板(不含示例行),第一次调用时加载词元池。 */
    public synchronized LogTemplate template(int index) throws IOException {
        LogTemplate template = templates.get(index);
        if (template == null) {
            template = descriptors.get(index).resolve(tokenPool(), Collections.emptyList());
            templates.put(index, template);
        }
        return template;
    }

    /** 模板的示例行,即其匹配的前几行,需要解码该模板的所有列。 */
    public List<String> examples(int templateIndex) throws IOException {
        int count = descriptors.get(templateIndex).exampleCount();
        List<String> examples = new ArrayList<>(count);
        for (int row = 0; row < count; row++) {
            examples.add(reconstruct(templateIndex, row));
        }
        return examples;
    }

    public List<LogTemplate> templates() throws IOException {
        List<LogTemplate> result = new ArrayList<>(descriptors.size());
        for (int i = 0; i < descriptors.size(); i++) {
            result.add(template(i));
        }
        return result;
    }

    public synchronized TokenPool tokenPool() throws IOException {
        if (pool == null) {
            byte[] section = readSection(ContainerFormat.POOL_SECTION);
            try {
                DataInputDeserializer in = new DataInputDeserializer(section);
                TokenPool loaded = TokenPool.read(in);
                if (in.available() != 0) {
                    throw new IOException(in.available() + " trailing bytes");
                }
                pool = loaded;
            } catch (IOException | RuntimeException e) {
                throw new CorruptContainerException("Token pool section is corrupt", e);
            }
        }
        return pool;
    }

    private TokenPool poolUnchecked() {
        try {
            return tokenPool();
        } catch (IOException e) {
            throw new PoolUnavailableException(e);
        }
    }

    /** 模板所匹配行的全局行号,严格递增。 */
    public synchronized int[] rowPositions(int templateIndex) throws IOException {
        int[] positions = rowPositions.get(templateIndex);
        if (positions == null) {
            TemplateDescriptor descriptor = descriptors.get(templateIndex);
            String name = ContainerFormat.rowsSection(descriptor.id());
            long[] decoded;
            try {
                decoded = DeltaVarintCompressor.decompress(readSection(name));
            } catch (IllegalArgumentException e) {
                throw new CorruptContainerException("Section " + name + " is corrupt", e);
            }
            if (decoded.length != descriptor.matchCount()) {
                throw new CorruptContainerException(
                        "Section " + name + " holds " + decoded.length + " rows, expected "
                                + descriptor.matchCount());
            }
            positions = new int[decoded.length];
            for (int i = 0; i < decoded.length; i++) {
                if (decoded[i] < 0
                        || decoded[i] >= totalLines
                        || (i > 0 && decoded[i] <= decoded[i - 1])) {
                    throw new CorruptContainerException(
                            "Section " + name + " holds invalid line number " + decoded[i]);
                }
                positions[i] = (int) decoded[i];
            }
            rowPositions.put(templateIndex, positions);
        }
        return positions;
    }

    /** 列的编码数据,不解码。 */
    public EncodedColumn encodedColumn(int templateIndex, int slotIndex) throws IOException {
        TemplateDescriptor descriptor = descriptors.get(templateIndex);
        String name =
                ContainerFormat.columnSection(
                        descriptor.id(), descriptor.slots().get(slotIndex).name());
        return new EncodedColumn(
                descriptor.codecs().get(slotIndex), readSection(name), descriptor.matchCount());
    }

    /** 解码后的列,只解压解码这一列。 */
    public synchronized DecodedColumn column(int templateIndex, int slotIndex) throws IOException {
        TemplateDescriptor descriptor = descriptors.get(templateIndex);
        String name =
                ContainerFormat.columnSection(
                        descriptor.id(), descriptor.slots().get(slotIndex).name());
        DecodedColumn column = columns.get(name);
        if (column == null) {
            EncodedColumn encoded = encodedColumn(templateIndex, slotIndex);
            try {
                column = ValueCodecs.of(encoded.codec()).decode(encoded, codecContext);
            } catch (PoolUnavailableException e) {
                throw e.getCause();
            } catch (CorruptContainerException e) {
                throw e;
            } catch (IOException | RuntimeException e) {
                throw new CorruptContainerException("Section " + name + " is corrupt", e);
            }
            if (column.size() != descriptor.matchCount()) {
                throw new CorruptContainerException(
                        "Section " + name + " decoded to " + column.size() + " values");
            }
            columns.put(name, column);
        }
        return column;
    }

    /** 还原模板的第 {@code row} 行,只解码该模板的列。 */
    public String reconstruct(int templateIndex, int row) throws IOException {
        return reconstruct(templateIndex, row, template(templateIndex));
    }

    private String reconstruct(int templateIndex, int row, LogTemplate template)
            throws IOException {
        String[] values = new String[template.slots().size()];
        for (int slot = 0; slot < values.length; slot++) {
            values[slot] = column(templateIndex, slot).get(row);
        }
        return template.reconstruct(values);
    }

    /** 按原始顺序还原全部行。 */
    public List<String> decodeAll() throws IOException {
        String[] lines = new String[totalLines];
        for (int t = 0; t < descriptors.size(); t++) {
            int[] positions = rowPositions(t);
            LogTemplate template = template(t);
            for (int row = 0; row < positions.length; row++) {
                if (lines[positions[row]] != null) {
                    throw new CorruptContainerException(
                            "Line " + positions[row] + " belongs to more than one template");
                }
                lines[positions[row]] = reconstruct(t, row, template);
            }
        }
        return Arrays.asList(lines);
    }

    /** 已解压过的段名,按首次访问顺序。 */
    @VisibleForTesting
    public synchronized Set<String> decodedSections() {
        return new LinkedHashSet<>(decodedSections);
    }

    // ------------------------------------------------------------------------
    //  Sections
    // ------------------------------------------------------------------------

    byte[] readSection(String name) throws CorruptContainerException {
        SectionDescriptor section = sections.get(name);
        if (section == null) {
            throw new CorruptContainerException("Missing section " + name);
        }
        synchronized (this) {
            decodedSections.add(name);
        }
        int offset = (int) section.offset();
        byte[] raw;
        if (section.compression() == BlockCompressionType.NONE) {
            if (section.length() != section.rawLength()) {
                throw new CorruptContainerException("Inconsistent lengths of section " + name);
            }
            raw = Arrays.copyOfRange(bytes, offset, offset + section.length());
        } else {
            BlockDecompressor decompressor = factory(section.compression()).getDecompressor();
            try {
                // rawLength comes from the footer, check it against the data before allocating
                int expected = decompressor.decompressedLength(bytes, offset, section.length());
                if (expected != section.rawLength()) {
                    throw new CorruptContainerException(
                            "Section " + name + " declares " + section.rawLength()
                                    + " raw bytes, its data holds " + expected);
                }
                raw = new byte[expected];
                int length = decompressor.decompress(bytes, offset, section.length(), raw, 0);
                if (length != raw.length) {
                    throw new CorruptContainerException(
                            "Section " + name + " decompressed to " + length + " bytes, expected "
                                    + raw.length);
                }
            } catch (BufferDecompressionException e) {
                throw new CorruptContainerException("Cannot decompress section " + name, e);
            }
        }

        CRC32 crc = new CRC32();
        crc.update(raw, 0, raw.length);
        if ((int) crc.getValue() != section.crc32()) {
            throw new CorruptContainerException("Checksum mismatch in section " + name);
        }
        return raw;
    }

    private synchronized BlockCompressionFactory factory(BlockCompressionType type) {
        return factories.computeIfAbsent(type, t -> BlockCompressionFactory.create(t, 1));
    }

    /** 词元池在列解码过程中按需加载失败。 */
    private static class PoolUnavailableException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        PoolUnavailableException(IOException cause) {
            super(cause);
        }

        @Override
        public synchronized IOException getCause() {
            return (IOException) super.getCause();
        }
    }
}
