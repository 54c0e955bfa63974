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

import org.logpress.classify.SemanticType;
import org.logpress.compression.BlockCompressionFactory;
import org.logpress.compression.BlockCompressionType;
import org.logpress.compression.BlockCompressor;
import org.logpress.compression.CompressOptions;
import org.logpress.encode.ColumnCodec;
import org.logpress.encode.EncodedColumn;
import org.logpress.encode.EncodedTemplate;
import org.logpress.encode.TokenPool;
import org.logpress.io.DataInputDeserializer;
import org.logpress.io.DataOutputSerializer;
import org.logpress.template.LogTemplate;
import org.logpress.template.PatternElement;
import org.logpress.template.SlotSpec;
import org.logpress.tokenize.TokenKind;
import org.logpress.utils.DeltaVarintCompressor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.EOFException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * 容器序列化器,格式见 {@link ContainerFormat}。
 *
 * <p>每个段单独用配置的块压缩算法压缩,压缩后不更小或段为空时原样保存。模板字面量在写元数据段时
 * 加入词元池,因此词元池段总是最后一个段。
 */
public class ContainerSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(ContainerSerializer.class);

    private static final int LITERAL = 0;
    private static final int SLOT = 1;

    @Nullable private final BlockCompressionFactory compressionFactory;

    public ContainerSerializer() {
        this(CompressOptions.defaultOptions());
    }

    public ContainerSerializer(CompressOptions compressOptions) {
        this.compressionFactory = BlockCompressionFactory.create(compressOptions);
    }

    // ------------------------------------------------------------------------
    //  Serialize
    // ------------------------------------------------------------------------

    /**
     * 序列化一次压缩的全部结果。
     *
     * @param templates 各模板的编码结果,UNMATCHED 模板(若有)在最后
     * @param pool 本次压缩的词元池,模板字面量会被加入其中
     */
    public byte[] serialize(List<EncodedTemplate> templates, TokenPool pool) throws IOException {
        Map<String, byte[]> sections = new LinkedHashMap<>();
        sections.put(ContainerFormat.META_SECTION, writeMeta(templates, pool));
        for (EncodedTemplate template : templates) {
            String id = template.template().id();
            sections.put(ContainerFormat.rowsSection(id), writeRows(template.lineNumbers()));
            for (Map.Entry<String, EncodedColumn> column : template.columns().entrySet()) {
                sections.put(
                        ContainerFormat.columnSection(id, column.getKey()),
                        column.getValue().payload());
            }
        }
        DataOutputSerializer poolOut = new DataOutputSerializer(256);
        pool.write(poolOut);
        sections.put(ContainerFormat.POOL_SECTION, poolOut.getCopyOfBuffer());

        DataOutputSerializer out = new DataOutputSerializer(1024);
        out.write(ContainerFormat.MAGIC);
        out.writeByte(ContainerFormat.Version.current().version());
        List<SectionDescriptor> descriptors = new ArrayList<>(sections.size());
        for (Map.Entry<String, byte[]> section : sections.entrySet()) {
            descriptors.add(writeSection(out, section.getKey(), section.getValue()));
        }

        long footerOffset = out.length();
        out.writeInt(descriptors.size());
        for (SectionDescriptor descriptor : descriptors) {
            descriptor.write(out);
        }
        int footerLength = (int) (out.length() - footerOffset);
        out.writeLong(footerOffset);
        out.writeInt(footerLength);
        out.write(ContainerFormat.MAGIC);

        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "Serialized {} templates into {} sections, {} bytes",
                    templates.size(),
                    descriptors.size(),
                    out.length());
        }
        return out.getCopyOfBuffer();
    }

    private SectionDescriptor writeSection(DataOutputSerializer out, String name, byte[] raw)
            throws IOException {
        CRC32 crc = new CRC32();
        crc.update(raw, 0, raw.length);
        int checksum = (int) crc.getValue();
        long offset = out.length();

        if (compressionFactory != null && raw.length > 0) {
            BlockCompressor compressor = compressionFactory.getCompressor();
            byte[] compressed = new byte[compressor.getMaxCompressedSize(raw.length)];
            int length = compressor.compress(raw, 0, raw.length, compressed, 0);
            if (length < raw.length) {
                out.write(compressed, 0, length);
                return new SectionDescriptor(
                        name,
                        offset,
                        length,
                        raw.length,
                        compressionFactory.getCompressionType(),
                        checksum);
            }
        }
        out.write(raw);
        return new SectionDescriptor(
                name, offset, raw.length, raw.length, BlockCompressionType.NONE, checksum);
    }

    private static byte[] writeMeta(List<EncodedTemplate> templates, TokenPool pool)
            throws IOException {
        DataOutputSerializer out = new DataOutputSerializer(256);
        int totalLines = 0;
        for (EncodedTemplate template : templates) {
            totalLines += template.rowCount();
        }
        out.writeVarInt(totalLines);
        out.writeVarInt(templates.size());
        for (EncodedTemplate encoded : templates) {
            LogTemplate template = encoded.template();
            out.writeString(template.id());
            out.writeVarInt(encoded.rowCount());
            out.writeVarInt(template.examples().size());

            out.writeVarInt(template.elements().size());
            for (PatternElement element : template.elements()) {
                if (element.isSlot()) {
                    out.writeByte(SLOT);
                    out.writeVarInt(element.slotIndex());
                    out.writeVarInt(element.span());
                    for (TokenKind kind : element.kinds()) {
                        out.writeByte(kind.persistentId());
                    }
                    out.writeString(element.open());
                    out.writeString(element.close());
                } else {
                    out.writeByte(LITERAL);
                    out.writeByte(element.literalKind().persistentId());
                    out.writeVarInt(pool.add(element.literal()));
                }
            }

            out.writeVarInt(template.slots().size());
            for (SlotSpec slot : template.slots()) {
                out.writeString(slot.name());
                out.writeString(slot.type().name());
                out.writeDouble(slot.confidence());
                out.writeByte(encoded.columns().get(slot.name()).codec().persistentId());
            }
        }
        return out.getCopyOfBuffer();
    }

    private static byte[] writeRows(int[] lineNumbers) {
        long[] values = new long[lineNumbers.length];
        for (int i = 0; i < lineNumbers.length; i++) {
            values[i] = lineNumbers[i];
        }
        return DeltaVarintCompressor.compress(values);
    }

    // ------------------------------------------------------------------------
    //  Deserialize
    // ------------------------------------------------------------------------

    /**
     * 读取容器。只解析 header、footer 和元数据段,其余段在使用时才解压解码。
     *
     * @throws FormatException 魔数错误或版本未知
     * @throws CorruptContainerException 数据被截断或已损坏
     */
    public LogContainer deserialize(byte[] bytes) throws IOException {
        checkHeader(bytes);
        if (bytes.length < ContainerFormat.HEADER_LENGTH + ContainerFormat.TRAILER_LENGTH) {
            throw new CorruptContainerException(
                    "Container of " + bytes.length + " bytes is truncated");
        }

        int trailer = bytes.length - ContainerFormat.TRAILER_LENGTH;
        if (!ContainerFormat.hasMagic(bytes, trailer + 12)) {
            throw new CorruptContainerException("Container trailer is missing, truncated input?");
        }
        DataInputDeserializer trailerIn = new DataInputDeserializer(bytes, trailer, 12);
        long footerOffset = trailerIn.readLong();
        int footerLength = trailerIn.readInt();
        if (footerOffset < ContainerFormat.HEADER_LENGTH
                || footerLength < 4
                || footerOffset + footerLength != trailer) {
            throw new CorruptContainerException(
                    "Invalid footer position " + footerOffset + "+" + footerLength);
        }

        Map<String, SectionDescriptor> sections = new LinkedHashMap<>();
        try {
            DataInputDeserializer footer =
                    new DataInputDeserializer(bytes, (int) footerOffset, footerLength);
            int count = footer.readInt();
            if (count < 0 || count > footerLength) {
                throw new CorruptContainerException("Invalid section count " + count);
            }
            for (int i = 0; i < count; i++) {
                SectionDescriptor section = SectionDescriptor.read(footer);
                if (section.offset() < ContainerFormat.HEADER_LENGTH
                        || section.length() < 0
                        || section.rawLength() < 0
                        || section.offset() + section.length() > footerOffset) {
                    throw new CorruptContainerException("Section out of range: " + section);
                }
                sections.put(section.name(), section);
            }
        } catch (CorruptContainerException e) {
            throw e;
        } catch (EOFException e) {
            throw new CorruptContainerException("Footer is truncated", e);
        } catch (IOException e) {
            throw new CorruptContainerException("Footer is corrupt: " + e.getMessage(), e);
        }

        return new LogContainer(bytes, sections);
    }

    private static void checkHeader(byte[] bytes) throws IOException {
        int prefix = Math.min(bytes.length, ContainerFormat.MAGIC.length);
        for (int i = 0; i < prefix; i++) {
            if (bytes[i] != ContainerFormat.MAGIC[i]) {
                throw new FormatException("Not a log container: bad magic");
            }
        }
        if (bytes.length < ContainerFormat.HEADER_LENGTH) {
            throw new CorruptContainerException(
                    "Container of " + bytes.length + " bytes is truncated");
        }
        int version = bytes[ContainerFormat.MAGIC.length] & 0xff;
        if (version != ContainerFormat.Version.current().version()) {
            throw new FormatException("Unsupported container version " + version);
        }
    }

    /** 解析元数据段,任何不一致都视为损坏。 */
    static Metadata readMeta(byte[] meta) throws CorruptContainerException {
        try {
            return parseMeta(meta);
        } catch (CorruptContainerException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new CorruptContainerException("Metadata section is corrupt", e);
        }
    }

    private static Metadata parseMeta(byte[] meta) throws IOException {
        DataInputDeserializer in = new DataInputDeserializer(meta);
        int totalLines = in.readVarInt();
        int templateCount = in.readVarInt();
        if (totalLines < 0 || templateCount < 0 || templateCount > meta.length) {
            throw new CorruptContainerException(
                    "Invalid metadata header: " + totalLines + " lines, " + templateCount
                            + " templates");
        }
        List<TemplateDescriptor> descriptors = new ArrayList<>(templateCount);
        long matched = 0;
        for (int t = 0; t < templateCount; t++) {
            String id = in.readString();
            int matchCount = in.readVarInt();
            int exampleCount = in.readVarInt();
            if (matchCount < 0 || exampleCount < 0 || exampleCount > matchCount) {
                throw new CorruptContainerException("Invalid counts for template " + id);
            }

            int elementCount = in.readVarInt();
            if (elementCount < 0 || elementCount > in.available()) {
                throw new CorruptContainerException("Invalid element count for template " + id);
            }
            List<PatternElement> elements = new ArrayList<>(elementCount);
            int[] literalRefs = new int[elementCount];
            for (int e = 0; e < elementCount; e++) {
                int tag = in.readUnsignedByte();
                if (tag == SLOT) {
                    int slotIndex = in.readVarInt();
                    int span = in.readVarInt();
                    if (span < 0 || span > in.available()) {
                        throw new CorruptContainerException("Invalid slot span " + span);
                    }
                    TokenKind[] kinds = new TokenKind[span];
                    for (int k = 0; k < span; k++) {
                        kinds[k] = TokenKind.fromPersistentId(in.readUnsignedByte());
                    }
                    String open = in.readString();
                    String close = in.readString();
                    elements.add(PatternElement.slot(slotIndex, kinds, open, close));
                    literalRefs[e] = -1;
                } else if (tag == LITERAL) {
                    TokenKind kind = TokenKind.fromPersistentId(in.readUnsignedByte());
                    elements.add(PatternElement.literal(kind, ""));
                    literalRefs[e] = in.readVarInt();
                } else {
                    throw new CorruptContainerException("Unknown pattern element tag " + tag);
                }
            }

            int slotCount = in.readVarInt();
            if (slotCount < 0 || slotCount > in.available()) {
                throw new CorruptContainerException("Invalid slot count for template " + id);
            }
            List<SlotSpec> slots = new ArrayList<>(slotCount);
            List<ColumnCodec> codecs = new ArrayList<>(slotCount);
            for (int s = 0; s < slotCount; s++) {
                String name = in.readString();
                SemanticType type = SemanticType.valueOf(in.readString());
                double confidence = in.readDouble();
                slots.add(new SlotSpec(name, type, confidence));
                codecs.add(ColumnCodec.fromPersistentId(in.readUnsignedByte()));
            }
            for (PatternElement element : elements) {
                if (element.isSlot() && element.slotIndex() >= slotCount) {
                    throw new CorruptContainerException(
                            "Template " + id + " references missing slot " + element.slotIndex());
                }
            }
            descriptors.add(
                    new TemplateDescriptor(
                            id, matchCount, exampleCount, elements, literalRefs, slots, codecs));
            matched += matchCount;
        }
        if (matched != totalLines) {
            throw new CorruptContainerException(
                    "Templates cover " + matched + " lines but the container holds " + totalLines);
        }
        if (in.available() != 0) {
            throw new CorruptContainerException(
                    in.available() + " trailing bytes in the metadata section");
        }
        return new Metadata(totalLines, descriptors);
    }

    /** 元数据段的内容。 */
    static final class Metadata {

        final int totalLines;
        final List<TemplateDescriptor> templates;

        Metadata(int totalLines, List<TemplateDescriptor> templates) {
            this.totalLines = totalLines;
            this.templates = templates;
        }
    }
}
