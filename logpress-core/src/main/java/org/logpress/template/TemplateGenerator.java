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

package org.logpress.template;

import org.logpress.LogPressOptions;
import org.logpress.classify.SemanticClassifier;
import org.logpress.classify.SemanticMatch;
import org.logpress.classify.SemanticType;
import org.logpress.classify.TokenContext;
import org.logpress.tokenize.LogTokenizer;
import org.logpress.tokenize.Token;
import org.logpress.tokenize.TokenKind;
import org.logpress.utils.IntArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 模板生成器,从一批日志行中推断模板。
 *
 * <h2>算法</h2>
 *
 * <ol>
 *   <li>对每行分词,按形状键(词元类型序列及括号/引号定界符)分组,组按首次出现的顺序处理
 *   <li>组大小不小于 {@code max(2, min-support)} 时逐位置对齐: 出现最多的值(并列取先出现的)
 *       占比达到 {@code similarity-threshold} 的位置为字面量,否则为槽位
 *   <li>槽位类型由各行取值的分类结果投票决定
 *   <li>相邻的、只隔着分隔符字面量的自由文本槽位合并为一个槽位
 *   <li>最终匹配: 所有行重新与候选模板匹配,匹配不到的行以及最终匹配数不足 2 的模板的行进入
 *       UNMATCHED
 * </ol>
 *
 * <p>结果是确定的: 同样的输入和参数总是得到同样的模板和行分配。
 */
public class TemplateGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateGenerator.class);

    private final LogTokenizer tokenizer;
    private final SemanticClassifier classifier;
    private final int minSupport;
    private final double similarityThreshold;
    private final int exampleLimit;
    private final boolean coalesceSlots;

    public TemplateGenerator(LogPressOptions options) {
        this(options, new LogTokenizer(), new SemanticClassifier());
    }

    public TemplateGenerator(
            LogPressOptions options, LogTokenizer tokenizer, SemanticClassifier classifier) {
        this.tokenizer = tokenizer;
        this.classifier = classifier;
        this.minSupport = options.minSupport();
        this.similarityThreshold = options.similarityThreshold();
        this.exampleLimit = options.exampleLimit();
        this.coalesceSlots = options.coalesceSlots();
    }

    public TemplateExtraction extractTemplates(List<String> lines) {
        List<List<Token>> tokenized = new ArrayList<>(lines.size());
        Map<String, IntArrayList> groups = new LinkedHashMap<>();
        for (int i = 0; i < lines.size(); i++) {
            List<Token> tokens = tokenizer.tokenize(lines.get(i));
            tokenized.add(tokens);
            groups.computeIfAbsent(shapeKey(tokens), k -> new IntArrayList(4)).add(i);
        }

        int required = Math.max(2, minSupport);
        List<LogTemplate> candidates = new ArrayList<>();
        for (IntArrayList group : groups.values()) {
            if (group.size() < required) {
                continue;
            }
            List<List<Token>> members = new ArrayList<>(group.size());
            for (int i = 0; i < group.size(); i++) {
                members.add(tokenized.get(group.get(i)));
            }
            LogTemplate candidate = align(members);
            if (LOG.isDebugEnabled()) {
                LOG.debug(
                        "Aligned group of {} lines into {}",
                        group.size(),
                        candidate.toPatternString());
            }
            candidates.add(candidate);
        }

        // final assignment pass
        List<IntArrayList> matchedLines = new ArrayList<>(candidates.size());
        List<List<String[]>> matchedValues = new ArrayList<>(candidates.size());
        for (int c = 0; c < candidates.size(); c++) {
            matchedLines.add(new IntArrayList(8));
            matchedValues.add(new ArrayList<>());
        }
        boolean[] assigned = new boolean[lines.size()];
        for (int i = 0; i < lines.size(); i++) {
            for (int c = 0; c < candidates.size(); c++) {
                String[] values = candidates.get(c).match(tokenized.get(i));
                if (values != null) {
                    matchedLines.get(c).add(i);
                    matchedValues.get(c).add(values);
                    assigned[i] = true;
                    break;
                }
            }
        }

        List<TemplateRows> matched = new ArrayList<>();
        for (int c = 0; c < candidates.size(); c++) {
            IntArrayList rows = matchedLines.get(c);
            if (rows.size() < 2) {
                for (int r = 0; r < rows.size(); r++) {
                    assigned[rows.get(r)] = false;
                }
                LOG.debug(
                        "Dropping template {} with only {} matched lines",
                        candidates.get(c).toPatternString(),
                        rows.size());
                continue;
            }
            String id = String.format("T%03d", matched.size());
            List<String> examples = new ArrayList<>();
            for (int r = 0; r < rows.size() && examples.size() < exampleLimit; r++) {
                examples.add(lines.get(rows.get(r)));
            }
            LogTemplate template = candidates.get(c).withMatches(id, rows.size(), examples);
            matched.add(new TemplateRows(template, rows.toArray(), matchedValues.get(c)));
        }

        IntArrayList unmatchedLines = new IntArrayList(8);
        List<String[]> unmatchedValues = new ArrayList<>();
        List<String> unmatchedExamples = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            if (!assigned[i]) {
                unmatchedLines.add(i);
                unmatchedValues.add(new String[] {lines.get(i)});
                if (unmatchedExamples.size() < exampleLimit) {
                    unmatchedExamples.add(lines.get(i));
                }
            }
        }
        TemplateRows unmatched =
                new TemplateRows(
                        LogTemplate.unmatched(unmatchedLines.size(), unmatchedExamples),
                        unmatchedLines.toArray(),
                        unmatchedValues);

        LOG.debug(
                "Extracted {} templates from {} lines in {} shape groups, {} lines unmatched",
                matched.size(),
                lines.size(),
                groups.size(),
                unmatchedLines.size());
        return new TemplateExtraction(matched, unmatched, lines.size());
    }

    // ------------------------------------------------------------------------
    //  Alignment
    // ------------------------------------------------------------------------

    private LogTemplate align(List<List<Token>> members) {
        List<Token> first = members.get(0);
        int width = first.size();

        // null means slot
        String[] literals = new String[width];
        for (int p = 0; p < width; p++) {
            literals[p] = dominantValue(members, p);
        }

        SemanticMatch[] types = new SemanticMatch[width];
        for (int p = 0; p < width; p++) {
            if (literals[p] == null) {
                types[p] = vote(members, p, p + 1);
            }
        }

        List<PatternElement> elements = new ArrayList<>();
        List<SlotSpec> slots = new ArrayList<>();
        Map<SemanticType, Integer> nameCounts = new EnumMap<>(SemanticType.class);
        int p = 0;
        while (p < width) {
            Token token = first.get(p);
            if (literals[p] != null) {
                elements.add(PatternElement.literal(token.kind(), literals[p]));
                p++;
                continue;
            }

            int end = p + 1;
            SemanticMatch type = types[p];
            if (coalesceSlots && isFreeTextSlot(token, types[p])) {
                end = coalescedEnd(first, literals, types, p);
                if (end > p + 1) {
                    type = vote(members, p, end);
                }
            }

            TokenKind[] kinds = new TokenKind[end - p];
            for (int k = p; k < end; k++) {
                kinds[k - p] = first.get(k).kind();
            }
            boolean wrapped = end == p + 1 && token.isWrapped();
            elements.add(
                    PatternElement.slot(
                            slots.size(),
                            kinds,
                            wrapped ? token.open() : "",
                            wrapped ? token.close() : ""));
            slots.add(
                    new SlotSpec(
                            slotName(type.type(), nameCounts), type.type(), type.confidence()));
            p = end;
        }
        return new LogTemplate("", elements, slots, 0, Collections.emptyList());
    }

    /** 出现最多的值占比达到阈值时返回该值,否则返回 null。 */
    private String dominantValue(List<List<Token>> members, int position) {
        Map<String, int[]> counts = new LinkedHashMap<>();
        for (List<Token> tokens : members) {
            counts.computeIfAbsent(tokens.get(position).value(), v -> new int[1])[0]++;
        }
        String top = null;
        int topCount = 0;
        for (Map.Entry<String, int[]> entry : counts.entrySet()) {
            if (entry.getValue()[0] > topCount) {
                top = entry.getKey();
                topCount = entry.getValue()[0];
            }
        }
        return (double) topCount / members.size() >= similarityThreshold ? top : null;
    }

    private SemanticMatch vote(List<List<Token>> members, int from, int to) {
        List<String> values = new ArrayList<>(members.size());
        List<TokenContext> contexts = new ArrayList<>(members.size());
        for (List<Token> tokens : members) {
            if (to - from == 1) {
                Token token = tokens.get(from);
                values.add(token.isWrapped() ? token.body() : token.value());
            } else {
                StringBuilder value = new StringBuilder();
                for (int k = from; k < to; k++) {
                    value.append(tokens.get(k).value());
                }
                values.add(value.toString());
            }
            contexts.add(TokenContext.of(tokens, from, to));
        }
        return classifier.vote(values, contexts);
    }

    /**
     * 从自由文本槽位 {@code start} 开始向后合并,中间只允许分隔符字面量,返回合并区间的结束位置
     * (不含)。区间总是以槽位结束。
     */
    private static int coalescedEnd(
            List<Token> tokens, String[] literals, SemanticMatch[] types, int start) {
        int end = start + 1;
        for (int k = start + 1; k < tokens.size(); k++) {
            Token token = tokens.get(k);
            if (literals[k] != null) {
                if (token.kind() != TokenKind.DELIMITER) {
                    break;
                }
            } else if (isFreeTextSlot(token, types[k])) {
                end = k + 1;
            } else {
                break;
            }
        }
        return end;
    }

    private static boolean isFreeTextSlot(Token token, SemanticMatch type) {
        return !token.isWrapped() && type.type().isFreeText();
    }

    private static String slotName(SemanticType type, Map<SemanticType, Integer> counts) {
        int count = counts.merge(type, 1, Integer::sum);
        return count == 1 ? type.slotName() : type.slotName() + "_" + count;
    }

    /** 形状键: 词元类型序列以及括号和引号的定界符。 */
    static String shapeKey(List<Token> tokens) {
        StringBuilder key = new StringBuilder(tokens.size() * 2);
        for (Token token : tokens) {
            key.append((char) ('0' + token.kind().persistentId()));
            if (token.isWrapped()) {
                key.append(token.open()).append(token.close()).append('\u0001');
            }
        }
        return key.toString();
    }
}
