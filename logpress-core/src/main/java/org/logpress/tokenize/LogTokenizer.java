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

package org.logpress.tokenize;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 日志行分词器。
 *
 * <p>不依赖任何日志格式的先验知识,按字符类别把一行切分为 {@link Token} 序列。扫描状态:
 * <ul>
 *   <li><b>默认状态</b>: 根据当前字符决定进入哪种状态
 *   <li><b>括号状态</b>: 遇到 {@code [ ( {} 进入,维护期望的结束括号栈,支持任意类型括号嵌套;
 *       括号内的双引号片段整体跳过,其中的结束括号不会闭合外层括号
 *   <li><b>引号状态</b>: 遇到双引号,或前一个字符不是字母数字的单引号时进入,反斜杠转义下一个字符
 *   <li><b>单词状态</b>: 字母、数字及词内连接符 {@code . _ - / @ + % ~ #} 的最长序列,
 *       两个数字之间的冒号(如 {@code 17:41:41})和 URL 的 {@code ://} 也算作单词的一部分
 *   <li><b>分隔符状态</b>: 空白、{@code , ; : = |} 以及不含字母数字的连接符序列合并为一个分隔符
 * </ul>
 *
 * <p>未闭合的括号或引号在行尾结束,不视为错误。其他字符各自成为一个 SPECIAL 词元。
 *
 * <p>保证: 所有词元按顺序拼接后与原始行完全相同;对同一输入结果确定。
 */
public class LogTokenizer {

    private static final String CONNECTORS = "._-/@+%~#";

    private static final String SEPARATORS = ",;:=|";

    public List<Token> tokenize(String line) {
        List<Token> tokens = new ArrayList<>();
        final int n = line.length();
        int i = 0;
        while (i < n) {
            int c = line.codePointAt(i);
            if (isOpenBracket(c)) {
                boolean[] terminated = new boolean[1];
                int end = scanBracket(line, i, terminated);
                tokens.add(wrapped(line, i, end, TokenKind.BRACKET, terminated[0]));
                i = end;
            } else if (opensQuote(line, i, c)) {
                boolean[] terminated = new boolean[1];
                int end = scanQuote(line, i, (char) c, terminated);
                tokens.add(wrapped(line, i, end, TokenKind.QUOTED, terminated[0]));
                i = end;
            } else {
                int wordEnd = scanWord(line, i);
                if (wordEnd > i && containsLetterOrDigit(line, i, wordEnd)) {
                    tokens.add(
                            new Token(
                                    line.substring(i, wordEnd),
                                    i,
                                    wordEnd,
                                    TokenKind.ALPHANUMERIC));
                    i = wordEnd;
                } else if (wordEnd > i || isSeparator(c)) {
                    int end = scanDelimiter(line, i);
                    tokens.add(new Token(line.substring(i, end), i, end, TokenKind.DELIMITER));
                    i = end;
                } else {
                    int end = i + Character.charCount(c);
                    tokens.add(new Token(line.substring(i, end), i, end, TokenKind.SPECIAL));
                    i = end;
                }
            }
        }
        return tokens;
    }

    private static Token wrapped(String line, int start, int end, TokenKind kind, boolean closed) {
        String open = String.valueOf(line.charAt(start));
        String close = closed ? String.valueOf(line.charAt(end - 1)) : "";
        return new Token(line.substring(start, end), start, end, kind, open, close);
    }

    // ------------------------------------------------------------------------
    //  Scanning states
    // ------------------------------------------------------------------------

    private static int scanBracket(String line, int start, boolean[] terminated) {
        final int n = line.length();
        Deque<Character> expected = new ArrayDeque<>();
        expected.push(closerOf(line.charAt(start)));
        int j = start + 1;
        while (j < n) {
            char ch = line.charAt(j);
            if (ch == '"') {
                j = scanQuote(line, j, '"', new boolean[1]);
                continue;
            }
            if (isOpenBracket(ch)) {
                expected.push(closerOf(ch));
            } else if (isCloseBracket(ch) && expected.contains(ch)) {
                // a closer of an outer bracket also closes every inner one
                while (expected.pop() != ch) {}
                if (expected.isEmpty()) {
                    terminated[0] = true;
                    return j + 1;
                }
            }
            j++;
        }
        return n;
    }

    private static int scanQuote(String line, int start, char quote, boolean[] terminated) {
        final int n = line.length();
        int j = start + 1;
        while (j < n) {
            char ch = line.charAt(j);
            if (ch == '\\') {
                j += 2;
                continue;
            }
            if (ch == quote) {
                terminated[0] = true;
                return j + 1;
            }
            j++;
        }
        return n;
    }

    private static int scanWord(String line, int start) {
        final int n = line.length();
        int j = start;
        while (j < n) {
            int cp = line.codePointAt(j);
            if (!isWordChar(line, j, cp)) {
                break;
            }
            j += Character.charCount(cp);
        }
        return j;
    }

    private static int scanDelimiter(String line, int start) {
        final int n = line.length();
        int j = start;
        while (j < n) {
            int cp = line.codePointAt(j);
            if (isSeparator(cp)) {
                j += Character.charCount(cp);
                continue;
            }
            int wordEnd = scanWord(line, j);
            if (wordEnd > j && !containsLetterOrDigit(line, j, wordEnd)) {
                j = wordEnd;
            } else {
                break;
            }
        }
        return j;
    }

    // ------------------------------------------------------------------------
    //  Character classes
    // ------------------------------------------------------------------------

    private static boolean isWordChar(String line, int index, int cp) {
        if (Character.isLetterOrDigit(cp) || CONNECTORS.indexOf(cp) >= 0) {
            return true;
        }
        if (cp != ':' || index == 0) {
            return false;
        }
        char before = line.charAt(index - 1);
        if (index + 1 < line.length()
                && Character.isDigit(before)
                && Character.isDigit(line.charAt(index + 1))) {
            return true;
        }
        // scheme separator of a URL
        return Character.isLetter(before) && line.startsWith("//", index + 1);
    }

    private static boolean containsLetterOrDigit(String line, int start, int end) {
        int j = start;
        while (j < end) {
            int cp = line.codePointAt(j);
            if (Character.isLetterOrDigit(cp)) {
                return true;
            }
            j += Character.charCount(cp);
        }
        return false;
    }

    private static boolean isSeparator(int cp) {
        return Character.isWhitespace(cp)
                || Character.isSpaceChar(cp)
                || SEPARATORS.indexOf(cp) >= 0;
    }

    private static boolean opensQuote(String line, int index, int cp) {
        if (cp == '"') {
            return true;
        }
        return cp == '\''
                && (index == 0 || !Character.isLetterOrDigit(line.codePointBefore(index)));
    }

    private static boolean isOpenBracket(int c) {
        return c == '[' || c == '(' || c == '{';
    }

    private static boolean isCloseBracket(char c) {
        return c == ']' || c == ')' || c == '}';
    }

    private static char closerOf(char open) {
        switch (open) {
            case '[':
                return ']';
            case '(':
                return ')';
            default:
                return '}';
        }
    }
}
