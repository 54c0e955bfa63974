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

package org.logpress.classify;

import org.logpress.tokenize.Token;
import org.logpress.tokenize.TokenKind;

import java.util.List;
import java.util.Locale;

/**
 * 被分类值在所属日志行中的上下文。
 *
 * <p>包含紧邻的前一个和后一个词元、向前最近的字母数字词元(小写,作为关键字使用),
 * 以及值本身的括号或引号包裹。
 */
public final class TokenContext {

    public static final TokenContext EMPTY = new TokenContext("", "", "", "", "");

    private final String previous;
    private final String next;
    private final String previousWord;
    private final String open;
    private final String close;

    public TokenContext(
            String previous, String next, String previousWord, String open, String close) {
        this.previous = previous;
        this.next = next;
        this.previousWord = previousWord;
        this.open = open;
        this.close = close;
    }

    /** 单个词元的上下文。 */
    public static TokenContext of(List<Token> tokens, int index) {
        return of(tokens, index, index + 1);
    }

    /** 词元区间 {@code [from, to)} 作为一个整体时的上下文。 */
    public static TokenContext of(List<Token> tokens, int from, int to) {
        String previous = from > 0 ? tokens.get(from - 1).value() : "";
        String next = to < tokens.size() ? tokens.get(to).value() : "";
        String previousWord = "";
        for (int i = from - 1; i >= 0; i--) {
            Token token = tokens.get(i);
            if (token.kind() == TokenKind.ALPHANUMERIC) {
                previousWord = token.value().toLowerCase(Locale.ROOT);
                break;
            }
        }
        String open = "";
        String close = "";
        if (to - from == 1) {
            open = tokens.get(from).open();
            close = tokens.get(from).close();
        }
        return new TokenContext(previous, next, previousWord, open, close);
    }

    public String previous() {
        return previous;
    }

    public String next() {
        return next;
    }

    public String previousWord() {
        return previousWord;
    }

    public String open() {
        return open;
    }

    public String close() {
        return close;
    }

    /** 前一个词元直接紧贴一个单词,如 {@code sshd[1234]} 中的 {@code sshd}。 */
    public boolean followsWord() {
        return !previous.isEmpty()
                && Character.isLetterOrDigit(previous.codePointBefore(previous.length()));
    }

    @Override
    public String toString() {
        return "TokenContext{previous='"
                + previous
                + "', next='"
                + next
                + "', previousWord='"
                + previousWord
                + "', wrap='"
                + open
                + close
                + "'}";
    }
}
