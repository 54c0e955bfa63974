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

import java.util.Objects;

/**
 * 日志行中的一个词元,不可变。
 *
 * <p>{@code start} 和 {@code end} 是在所属日志行中的字符偏移(左闭右开)。括号与引号词元额外记录
 * 开始和结束定界符:未闭合的词元结束定界符为空串。{@link #body()} 是去掉定界符后的内容。
 */
public final class Token {

    private final String value;
    private final int start;
    private final int end;
    private final TokenKind kind;
    private final String open;
    private final String close;

    public Token(String value, int start, int end, TokenKind kind) {
        this(value, start, end, kind, "", "");
    }

    public Token(String value, int start, int end, TokenKind kind, String open, String close) {
        this.value = value;
        this.start = start;
        this.end = end;
        this.kind = kind;
        this.open = open;
        this.close = close;
    }

    public String value() {
        return value;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    public TokenKind kind() {
        return kind;
    }

    public String open() {
        return open;
    }

    public String close() {
        return close;
    }

    public boolean isWrapped() {
        return !open.isEmpty();
    }

    public String body() {
        return value.substring(open.length(), value.length() - close.length());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Token token = (Token) o;
        return start == token.start
                && end == token.end
                && kind == token.kind
                && value.equals(token.value)
                && open.equals(token.open)
                && close.equals(token.close);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, start, end, kind, open, close);
    }

    @Override
    public String toString() {
        return kind + "(" + value + ")";
    }
}
