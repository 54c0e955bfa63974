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

import org.logpress.tokenize.TokenKind;

import java.util.Arrays;
import java.util.Objects;

/**
 * 模板字面模式中的一个元素,可能是字面量或槽位。
 *
 * <ul>
 *   <li>字面量: 一个固定的词元,类型与值都必须完全一致
 *   <li>槽位: 覆盖一个或多个连续词元,只校验词元类型;单个括号或引号词元的槽位保留其定界符,
 *       槽位值为去掉定界符后的内容
 * </ul>
 */
public final class PatternElement {

    private final boolean slot;
    private final TokenKind literalKind;
    private final String literal;
    private final int slotIndex;
    private final TokenKind[] kinds;
    private final String open;
    private final String close;

    private PatternElement(
            boolean slot,
            TokenKind literalKind,
            String literal,
            int slotIndex,
            TokenKind[] kinds,
            String open,
            String close) {
        this.slot = slot;
        this.literalKind = literalKind;
        this.literal = literal;
        this.slotIndex = slotIndex;
        this.kinds = kinds;
        this.open = open;
        this.close = close;
    }

    public static PatternElement literal(TokenKind kind, String value) {
        return new PatternElement(false, kind, value, -1, new TokenKind[] {kind}, "", "");
    }

    public static PatternElement slot(int slotIndex, TokenKind[] kinds, String open, String close) {
        return new PatternElement(true, null, null, slotIndex, kinds.clone(), open, close);
    }

    public boolean isSlot() {
        return slot;
    }

    public TokenKind literalKind() {
        return literalKind;
    }

    public String literal() {
        return literal;
    }

    public int slotIndex() {
        return slotIndex;
    }

    /** 覆盖的词元类型序列。 */
    public TokenKind[] kinds() {
        return kinds.clone();
    }

    TokenKind kindAt(int offset) {
        return kinds[offset];
    }

    /** 覆盖的词元个数。 */
    public int span() {
        return kinds.length;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PatternElement that = (PatternElement) o;
        return slot == that.slot
                && slotIndex == that.slotIndex
                && literalKind == that.literalKind
                && Objects.equals(literal, that.literal)
                && Arrays.equals(kinds, that.kinds)
                && open.equals(that.open)
                && close.equals(that.close);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(slot, literalKind, literal, slotIndex, open, close);
        return 31 * result + Arrays.hashCode(kinds);
    }

    @Override
    public String toString() {
        return slot
                ? "SLOT#" + slotIndex + Arrays.toString(kinds)
                : literalKind + "'" + literal + "'";
    }
}
