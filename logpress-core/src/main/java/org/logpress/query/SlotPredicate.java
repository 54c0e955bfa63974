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

package org.logpress.query;

import org.logpress.utils.Preconditions;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * 作用于单个槽位值的谓词。
 *
 * <p>谓词必须是值的纯函数: 对字典列和词元池列,查询引擎对每个不同的值只求值一次。
 */
public final class SlotPredicate {

    private final String description;
    private final Predicate<String> predicate;

    private SlotPredicate(String description, Predicate<String> predicate) {
        this.description = description;
        this.predicate = predicate;
    }

    public boolean test(String value) {
        return predicate.test(value);
    }

    public static SlotPredicate equalTo(String expected) {
        Preconditions.checkNotNull(expected);
        return new SlotPredicate("= '" + expected + "'", expected::equals);
    }

    public static SlotPredicate equalToIgnoreCase(String expected) {
        Preconditions.checkNotNull(expected);
        return new SlotPredicate("=~ '" + expected + "'", expected::equalsIgnoreCase);
    }

    public static SlotPredicate contains(String part) {
        Preconditions.checkNotNull(part);
        return new SlotPredicate("contains '" + part + "'", v -> v.contains(part));
    }

    public static SlotPredicate startsWith(String prefix) {
        Preconditions.checkNotNull(prefix);
        return new SlotPredicate("starts with '" + prefix + "'", v -> v.startsWith(prefix));
    }

    public static SlotPredicate in(Collection<String> values) {
        Set<String> set = new HashSet<>(values);
        return new SlotPredicate("in " + set, set::contains);
    }

    public static SlotPredicate in(String... values) {
        return in(Arrays.asList(values));
    }

    /** 正则表达式在值的某处匹配即可,与 {@link java.util.regex.Matcher#find()} 相同。 */
    public static SlotPredicate matches(String regex) {
        Pattern pattern = Pattern.compile(regex);
        return new SlotPredicate("matches /" + regex + "/", v -> pattern.matcher(v).find());
    }

    public SlotPredicate negate() {
        return new SlotPredicate("not " + description, predicate.negate());
    }

    @Override
    public String toString() {
        return description;
    }
}
