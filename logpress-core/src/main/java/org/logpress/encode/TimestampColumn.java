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

package org.logpress.encode;

import org.logpress.classify.TimestampLayout;

/** 时间戳列: 主路径上的行保存 UTC 毫秒时间,其余行在例外列表中保存原文。 */
public final class TimestampColumn implements DecodedColumn {

    private final TimestampLayout layout;
    private final long[] millis;
    private final ExceptionList exceptions;

    public TimestampColumn(TimestampLayout layout, long[] millis, ExceptionList exceptions) {
        this.layout = layout;
        this.millis = millis;
        this.exceptions = exceptions;
    }

    @Override
    public int size() {
        return millis.length;
    }

    @Override
    public String get(int row) {
        int exception = exceptions.indexOfRow(row);
        if (exception >= 0) {
            return exceptions.value(exception);
        }
        return layout.format(millis[row]);
    }

    public TimestampLayout layout() {
        return layout;
    }

    public boolean isParsed(int row) {
        return !exceptions.containsRow(row);
    }

    /** 主路径上的行的毫秒时间,例外行的结果无意义。 */
    public long millisAt(int row) {
        return millis[row];
    }

    public ExceptionList exceptions() {
        return exceptions;
    }
}
