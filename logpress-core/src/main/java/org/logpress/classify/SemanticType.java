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

import java.util.Locale;

/** 模板变量槽位的语义类型,封闭枚举。 */
public enum SemanticType {
    TIMESTAMP,
    SEVERITY,
    IP_ADDRESS,
    PORT,
    URL,
    EMAIL,
    USER_ID,
    PROCESS_ID,
    ERROR_CODE,
    STATUS,
    HOST,
    PATH,
    METRIC,
    MESSAGE,
    UNKNOWN;

    /** 槽位命名使用的小写名称,如 {@code ip_address}。 */
    public String slotName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** 自由文本类型,相邻的此类槽位可以合并。 */
    public boolean isFreeText() {
        return this == MESSAGE || this == UNKNOWN;
    }
}
