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

package org.logpress.schema;

/** 两个模式版本之间的查询兼容级别,按兼容程度由高到低排列。 */
public enum CompatibilityLevel {

    /** 结构完全相同。 */
    IDENTICAL,

    /** 只新增了槽位,旧查询在新版本上仍然成立。 */
    BACKWARD_COMPATIBLE,

    /** 没有删除槽位,但有槽位的语义类型改变,查询需要做类型转换。 */
    COMPATIBLE_WITH_CAST,

    /** 有槽位被删除,引用这些槽位的查询会失败。 */
    INCOMPATIBLE
}
