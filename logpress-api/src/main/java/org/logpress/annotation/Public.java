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

package org.logpress.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Target;

/**
 * 标记公共 API 的注解。
 *
 * <p>被标记的类、接口和方法属于 LogPress 对外稳定的接口,例如压缩入口 {@code LogCompressor}、
 * 查询引擎 {@code LogQueryEngine} 以及配置项 {@code LogPressOptions}。在次版本之间保持兼容。
 */
@Documented
@Target(ElementType.TYPE)
@Public
public @interface Public {}
