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

import java.io.IOException;
import java.util.List;

/**
 * 一种列编码的编解码能力,按 {@link ColumnCodec} 选择。
 *
 * <p>编码从不丢弃值: 无法走主编码路径的值进入例外列表。解码遇到损坏的数据抛出
 * {@link IOException}。
 */
public interface ValueCodec {

    ColumnCodec codec();

    EncodedColumn encode(List<String> values, CodecContext context) throws IOException;

    DecodedColumn decode(EncodedColumn column, CodecContext context) throws IOException;
}
