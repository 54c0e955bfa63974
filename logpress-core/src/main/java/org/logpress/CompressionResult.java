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

package org.logpress;

/** 压缩结果: 容器字节和统计。 */
public final class CompressionResult {

    private final byte[] container;
    private final CompressionStats stats;

    public CompressionResult(byte[] container, CompressionStats stats) {
        this.container = container;
        this.stats = stats;
    }

    public byte[] container() {
        return container;
    }

    public CompressionStats stats() {
        return stats;
    }
}
