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

import java.util.function.Supplier;

/**
 * 编解码时的共享环境。
 *
 * <p>词元池通过 {@link Supplier} 提供: 编码时是正在构建的词元池,解码时按需加载,
 * 不引用词元池的列不会触发加载。
 */
public final class CodecContext {

    private final Supplier<TokenPool> pool;
    private final int rleMinRun;

    public CodecContext(Supplier<TokenPool> pool, int rleMinRun) {
        this.pool = pool;
        this.rleMinRun = rleMinRun;
    }

    public TokenPool pool() {
        return pool.get();
    }

    public int rleMinRun() {
        return rleMinRun;
    }
}
