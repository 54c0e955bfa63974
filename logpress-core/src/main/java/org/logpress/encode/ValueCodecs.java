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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** {@link ColumnCodec} 到 {@link ValueCodec} 的固定映射。 */
public class ValueCodecs {

    private static final Map<ColumnCodec, ValueCodec> CODECS;

    static {
        Map<ColumnCodec, ValueCodec> codecs = new EnumMap<>(ColumnCodec.class);
        register(codecs, new DeltaTimestampCodec());
        register(codecs, new GorillaTimestampCodec());
        register(codecs, new DictionaryCodec());
        register(codecs, new ZigZagVarintCodec());
        register(codecs, new DoubleCodec());
        register(codecs, new PoolIndexCodec());
        register(codecs, new VerbatimCodec());
        CODECS = Collections.unmodifiableMap(codecs);
    }

    private ValueCodecs() {}

    private static void register(Map<ColumnCodec, ValueCodec> codecs, ValueCodec codec) {
        codecs.put(codec.codec(), codec);
    }

    public static ValueCodec of(ColumnCodec codec) {
        return CODECS.get(codec);
    }
}
