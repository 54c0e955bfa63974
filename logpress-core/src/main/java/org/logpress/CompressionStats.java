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

import java.time.Duration;

/** 一次压缩的统计。 */
public final class CompressionStats {

    private final int logCount;
    private final int templateCount;
    private final int unmatchedCount;
    private final long originalSize;
    private final long compressedSize;
    private final Duration compressionTime;

    public CompressionStats(
            int logCount,
            int templateCount,
            int unmatchedCount,
            long originalSize,
            long compressedSize,
            Duration compressionTime) {
        this.logCount = logCount;
        this.templateCount = templateCount;
        this.unmatchedCount = unmatchedCount;
        this.originalSize = originalSize;
        this.compressedSize = compressedSize;
        this.compressionTime = compressionTime;
    }

    public int logCount() {
        return logCount;
    }

    /** 不含 UNMATCHED 的模板数。 */
    public int templateCount() {
        return templateCount;
    }

    public int unmatchedCount() {
        return unmatchedCount;
    }

    /** 原始大小: 各行 UTF-8 字节数,每行另加一个换行符。 */
    public long originalSize() {
        return originalSize;
    }

    public long compressedSize() {
        return compressedSize;
    }

    /** 原始大小与容器大小之比,空输入时为 0。 */
    public double compressionRatio() {
        return originalSize == 0 ? 0.0 : (double) originalSize / compressedSize;
    }

    public Duration compressionTime() {
        return compressionTime;
    }

    @Override
    public String toString() {
        return String.format(
                "CompressionStats{logs=%d, templates=%d, unmatched=%d, original=%d, "
                        + "compressed=%d, ratio=%.2f, time=%dms}",
                logCount,
                templateCount,
                unmatchedCount,
                originalSize,
                compressedSize,
                compressionRatio(),
                compressionTime.toMillis());
    }
}
