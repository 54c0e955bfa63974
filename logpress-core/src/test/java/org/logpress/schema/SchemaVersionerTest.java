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

import org.logpress.LogPressOptions;
import org.logpress.classify.SemanticType;
import org.logpress.options.Options;
import org.logpress.template.LogTemplate;
import org.logpress.template.SlotSpec;
import org.logpress.template.TemplateGenerator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/** Tests for {@link SchemaVersioner}. */
public class SchemaVersionerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private static final List<SlotSpec> V1 =
            Arrays.asList(
                    new SlotSpec("timestamp", SemanticType.TIMESTAMP, 0.95),
                    new SlotSpec("severity", SemanticType.SEVERITY, 0.9));

    private static final List<SlotSpec> V2 =
            Arrays.asList(
                    new SlotSpec("timestamp", SemanticType.TIMESTAMP, 0.95),
                    new SlotSpec("severity", SemanticType.SEVERITY, 0.9),
                    new SlotSpec("message", SemanticType.MESSAGE, 0.3));

    private SchemaVersioner versioner;

    @BeforeEach
    public void setUp() {
        versioner = new SchemaVersioner(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    public void testFirstRegistration() {
        assertThat(versioner.currentVersion("app")).isNull();
        assertThat(versioner.history("app")).isEmpty();

        int version = versioner.register("app", "[TIMESTAMP] [SEVERITY]", V1, 10);

        assertThat(version).isEqualTo(1);
        SchemaVersion current = versioner.currentVersion("app");
        assertThat(current).isNotNull();
        assertThat(current.version()).isEqualTo(1);
        assertThat(current.registeredAt()).isEqualTo(NOW);
        assertThat(current.pattern()).isEqualTo("[TIMESTAMP] [SEVERITY]");
        assertThat(current.sampleCount()).isEqualTo(10);
        assertThat(current.hash()).hasSize(16).matches("[0-9a-f]+");
        assertThat(current.slotTypes())
                .containsExactly(
                        entry("timestamp", SemanticType.TIMESTAMP),
                        entry("severity", SemanticType.SEVERITY));
    }

    @Test
    public void testSameSchemaAccumulatesSamples() {
        versioner.register("app", "[TIMESTAMP] [SEVERITY]", V1, 10);
        int version = versioner.register("app", "[TIMESTAMP] [SEVERITY]", V1, 5);

        assertThat(version).isEqualTo(1);
        assertThat(versioner.history("app")).hasSize(1);
        assertThat(versioner.currentVersion("app").sampleCount()).isEqualTo(15);
    }

    @Test
    public void testConfidenceDoesNotChangeTheFingerprint() {
        List<SlotSpec> lessConfident =
                Arrays.asList(
                        new SlotSpec("timestamp", SemanticType.TIMESTAMP, 0.5),
                        new SlotSpec("severity", SemanticType.SEVERITY, 0.5));

        assertThat(SchemaVersioner.fingerprint("p", lessConfident))
                .isEqualTo(SchemaVersioner.fingerprint("p", V1));
        assertThat(SchemaVersioner.fingerprint("q", V1))
                .isNotEqualTo(SchemaVersioner.fingerprint("p", V1));
    }

    @Test
    public void testAddedSlotIsBackwardCompatible() {
        versioner.register("app", "[TIMESTAMP] [SEVERITY]", V1, 10);
        int version = versioner.register("app", "[TIMESTAMP] [SEVERITY] MESSAGE", V2, 3);

        assertThat(version).isEqualTo(2);
        SchemaComparison comparison = versioner.compare("app", 1, 2);
        assertThat(comparison.fromVersion()).isEqualTo(1);
        assertThat(comparison.toVersion()).isEqualTo(2);
        assertThat(comparison.addedSlots()).containsExactly("message");
        assertThat(comparison.removedSlots()).isEmpty();
        assertThat(comparison.typeChanges()).isEmpty();
        assertThat(comparison.compatibility()).isEqualTo(CompatibilityLevel.BACKWARD_COMPATIBLE);
        assertThat(comparison.isCompatible()).isTrue();

        SchemaComparison reverse = versioner.compare("app", 2, 1);
        assertThat(reverse.removedSlots()).containsExactly("message");
        assertThat(reverse.compatibility()).isEqualTo(CompatibilityLevel.INCOMPATIBLE);
        assertThat(reverse.isCompatible()).isFalse();
    }

    @Test
    public void testTypeChangeNeedsCast() {
        versioner.register("app", "[TIMESTAMP] [SEVERITY]", V1, 10);
        versioner.register(
                "app",
                "[TIMESTAMP] [STATUS]",
                Arrays.asList(
                        new SlotSpec("timestamp", SemanticType.TIMESTAMP, 0.95),
                        new SlotSpec("severity", SemanticType.STATUS, 0.6)),
                4);

        SchemaComparison comparison = versioner.compare("app", 1, 2);
        assertThat(comparison.typeChanges()).containsOnlyKeys("severity");
        assertThat(comparison.typeChanges().get("severity").from())
                .isEqualTo(SemanticType.SEVERITY);
        assertThat(comparison.typeChanges().get("severity").to()).isEqualTo(SemanticType.STATUS);
        assertThat(comparison.compatibility()).isEqualTo(CompatibilityLevel.COMPATIBLE_WITH_CAST);
        assertThat(comparison.isCompatible()).isFalse();
    }

    @Test
    public void testCompatibilityMatrix() {
        versioner.register("app", "[TIMESTAMP] [SEVERITY]", V1, 10);
        versioner.register("app", "[TIMESTAMP] [SEVERITY] MESSAGE", V2, 3);

        Map<Integer, Map<Integer, CompatibilityLevel>> matrix =
                versioner.compatibilityMatrix("app");

        assertThat(matrix).containsOnlyKeys(1, 2);
        assertThat(matrix.get(1))
                .containsExactly(
                        entry(1, CompatibilityLevel.IDENTICAL),
                        entry(2, CompatibilityLevel.BACKWARD_COMPATIBLE));
        assertThat(matrix.get(2))
                .containsExactly(
                        entry(1, CompatibilityLevel.INCOMPATIBLE),
                        entry(2, CompatibilityLevel.IDENTICAL));
        assertThat(versioner.compatibilityMatrix("other")).isEmpty();
    }

    @Test
    public void testSourcesAreIndependent() {
        versioner.register("app", "[TIMESTAMP] [SEVERITY]", V1, 10);
        versioner.register("db", "[TIMESTAMP] [SEVERITY] MESSAGE", V2, 1);

        assertThat(versioner.history("app")).hasSize(1);
        assertThat(versioner.history("db")).hasSize(1);
        assertThat(versioner.currentVersion("db").pattern())
                .isEqualTo("[TIMESTAMP] [SEVERITY] MESSAGE");
    }

    @Test
    public void testUnknownVersions() {
        versioner.register("app", "[TIMESTAMP] [SEVERITY]", V1, 10);

        assertThat(versioner.version("app", 0)).isNull();
        assertThat(versioner.version("app", 2)).isNull();
        assertThat(versioner.version("missing", 1)).isNull();
        assertThatThrownBy(() -> versioner.compare("app", 1, 3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("v3");
    }

    @Test
    public void testRegisterExtractedTemplate() {
        List<String> lines =
                Arrays.asList(
                        "[2005-06-09 06:07:04] [INFO] start",
                        "[2005-06-09 06:07:05] [ERROR] fail",
                        "[2005-06-09 06:07:06] [INFO] start");
        LogTemplate template =
                new TemplateGenerator(new LogPressOptions(new Options()))
                        .extractTemplates(lines)
                        .templates()
                        .get(0);

        assertThat(versioner.register("app", template)).isEqualTo(1);
        assertThat(versioner.register("app", template)).isEqualTo(1);

        SchemaVersion current = versioner.currentVersion("app");
        assertThat(current.pattern()).isEqualTo("[TIMESTAMP] [SEVERITY] MESSAGE");
        assertThat(current.sampleCount()).isEqualTo(6);
        assertThat(current.slotTypes()).containsOnlyKeys("timestamp", "severity", "message");
    }
}
