package com.stratumduck.sampling;

import com.stratumduck.backend.RelationName;
import com.stratumduck.exception.EmptyInputException;
import com.stratumduck.exception.InvalidArgumentException;
import com.stratumduck.exception.RelationAlreadyExistsException;
import com.stratumduck.exception.RelationNotFoundException;
import com.stratumduck.exception.SamplingException;
import com.stratumduck.exception.SchemaMismatchException;
import com.stratumduck.logging.SamplingLogger;
import com.stratumduck.test.DuckDBTestBase;
import com.stratumduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests of {@link StratifiedSampler} on DuckDB.
 */
@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("Stratified Sampler Integration Tests")
public class StratifiedSamplerIntegrationTest extends DuckDBTestBase {

    private StratifiedSampler sampler;

    @Override
    protected void setUpData() {
        sampler = new StratifiedSampler(backend, SamplerConfig.defaults());
    }

    @Nested
    @DisplayName("Sampling")
    class Sampling {

        @ParameterizedTest(name = "withReplacement={0}")
        @ValueSource(booleans = {false, true})
        @DisplayName("Two strata of 12 and 6 rows at p=0.5 yield 6 and 3 rows")
        void testTwoStrata(boolean withReplacement) {
            logStep("Given: strata of 12 and 6 rows");
            createStratifiedTable("src", 12, 6);

            logStep("When: sampling half of each stratum");
            sampler.sample("src", "out", 0.5, List.of("stratum"), null, withReplacement);

            logStep("Then: each stratum contributes half its rows");
            Map<Object, Long> counts = countsBy("out", "stratum");
            logData("Per-stratum counts", counts);
            assertThat(counts).containsOnly(entry("s1", 6L), entry("s2", 3L));
            assertThat(stagingRelations()).isEmpty();
        }

        @Test
        @DisplayName("Ungrouped sampling keeps floor(total * p) rows")
        void testUngrouped() {
            createStratifiedTable("src", 12, 6);

            sampler.sample("src", "out", 0.25);

            assertThat(count("out")).isEqualTo(4);
            assertThat(backend.columns(RelationName.parse("out")))
                .containsExactly("id", "stratum", "payload");
        }

        @Test
        @DisplayName("A singleton stratum survives a small proportion")
        void testSingletonStratum() {
            createStratifiedTable("src", 1, 10);

            sampler.sample("src", "out", 0.5, List.of("stratum"), null, false);

            assertThat(countsBy("out", "stratum")).containsEntry("s1", 1L).containsEntry("s2", 5L);
        }

        @Test
        @DisplayName("NULL key values form their own stratum")
        void testNullStratum() {
            sql("CREATE TABLE src AS SELECT i AS id, CASE WHEN i < 8 THEN NULL ELSE 'x' END AS grp"
                + " FROM range(12) t(i)");

            sampler.sample("src", "out", 0.5, List.of("grp"), null, false);
            sampler.sample("src", "out_wr", 0.5, List.of("grp"), null, true);

            assertThat(scalar("SELECT COUNT(*) FROM out WHERE grp IS NULL")).isEqualTo(4);
            assertThat(scalar("SELECT COUNT(*) FROM out WHERE grp = 'x'")).isEqualTo(2);
            assertThat(scalar("SELECT COUNT(*) FROM out_wr WHERE grp IS NULL")).isEqualTo(4);
            assertThat(scalar("SELECT COUNT(*) FROM out_wr WHERE grp = 'x'")).isEqualTo(2);
        }

        @Test
        @DisplayName("Explicit targets overlapping the keys emit the key once")
        void testTargetsOverlapKeys() {
            createStratifiedTable("src", 4, 4);

            sampler.sample("src", "out", 0.5, List.of("stratum"), List.of("STRATUM", "id"), false);

            assertThat(backend.columns(RelationName.parse("out"))).containsExactly("stratum", "id");
        }

        @Test
        @DisplayName("Key columns are appended after explicit targets")
        void testKeysAppended() {
            createStratifiedTable("src", 4, 4);

            sampler.sample("src", "out", 0.5, List.of("stratum"), List.of("payload"), true);

            assertThat(backend.columns(RelationName.parse("out"))).containsExactly("payload", "stratum");
        }

        @Test
        @DisplayName("Identifiers needing quotes work end to end")
        void testQuotedIdentifiers() {
            sql("CREATE TABLE \"my source\" AS SELECT i AS \"select\", i % 2 AS \"group \"\"key\"\"\","
                + " 'v' || i AS \"Value Col\" FROM range(20) t(i)");

            sampler.sample("my source", "my \"output\"", 0.5,
                List.of("group \"key\""), List.of("select", "Value Col"), false);
            sampler.sample("my source", "order", 0.5,
                List.of("group \"key\""), null, true);

            assertThat(count("my \"output\"")).isEqualTo(10);
            assertThat(backend.columns(RelationName.parse("my \"output\"")))
                .containsExactly("select", "Value Col", "group \"key\"");
            assertThat(count("order")).isEqualTo(10);
        }

        @Test
        @DisplayName("Schema-qualified relations keep staging in the source schema")
        void testSchemaQualified() {
            sql("CREATE SCHEMA lake");
            sql("CREATE SCHEMA mart");
            sql("CREATE TABLE lake.events AS SELECT i AS id, i % 4 AS kind FROM range(40) t(i)");

            sampler.sample("lake.events", "mart.events_sample", 0.5, List.of("kind"), null, false);

            assertThat(count("mart.events_sample")).isEqualTo(20);
            assertThat(exists("main.events_sample")).isFalse();
            assertThat(rows("SELECT table_name FROM information_schema.tables"
                + " WHERE table_schema = 'lake' AND table_name <> 'events'")).isEmpty();
        }

        @Test
        @DisplayName("Seeded requests are reproducible in both modes")
        void testSeeded() {
            createStratifiedTable("src", 50, 30);

            for (boolean withReplacement : new boolean[] {false, true}) {
                String suffix = withReplacement ? "_wr" : "_wor";
                for (String name : List.of("a", "b")) {
                    sampler.sample(SamplingRequest.builder("src", name + suffix, 0.4)
                        .groupingKeys(List.of("stratum"))
                        .withReplacement(withReplacement)
                        .seed(2024L)
                        .build());
                }
                assertThat(rows("SELECT id FROM a" + suffix + " ORDER BY id"))
                    .isEqualTo(rows("SELECT id FROM b" + suffix + " ORDER BY id"));
            }
        }

        @Test
        @DisplayName("The source relation is left unchanged")
        void testSourceUnchanged() {
            createStratifiedTable("src", 30, 30);
            List<List<Object>> before = rows("SELECT * FROM src ORDER BY id");

            sampler.sample("src", "out", 0.3, List.of("stratum"), null, false);
            sampler.sample("src", "out2", 0.3, List.of("stratum"), null, true);

            assertThat(rows("SELECT * FROM src ORDER BY id")).isEqualTo(before);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Existing output is reported and left untouched")
        void testOutputExists() {
            createStratifiedTable("src", 5);
            sql("CREATE TABLE out AS SELECT 1 AS marker");

            assertThatThrownBy(() -> sampler.sample("src", "out", 0.5))
                .isInstanceOf(RelationAlreadyExistsException.class)
                .extracting(e -> ((SamplingException) e).kind())
                .isEqualTo(SamplingException.Kind.ALREADY_EXISTS);

            assertThat(rows("SELECT * FROM out")).containsExactly(List.of(1));
            assertThat(stagingRelations()).isEmpty();
        }

        @Test
        @DisplayName("Empty source creates nothing")
        void testEmptySource() {
            sql("CREATE TABLE src (id INTEGER, grp VARCHAR)");

            assertThatThrownBy(() -> sampler.sample("src", "out", 0.5, List.of("grp"), null, true))
                .isInstanceOf(EmptyInputException.class);

            assertThat(exists("out")).isFalse();
        }

        @Test
        @DisplayName("Missing source creates nothing")
        void testMissingSource() {
            assertThatThrownBy(() -> sampler.sample("nope", "out", 0.5))
                .isInstanceOf(RelationNotFoundException.class);
            assertThat(exists("out")).isFalse();
        }

        @ParameterizedTest
        @ValueSource(doubles = {0.0, -0.5, 1.01, Double.NaN})
        @DisplayName("Out-of-range proportions are rejected")
        void testBadProportion(double p) {
            createStratifiedTable("src", 5);

            assertThatThrownBy(() -> sampler.sample("src", "out", p))
                .isInstanceOf(InvalidArgumentException.class);
            assertThat(exists("out")).isFalse();
        }

        @Test
        @DisplayName("Unknown columns are reported together")
        void testUnknownColumns() {
            createStratifiedTable("src", 5);

            assertThatThrownBy(() -> sampler.sample("src", "out", 0.5,
                List.of("region"), List.of("id", "amount"), false))
                .isInstanceOf(SchemaMismatchException.class)
                .hasMessageContaining("region")
                .hasMessageContaining("amount");
            assertThat(exists("out")).isFalse();
        }

        @Test
        @DisplayName("Seeded sampling refuses a source whose rowid column hides row identity")
        void testSeededRowidColumn() {
            sql("CREATE TABLE src AS SELECT 0 AS rowid, CASE WHEN i < 10 THEN 'a' ELSE 'b' END AS grp"
                + " FROM range(20) t(i)");

            assertThatThrownBy(() -> sampler.sample(SamplingRequest.builder("src", "out", 0.5)
                .groupingKeys(List.of("grp"))
                .seed(7L)
                .build()))
                .isInstanceOf(InvalidArgumentException.class);
            assertThat(exists("out")).isFalse();

            logStep("Unseeded sampling of the same source still selects half of each stratum");
            sampler.sample("src", "out", 0.5, List.of("grp"), null, false);
            assertThat(count("out")).isEqualTo(10);
        }

        @Test
        @DisplayName("Logging context is cleared after a failure")
        void testContextCleared() {
            assertThatThrownBy(() -> sampler.sample("nope", "out", 0.5))
                .isInstanceOf(RelationNotFoundException.class);

            assertThat(MDC.get(SamplingLogger.MDC_INVOCATION_ID)).isNull();
            assertThat(MDC.get(SamplingLogger.MDC_STAGE)).isNull();
        }
    }
}
