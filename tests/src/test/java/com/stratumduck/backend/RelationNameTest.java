package com.stratumduck.backend;

import com.stratumduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Relation Name Tests")
public class RelationNameTest {

    @Test
    void testUnqualifiedUsesMain() {
        RelationName name = RelationName.parse("sales");
        assertThat(name.schema()).isEqualTo("main");
        assertThat(name.table()).isEqualTo("sales");
        assertThat(name.toSQL()).isEqualTo("\"main\".\"sales\"");
    }

    @Test
    void testQualified() {
        RelationName name = RelationName.parse("lake.events.2024");
        assertThat(name.schema()).isEqualTo("lake");
        assertThat(name.table()).isEqualTo("events.2024");
        assertThat(name.toString()).isEqualTo("lake.events.2024");
    }

    @Test
    void testQuotesEscaped() {
        assertThat(RelationName.of("s", "a\"b").toSQL()).isEqualTo("\"s\".\"a\"\"b\"");
    }

    @Test
    void testSibling() {
        RelationName staging = RelationName.parse("lake.events").sibling("__strat_x_labeled");
        assertThat(staging).isEqualTo(RelationName.of("lake", "__strat_x_labeled"));
        assertThat(staging.hashCode()).isEqualTo(RelationName.of("lake", "__strat_x_labeled").hashCode());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", ".sales", "main.", "."})
    void testRejectsEmptyParts(String name) {
        assertThatThrownBy(() -> RelationName.parse(name)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testRejectsNull() {
        assertThatThrownBy(() -> RelationName.parse(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
