package com.relcore.session;

import com.relcore.analysis.UnresolvedRelation;
import com.relcore.exception.ParseException;
import com.relcore.exception.TableNotFoundException;
import com.relcore.exception.UnsupportedDialectException;
import com.relcore.logical.LogicalPlan;
import com.relcore.row.Row;
import com.relcore.test.Fixtures;
import com.relcore.test.TestBase;
import com.relcore.test.TestCategories;

import org.junit.jupiter.api.*;
import static org.assertj.core.api.Assertions.*;

import java.util.List;

/**
 * Tests for {@link Session} wiring.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Session Tests")
public class SessionTest extends TestBase {

    /** Accepts {@code FROM <table>} only. */
    private static LogicalPlan parseFrom(String sqlText) {
        String[] words = sqlText.trim().split("\\s+");
        if (words.length != 2 || !words[0].equalsIgnoreCase("from")) {
            throw new ParseException("Expected FROM <table>: " + sqlText);
        }
        return new UnresolvedRelation(words[1]);
    }

    @Nested
    @DisplayName("Dialects")
    class DialectTests {

        @Test
        @DisplayName("Query text is parsed by the parser of the configured dialect")
        void testSqlUsesDialectParser() {
            Session session = Session.builder().parser("sql", SessionTest::parseFrom).build();
            Fixtures.people(session).registerTempTable("people");

            List<Row> rows = session.sql("FROM people").collect();

            assertThat(rows).containsExactlyElementsOf(Fixtures.PEOPLE);
        }

        @Test
        @DisplayName("A dialect without a parser is rejected")
        void testUnsupportedDialect() {
            Session session = Session.builder()
                .parser("sql", SessionTest::parseFrom)
                .config(SQLConf.DIALECT, "hiveql")
                .build();

            assertThatThrownBy(() -> session.sql("FROM people"))
                .isInstanceOf(UnsupportedDialectException.class)
                .hasMessageContaining("hiveql");
        }

        @Test
        @DisplayName("Switching the dialect at runtime picks another parser")
        void testSwitchDialect() {
            Session session = Session.builder()
                .parser("sql", SessionTest::parseFrom)
                .parser("upper", text -> parseFrom(text.toLowerCase()))
                .build();

            session.setConf(SQLConf.DIALECT, "upper");

            assertThat(session.parseSql("FROM PEOPLE"))
                .isInstanceOfSatisfying(UnresolvedRelation.class,
                    relation -> assertThat(relation.tableIdentifier()).containsExactly("people"));
        }

        @Test
        @DisplayName("Parse errors surface unchanged")
        void testParseError() {
            Session session = Session.builder().parser("sql", SessionTest::parseFrom).build();

            assertThatThrownBy(() -> session.sql("SELECT 1")).isInstanceOf(ParseException.class);
        }
    }

    @Nested
    @DisplayName("Configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("System properties with the configuration prefix are picked up")
        void testSystemProperties() {
            System.setProperty(SQLConf.SHUFFLE_PARTITIONS, "7");
            try {
                Session session = Session.builder().build();

                assertThat(session.conf().numShufflePartitions()).isEqualTo(7);
            } finally {
                System.clearProperty(SQLConf.SHUFFLE_PARTITIONS);
            }
        }

        @Test
        @DisplayName("Builder settings override system properties")
        void testBuilderOverridesSystemProperties() {
            System.setProperty(SQLConf.SHUFFLE_PARTITIONS, "7");
            try {
                Session session = Session.builder().config(SQLConf.SHUFFLE_PARTITIONS, "3").build();

                assertThat(session.getConf(SQLConf.SHUFFLE_PARTITIONS)).isEqualTo("3");
            } finally {
                System.clearProperty(SQLConf.SHUFFLE_PARTITIONS);
            }
        }

        @Test
        @DisplayName("Case sensitivity setting reaches the catalog")
        void testCaseInsensitiveCatalog() {
            Session session = Session.builder().config(SQLConf.CASE_SENSITIVE, "false").build();
            Fixtures.people(session).registerTempTable("People");

            assertThat(session.table("PEOPLE").count()).isEqualTo(5L);
        }

        @Test
        @DisplayName("Sessions do not share state")
        void testIsolation() {
            Session first = Fixtures.session();
            Session second = Fixtures.session();
            Fixtures.people(first).registerTempTable("people");
            first.setConf("custom.key", "1");

            assertThatThrownBy(() -> second.table("people")).isInstanceOf(TableNotFoundException.class);
            assertThat(second.getConf("custom.key", "none")).isEqualTo("none");
        }
    }

    @Nested
    @DisplayName("Temporary Tables")
    class TempTableTests {

        @Test
        @DisplayName("Dropping an unknown table does nothing")
        void testDropUnknown() {
            Session session = Fixtures.session();

            assertThatCode(() -> session.dropTempTable("missing")).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Rows that do not fit the schema are rejected")
        void testCreateDataFrameValidates() {
            Session session = Fixtures.session();

            assertThatThrownBy(() -> session.createDataFrame(List.of(Row.of(1, "x")), Fixtures.PEOPLE_SCHEMA))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("4 fields");
            assertThatThrownBy(() -> session.createDataFrame(List.of(Row.of(null, "x")), Fixtures.DEPTS_SCHEMA))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dept_id");
            assertThatThrownBy(() -> session.createDataFrame(List.of(Row.of("10", "x")), Fixtures.DEPTS_SCHEMA))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Re-registering a name replaces the table")
        void testReplace() {
            Session session = Fixtures.session();
            Fixtures.people(session).registerTempTable("t");
            Fixtures.depts(session).registerTempTable("t");

            assertThat(session.table("t").columns()).containsExactly("dept_id", "dept_name");
        }
    }
}
