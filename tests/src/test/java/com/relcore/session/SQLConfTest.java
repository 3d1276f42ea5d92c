package com.relcore.session;

import com.relcore.test.TestBase;
import com.relcore.test.TestCategories;

import org.junit.jupiter.api.*;
import static org.assertj.core.api.Assertions.*;

import java.util.NoSuchElementException;
import java.util.Properties;

/**
 * Tests for {@link SQLConf}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("SQLConf Tests")
public class SQLConfTest extends TestBase {

    private SQLConf conf;

    @Override
    protected void doSetUp() {
        conf = new SQLConf();
    }

    @Test
    @DisplayName("Recognised keys fall back to their defaults")
    void testDefaults() {
        assertThat(conf.dialect()).isEqualTo("sql");
        assertThat(conf.codegenEnabled()).isFalse();
        assertThat(conf.numShufflePartitions()).isEqualTo(200);
        assertThat(conf.caseSensitive()).isTrue();
        assertThat(conf.columnBatchSize()).isEqualTo(10000);
        assertThat(conf.columnNameOfCorruptRecord()).isEqualTo("_corrupt_record");
        assertThat(conf.getAllConfs()).isEmpty();
    }

    @Test
    @DisplayName("Explicit values override defaults")
    void testOverride() {
        conf.setConf(SQLConf.SHUFFLE_PARTITIONS, "8");
        conf.setConf(SQLConf.CODEGEN_ENABLED, "true");

        assertThat(conf.numShufflePartitions()).isEqualTo(8);
        assertThat(conf.codegenEnabled()).isTrue();
        assertThat(conf.getAllConfs()).containsOnlyKeys(SQLConf.CODEGEN_ENABLED, SQLConf.SHUFFLE_PARTITIONS);
    }

    @Test
    @DisplayName("Unknown keys without a value are rejected")
    void testUnknownKey() {
        assertThatThrownBy(() -> conf.getConf("relcore.sql.unknown"))
            .isInstanceOf(NoSuchElementException.class)
            .hasMessage("relcore.sql.unknown");
        assertThat(conf.getConf("relcore.sql.unknown", "fallback")).isEqualTo("fallback");
    }

    @Test
    @DisplayName("The explicit default wins over the built-in default")
    void testExplicitDefault() {
        assertThat(conf.getConf(SQLConf.SHUFFLE_PARTITIONS, "3")).isEqualTo("3");
    }

    @Test
    @DisplayName("Null keys and values are rejected")
    void testNulls() {
        assertThatThrownBy(() -> conf.setConf(null, "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> conf.setConf("k", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("k");
    }

    @Test
    @DisplayName("Numeric settings are validated when read")
    void testInvalidNumbers() {
        conf.setConf(SQLConf.SHUFFLE_PARTITIONS, "many");
        assertThatThrownBy(conf::numShufflePartitions).isInstanceOf(IllegalArgumentException.class);

        conf.setConf(SQLConf.COLUMN_BATCH_SIZE, "0");
        assertThatThrownBy(conf::columnBatchSize)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("positive");
    }

    @Test
    @DisplayName("Properties are copied in bulk and clear removes them")
    void testPropertiesAndClear() {
        Properties props = new Properties();
        props.setProperty(SQLConf.DIALECT, "hiveql");
        props.setProperty("custom.key", "v");

        conf.setConf(props);
        assertThat(conf.dialect()).isEqualTo("hiveql");
        assertThat(conf.getConf("custom.key")).isEqualTo("v");

        conf.clear();
        assertThat(conf.dialect()).isEqualTo("sql");
    }
}
