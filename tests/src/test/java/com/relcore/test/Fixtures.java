package com.relcore.test;

import com.relcore.row.Row;
import com.relcore.session.DataFrame;
import com.relcore.session.Session;
import com.relcore.types.IntegerType;
import com.relcore.types.StringType;
import com.relcore.types.StructField;
import com.relcore.types.StructType;
import java.util.List;

/**
 * Shared test data.
 */
public final class Fixtures {

    public static final StructType PEOPLE_SCHEMA = new StructType(List.of(
        new StructField("id", IntegerType.get(), false),
        new StructField("name", StringType.get(), true),
        new StructField("age", IntegerType.get(), true),
        new StructField("dept", IntegerType.get(), true)));

    public static final List<Row> PEOPLE = List.of(
        Row.of(1, "alice", 34, 10),
        Row.of(2, "bob", 19, 10),
        Row.of(3, "carol", 45, 20),
        Row.of(4, "dave", null, 20),
        Row.of(5, "erin", 28, 30));

    public static final StructType DEPTS_SCHEMA = new StructType(List.of(
        new StructField("dept_id", IntegerType.get(), false),
        new StructField("dept_name", StringType.get(), true)));

    public static final List<Row> DEPTS = List.of(
        Row.of(10, "eng"),
        Row.of(20, "sales"),
        Row.of(40, "legal"));

    private Fixtures() {
    }

    /**
     * Creates a session with few shuffle partitions, so plans stay readable.
     *
     * @return the session
     */
    public static Session session() {
        return Session.builder()
            .config("relcore.sql.shuffle.partitions", "4")
            .build();
    }

    public static DataFrame people(Session session) {
        return session.createDataFrame(PEOPLE, PEOPLE_SCHEMA);
    }

    public static DataFrame depts(Session session) {
        return session.createDataFrame(DEPTS, DEPTS_SCHEMA);
    }
}
