package com.relcore.command;

import com.relcore.expression.AttributeReference;
import com.relcore.row.Row;
import com.relcore.session.Session;
import com.relcore.types.StringType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Sets or lists configuration values.
 *
 * <ul>
 *   <li>key and value: sets the key, returns the new pair</li>
 *   <li>key only: returns the current value, or {@code <undefined>}</li>
 *   <li>neither: returns every setting</li>
 * </ul>
 */
public final class SetCommand extends RunnableCommand {

    private final String key;
    private final String value;
    private final List<AttributeReference> output = List.of(
        new AttributeReference("key", StringType.get(), false),
        new AttributeReference("value", StringType.get(), true));

    public SetCommand(String key, String value) {
        if (key == null && value != null) {
            throw new IllegalArgumentException("value given without a key");
        }
        this.key = key;
        this.value = value;
    }

    public String key() {
        return key;
    }

    public String value() {
        return value;
    }

    @Override
    public List<Row> run(Session session) {
        if (key != null && value != null) {
            session.setConf(key, value);
            return List.of(Row.of(key, value));
        }
        if (key != null) {
            return List.of(Row.of(key, session.getConf(key, "<undefined>")));
        }
        List<Row> rows = new ArrayList<>();
        for (Map.Entry<String, String> entry : session.conf().getAllConfs().entrySet()) {
            rows.add(Row.of(entry.getKey(), entry.getValue()));
        }
        return rows;
    }

    @Override
    public List<AttributeReference> output() {
        return output;
    }

    @Override
    protected List<Object> args() {
        return Arrays.asList(key, value);
    }

    @Override
    public String argString() {
        return key == null ? "" : value == null ? key : key + "=" + value;
    }
}
