package com.querytuner.model.stats;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Value in a version's execution statistics: a number, a string, a boolean, or a nested
 * map of further values. Nothing else can be constructed, which keeps the JSON stored for
 * a version well-defined.
 */
public final class StatValue {

    public enum Kind {
        NUMBER,
        STRING,
        BOOLEAN,
        MAP
    }

    private final Kind kind;
    private final Number number;
    private final String text;
    private final Boolean flag;
    private final Map<String, StatValue> map;

    private StatValue(Kind kind, Number number, String text, Boolean flag, Map<String, StatValue> map) {
        this.kind = kind;
        this.number = number;
        this.text = text;
        this.flag = flag;
        this.map = map;
    }

    public static StatValue of(Number number) {
        Preconditions.checkNotNull(number, "number cannot be null");
        return new StatValue(Kind.NUMBER, number, null, null, null);
    }

    public static StatValue of(String text) {
        Preconditions.checkNotNull(text, "text cannot be null");
        return new StatValue(Kind.STRING, null, text, null, null);
    }

    public static StatValue of(boolean flag) {
        return new StatValue(Kind.BOOLEAN, null, null, flag, null);
    }

    public static StatValue of(Map<String, StatValue> nested) {
        Preconditions.checkNotNull(nested, "nested map cannot be null");
        return new StatValue(Kind.MAP, null, null, null, Collections.unmodifiableMap(new LinkedHashMap<>(nested)));
    }

    /**
     * Read a value back from JSON. Arrays and nulls have no counterpart and are rejected.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static StatValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new IllegalArgumentException("Statistic value cannot be null");
        }
        if (node.isBoolean()) {
            return of(node.booleanValue());
        }
        if (node.isNumber()) {
            return of(node.numberValue());
        }
        if (node.isTextual()) {
            return of(node.textValue());
        }
        if (node.isObject()) {
            Map<String, StatValue> nested = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                nested.put(field.getKey(), fromJson(field.getValue()));
            }
            return of(nested);
        }
        throw new IllegalArgumentException("Unsupported statistic value: " + node.getNodeType());
    }

    @JsonValue
    public Object toJson() {
        switch (kind) {
            case NUMBER:
                return number;
            case STRING:
                return text;
            case BOOLEAN:
                return flag;
            default:
                return map;
        }
    }

    public Kind getKind() {
        return kind;
    }

    public Number asNumber() {
        expect(Kind.NUMBER);
        return number;
    }

    public String asString() {
        expect(Kind.STRING);
        return text;
    }

    public boolean asBoolean() {
        expect(Kind.BOOLEAN);
        return flag;
    }

    public Map<String, StatValue> asMap() {
        expect(Kind.MAP);
        return map;
    }

    private void expect(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Statistic is " + kind + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StatValue other)) {
            return false;
        }
        return kind == other.kind && Objects.equals(toJson(), other.toJson());
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, toJson());
    }

    @Override
    public String toString() {
        return String.valueOf(toJson());
    }
}
