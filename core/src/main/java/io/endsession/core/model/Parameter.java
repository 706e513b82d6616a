package io.endsession.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.List;
import java.util.Objects;

/**
 * A single protocol parameter or property value. Exactly one of three kinds:
 *
 * <ul>
 * <li>{@link Kind#STRING}: a single string value.
 * <li>{@link Kind#STRING_LIST}: an ordered list of string values (e.g. a parameter repeated in
 * a query string).
 * <li>{@link Kind#JSON}: a structured value, typically a JSON object.
 * </ul>
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class Parameter {

    /** The kind of value held by a parameter. */
    public enum Kind {
        STRING,
        STRING_LIST,
        JSON
    }

    private final Kind kind;
    private final String string;
    private final List<String> strings;
    private final JsonNode json;

    private Parameter(Kind kind, String string, List<String> strings, JsonNode json) {
        this.kind = kind;
        this.string = string;
        this.strings = strings;
        this.json = json;
    }

    /** Creates a single-valued parameter. */
    public static Parameter of(String value) {
        Objects.requireNonNull(value, "value must not be null");
        return new Parameter(Kind.STRING, value, null, null);
    }

    /** Creates a multi-valued parameter. The list is copied. */
    public static Parameter of(List<String> values) {
        Objects.requireNonNull(values, "values must not be null");
        return new Parameter(Kind.STRING_LIST, null, List.copyOf(values), null);
    }

    /** Creates a multi-valued parameter from the given values. */
    public static Parameter of(String first, String... rest) {
        Objects.requireNonNull(first, "first must not be null");
        String[] all = new String[rest.length + 1];
        all[0] = first;
        System.arraycopy(rest, 0, all, 1, rest.length);
        return new Parameter(Kind.STRING_LIST, null, List.of(all), null);
    }

    /** Creates a structured parameter. The node is deep-copied. */
    public static Parameter json(JsonNode value) {
        Objects.requireNonNull(value, "value must not be null");
        return new Parameter(Kind.JSON, null, null, value.deepCopy());
    }

    public Kind kind() {
        return kind;
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    public boolean isList() {
        return kind == Kind.STRING_LIST;
    }

    public boolean isJson() {
        return kind == Kind.JSON;
    }

    /**
     * Returns the value as a single string: the string itself, the first list element, or the
     * compact JSON text. Returns {@code null} for an empty list.
     */
    public String asString() {
        return switch (kind) {
            case STRING -> string;
            case STRING_LIST -> strings.isEmpty() ? null : strings.get(0);
            case JSON -> json.isTextual() ? json.asText() : json.toString();
        };
    }

    /** Returns the value as a list of strings; a single string becomes a one-element list. */
    public List<String> asList() {
        return switch (kind) {
            case STRING -> List.of(string);
            case STRING_LIST -> strings;
            case JSON -> List.of(asString());
        };
    }

    /** Converts the value to a JSON node: a text node, an array of text nodes, or a copy of the structure. */
    public JsonNode toJson() {
        return switch (kind) {
            case STRING -> JsonNodeFactory.instance.textNode(string);
            case STRING_LIST -> {
                ArrayNode array = JsonNodeFactory.instance.arrayNode();
                strings.forEach(array::add);
                yield array;
            }
            case JSON -> json.deepCopy();
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Parameter that)) return false;
        return kind == that.kind
                && Objects.equals(string, that.string)
                && Objects.equals(strings, that.strings)
                && Objects.equals(json, that.json);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, string, strings, json);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case STRING -> string;
            case STRING_LIST -> strings.toString();
            case JSON -> json.toString();
        };
    }
}
