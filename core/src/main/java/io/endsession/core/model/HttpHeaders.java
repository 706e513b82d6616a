package io.endsession.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Case-insensitive, multi-valued HTTP request headers. Names are stored lowercase. Immutable.
 */
public final class HttpHeaders {

    public static final String CONTENT_TYPE = "content-type";
    public static final String REQUEST_ID = "x-request-id";

    private static final HttpHeaders EMPTY = new HttpHeaders(new TreeMap<>());

    private final TreeMap<String, List<String>> values;

    private HttpHeaders(TreeMap<String, List<String>> values) {
        this.values = values;
    }

    /** Headers with one value per name. */
    public static HttpHeaders of(Map<String, String> singleValue) {
        if (singleValue == null || singleValue.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> map = new TreeMap<>();
        singleValue.forEach((name, value) -> append(map, name, List.of(value)));
        return new HttpHeaders(map);
    }

    /** Headers with any number of values per name. Names differing only in case are merged. */
    public static HttpHeaders ofMulti(Map<String, List<String>> multiValue) {
        if (multiValue == null || multiValue.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> map = new TreeMap<>();
        multiValue.forEach((name, list) -> append(map, name, list));
        return new HttpHeaders(map);
    }

    public static HttpHeaders empty() {
        return EMPTY;
    }

    private static void append(TreeMap<String, List<String>> map, String name, List<String> added) {
        map.merge(name.toLowerCase(Locale.ROOT), List.copyOf(added), (current, more) -> {
            List<String> merged = new ArrayList<>(current);
            merged.addAll(more);
            return List.copyOf(merged);
        });
    }

    /**
     * First value of a header (case-insensitive name).
     *
     * @return the value, or {@code null} if the header is absent or blank
     */
    public String first(String name) {
        List<String> list = values.get(name.toLowerCase(Locale.ROOT));
        if (list == null || list.isEmpty() || list.get(0).isBlank()) {
            return null;
        }
        return list.get(0);
    }

    /** Number of distinct header names. */
    public int size() {
        return values.size();
    }

    /** Prints header names only; values may carry credentials. */
    @Override
    public String toString() {
        return "HttpHeaders" + values.keySet();
    }
}
