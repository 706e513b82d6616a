package io.endsession.core.pipeline;

import io.endsession.core.model.Parameter;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Parsing and building of {@code application/x-www-form-urlencoded} strings. */
public final class FormUrlEncoding {

    private FormUrlEncoding() {
        // utility class
    }

    /**
     * Parses a query string or form body (without leading '?') into an insertion-ordered
     * multi-value map. Names without '=' map to an empty value.
     *
     * @throws IllegalArgumentException if a component contains an invalid percent-escape
     */
    public static Map<String, List<String>> parse(String encoded) {
        Map<String, List<String>> params = new LinkedHashMap<>();
        if (encoded == null || encoded.isEmpty()) {
            return params;
        }
        for (String pair : encoded.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            params.computeIfAbsent(decode(key), k -> new ArrayList<>()).add(decode(value));
        }
        return params;
    }

    /**
     * Appends parameters to a URI as query parameters. List values repeat the name; structured
     * values are serialized as compact JSON.
     */
    public static String appendQuery(String target, Map<String, Parameter> parameters) {
        if (parameters.isEmpty()) {
            return target;
        }
        StringBuilder sb = new StringBuilder(target);
        char separator = target.indexOf('?') >= 0 ? '&' : '?';
        boolean needsSeparator = !target.endsWith("?") && !target.endsWith("&");
        for (Map.Entry<String, Parameter> entry : parameters.entrySet()) {
            for (String value : entry.getValue().asList()) {
                if (needsSeparator) {
                    sb.append(separator);
                }
                sb.append(encode(entry.getKey())).append('=').append(encode(value));
                separator = '&';
                needsSeparator = true;
            }
        }
        return sb.toString();
    }

    private static String decode(String component) {
        return URLDecoder.decode(component, StandardCharsets.UTF_8);
    }

    /** Percent-encodes a query component; spaces become {@code %20}. */
    private static String encode(String component) {
        return URLEncoder.encode(component, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
