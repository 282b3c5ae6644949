package io.httpr.client;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Appends query parameters to a URI, keys in lexicographic order and values in insertion order.
 */
final class Urls {
    private Urls() {}

    static URI withQuery(URI base, Map<String, List<String>> params) {
        Objects.requireNonNull(base, "base");
        if (params == null || params.isEmpty()) return base;

        TreeMap<String, List<String>> sorted = new TreeMap<>(params);
        StringBuilder query = new StringBuilder();
        for (Map.Entry<String, List<String>> e : sorted.entrySet()) {
            for (String value : e.getValue()) {
                if (query.length() > 0) query.append('&');
                query.append(encode(e.getKey())).append('=').append(encode(value));
            }
        }

        String s = base.toString();
        String fragment = null;
        int hash = s.indexOf('#');
        if (hash >= 0) {
            fragment = s.substring(hash);
            s = s.substring(0, hash);
        }
        StringBuilder sb = new StringBuilder(s);
        String existing = base.getRawQuery();
        if (existing == null || existing.isEmpty()) {
            if (!s.endsWith("?")) sb.append('?');
        } else {
            sb.append('&');
        }
        sb.append(query);
        if (fragment != null) sb.append(fragment);
        return URI.create(sb.toString());
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
