package com.forecastplatform.retrieval.query;

/**
 * Removes characters that news search endpoints reject or treat as operators, in both raw
 * and percent-encoded form.
 */
public final class QueryCleaner {

    private static final String[] FORBIDDEN = {
        "%5B", "%5D", "%2F", "%5C", "%3A", "%5E", "[", "]", "/", "\\", ":", "^"
    };

    private QueryCleaner() {}

    public static String clean(String query) {
        if (query == null) return "";
        String cleaned = query;
        for (String token : FORBIDDEN) {
            cleaned = cleaned.replace(token, "");
        }
        return cleaned.trim().replaceAll("\\s{2,}", " ");
    }
}
