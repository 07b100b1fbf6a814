package com.github.dimitryivaniuta.telemetry.proxy.support;

public final class KqlSupport {
    private KqlSupport() {}

    public static final int LOG_SNIPPET_CHARS = 200;

    /**
     * Quotes a value as a single-quoted KQL string literal.
     */
    public static String literal(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('\'');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' || c == '\'') sb.append('\\');
            sb.append(c);
        }
        return sb.append('\'').toString();
    }

    // keep query text in logs short
    public static String snippet(String query) {
        if (query == null) return "";
        return query.length() <= LOG_SNIPPET_CHARS ? query : query.substring(0, LOG_SNIPPET_CHARS) + "...";
    }
}
