package com.interviewpulse.aggregator.util;

/** Utility for log-safe previews of untrusted payloads. */
public final class LogSanitizer {

    /** Default preview length for dropped feed payloads. */
    public static final int PREVIEW_LENGTH = 200;

    private LogSanitizer() {}

    /**
     * Single-line preview: control characters become spaces and the result is truncated to
     * {@code max} characters, with "..." appended when something was cut.
     */
    public static String preview(String s, int max) {
        if (s == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(Math.max(0, Math.min(s.length(), max)));
        for (int i = 0; i < s.length() && sb.length() < max; i++) {
            char c = s.charAt(i);
            sb.append(Character.isISOControl(c) ? ' ' : c);
        }
        return s.length() > max ? sb + "..." : sb.toString();
    }
}
