package com.lineage.core.process;

/**
 * Rough token estimate used for budgeting prompt text: one token per four characters.
 */
public final class TokenEstimator {

    private TokenEstimator() {}

    public static long estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + 3L) / 4;
    }

    /**
     * Cuts {@code text} to roughly {@code maxTokens} and appends a truncation marker.
     */
    public static String truncate(String text, long maxTokens) {
        long tokens = estimate(text);
        if (tokens <= maxTokens) {
            return text;
        }
        int keep = (int) Math.min(text.length(), maxTokens * 4);
        return text.substring(0, keep)
                + "\n[truncated: ~" + (tokens - maxTokens) + " estimated tokens omitted]\n";
    }
}
