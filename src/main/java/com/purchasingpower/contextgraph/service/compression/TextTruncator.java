package com.purchasingpower.contextgraph.service.compression;

/**
 * Head-and-tail shortening of long text.
 */
public final class TextTruncator {

    private TextTruncator() {
    }

    /**
     * Keep the first and last {@code maxLength/2} characters around an
     * {@code ...[N chars omitted]...} marker, where N is {@code length - maxLength}.
     * Text no longer than {@code maxLength} is returned as is.
     */
    public static String extractKeyPoints(String text, int maxLength) {
        if (maxLength < 0) {
            throw new IllegalArgumentException("maxLength must not be negative: " + maxLength);
        }
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        int partLength = maxLength / 2;
        String start = text.substring(0, partLength);
        String end = text.substring(text.length() - partLength);
        return start + "...[" + (text.length() - maxLength) + " chars omitted]..." + end;
    }

    /**
     * Like {@link #extractKeyPoints(String, int)}, but returns the original when
     * the marker would make the result longer.
     */
    public static String shorten(String text, int maxLength) {
        String shortened = extractKeyPoints(text, maxLength);
        return shortened != null && shortened.length() < text.length() ? shortened : text;
    }
}
