package com.crossfire.materializer;

/**
 * Turns raw MDX column names into client labels.
 *
 * <p>{@code [Measures].[Sales Amount]} becomes {@code Sales Amount};
 * {@code [Date].[Year].[Year].[MEMBER_CAPTION]} becomes {@code Year};
 * segments holding member keys ({@code &[2020]}) are dropped.
 */
public final class ColumnNames {
    private static final String MEASURES_PREFIX = "[Measures].";
    private static final String MEMBER_CAPTION_SUFFIX = ".[MEMBER_CAPTION]";
    private static final String MEMBER_KEY_MARKER = "&";

    private ColumnNames() {
    }

    public static String extract(String columnName) {
        String stripped = columnName
                .replace(MEASURES_PREFIX, "")
                .replace(MEMBER_CAPTION_SUFFIX, "")
                .replace("[", "")
                .replace("]", "");

        String last = "";
        for (String segment : stripped.split("\\.", -1)) {
            if (!segment.contains(MEMBER_KEY_MARKER)) {
                last = segment;
            }
        }
        return last;
    }
}
