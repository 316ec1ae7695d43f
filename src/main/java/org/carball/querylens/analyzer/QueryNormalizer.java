package org.carball.querylens.analyzer;

import java.util.regex.Pattern;

/**
 * Maps statement text to a pattern in which literal values are replaced by placeholders, so that
 * statements differing only in their literals share one pattern. Normalizing a pattern again
 * returns it unchanged.
 */
public final class QueryNormalizer {

    private static final Pattern UUID_LITERAL = Pattern.compile(
            "'[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}'");

    private static final String UUID_PLACEHOLDER = "'UUID'";

    private static final Pattern STRING_LITERAL = Pattern.compile("'[^']*'");

    private static final Pattern NUMBER = Pattern.compile("\\b\\d+\\b");

    private static final Pattern COMMENT = Pattern.compile("--[^\\r\\n]*|/\\*.*?\\*/", Pattern.DOTALL);

    private QueryNormalizer() {
        // Utility class - prevent instantiation
    }

    public static String normalize(String queryText, NormalizationStyle style) {
        if (queryText == null) {
            return "";
        }

        switch (style) {
            case SQLALCHEMY:
                return normalizeSqlAlchemy(queryText);
            case POSTGRES:
            default:
                return normalizePostgres(queryText);
        }
    }

    private static String normalizePostgres(String queryText) {
        // UUIDs first, otherwise their digit groups are rewritten before they can be recognised
        String pattern = UUID_LITERAL.matcher(queryText).replaceAll(UUID_PLACEHOLDER);
        pattern = NUMBER.matcher(pattern).replaceAll("N");
        // 'UUID' placeholders are left alone by the generic string rule
        return STRING_LITERAL.matcher(pattern).replaceAll(literal ->
                UUID_PLACEHOLDER.equals(literal.group()) ? UUID_PLACEHOLDER : "'S'");
    }

    private static String normalizeSqlAlchemy(String queryText) {
        // a space, so the text on either side cannot join into a new comment marker
        String pattern = COMMENT.matcher(queryText).replaceAll(" ");
        pattern = STRING_LITERAL.matcher(pattern).replaceAll("'?'");
        pattern = NUMBER.matcher(pattern).replaceAll("?");
        return pattern.trim();
    }
}
