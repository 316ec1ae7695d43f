package org.carball.querylens.parser;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort extraction of table and column names from SQL text by string scanning.
 *
 * <p>This is not a SQL parser. Subqueries, CTEs and quoted identifiers that contain keywords
 * can produce wrong or missing names.</p>
 */
public final class SqlTableExtractor {

    private static final Pattern FROM_PATTERN = Pattern.compile("\\bFROM\\b");

    private static final Pattern FROM_END_PATTERN = Pattern.compile(
            "\\b(?:WHERE|GROUP BY|HAVING|ORDER BY|LIMIT|OFFSET)\\b");

    private static final Pattern JOIN_PATTERN = Pattern.compile("\\bJOIN\\s+(\\S+)");

    private static final Pattern TARGET_PATTERN = Pattern.compile(
            "^(?:INSERT\\s+INTO|UPDATE|DELETE\\s+FROM)\\s+(\\S+)");

    private static final Pattern WHERE_PATTERN = Pattern.compile("\\bWHERE\\b");

    private static final Pattern WHERE_END_PATTERN = Pattern.compile(
            "\\b(?:GROUP BY|HAVING|ORDER BY|LIMIT|OFFSET)\\b");

    private static final Pattern AND_PATTERN = Pattern.compile("\\bAND\\b");

    private static final Pattern COMPARISON_PATTERN = Pattern.compile("<>|!=|>=|<=|=|<|>");

    private static final String IDENTIFIER_QUOTES = "[\"'`\\[\\]]";

    private SqlTableExtractor() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the upper-cased names of the tables a statement references, in discovery order.
     */
    public static Set<String> extractTables(String queryText) {
        Set<String> tables = new LinkedHashSet<>();
        if (queryText == null) {
            return tables;
        }

        String upper = queryText.toUpperCase(Locale.ROOT).trim();
        if (upper.startsWith("BEGIN") || upper.startsWith("COMMIT") || upper.startsWith("ROLLBACK")) {
            return tables;
        }

        // FROM clause, up to the next clause keyword
        Matcher from = FROM_PATTERN.matcher(upper);
        if (from.find()) {
            String fromClause = upper.substring(from.end());
            Matcher end = FROM_END_PATTERN.matcher(fromClause);
            if (end.find()) {
                fromClause = fromClause.substring(0, end.start());
            }

            for (String reference : fromClause.split(",")) {
                String[] parts = reference.trim().split("\\s+");
                addTable(tables, parts[0]);
            }
        }

        // Every JOIN target
        Matcher join = JOIN_PATTERN.matcher(upper);
        while (join.find()) {
            addTable(tables, join.group(1));
        }

        // INSERT INTO / UPDATE / DELETE FROM target
        Matcher target = TARGET_PATTERN.matcher(upper);
        if (target.find()) {
            addTable(tables, target.group(1));
        }

        return tables;
    }

    /**
     * Returns the sorted, distinct, upper-cased columns compared with {@code =, <, >, <=, >=} in the
     * WHERE clause of a SELECT statement. Statements other than SELECT yield nothing.
     */
    public static List<String> extractWhereColumns(String queryText) {
        Set<String> columns = new TreeSet<>();
        if (queryText == null) {
            return new ArrayList<>(columns);
        }

        String upper = queryText.toUpperCase(Locale.ROOT).trim();
        if (!upper.startsWith("SELECT")) {
            return new ArrayList<>(columns);
        }

        Matcher where = WHERE_PATTERN.matcher(upper);
        if (!where.find()) {
            return new ArrayList<>(columns);
        }

        String whereClause = upper.substring(where.end());
        Matcher end = WHERE_END_PATTERN.matcher(whereClause);
        if (end.find()) {
            whereClause = whereClause.substring(0, end.start());
        }

        for (String condition : AND_PATTERN.split(whereClause)) {
            Matcher operator = COMPARISON_PATTERN.matcher(condition);
            if (!operator.find() || "<>".equals(operator.group()) || "!=".equals(operator.group())) {
                continue;
            }

            String left = condition.substring(0, operator.start()).trim();
            if (left.isEmpty()) {
                continue;
            }

            String[] tokens = left.split("\\s+");
            String column = cleanColumn(tokens[tokens.length - 1]);
            if (!column.isEmpty()) {
                columns.add(column);
            }
        }

        return new ArrayList<>(columns);
    }

    private static void addTable(Set<String> tables, String token) {
        String table = cleanIdentifier(token);
        // "FROM (SELECT ..." leaves the subquery keyword behind
        if (!table.isEmpty() && !"SELECT".equals(table)) {
            tables.add(table);
        }
    }

    private static String cleanIdentifier(String token) {
        String cleaned = token.replaceAll(IDENTIFIER_QUOTES, "");
        cleaned = cleaned.replaceAll("^\\(+", "");
        int paren = cleaned.indexOf('(');
        if (paren != -1) {
            cleaned = cleaned.substring(0, paren);
        }
        return cleaned.replaceAll("[);,]+$", "").trim();
    }

    private static String cleanColumn(String token) {
        String column = token.replaceAll(IDENTIFIER_QUOTES, "")
                .replaceAll("^\\(+", "")
                .replaceAll("\\)+$", "");
        if (column.contains("(") || column.contains(")")) {
            // function call such as LOWER(NAME), not indexable as a plain column
            return "";
        }
        int dot = column.lastIndexOf('.');
        if (dot != -1) {
            column = column.substring(dot + 1);
        }
        return column.trim();
    }
}
