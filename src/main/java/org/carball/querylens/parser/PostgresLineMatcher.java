package org.carball.querylens.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.model.query.LogDialect;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches PostgreSQL server log lines written with a prefix like
 * {@code log_line_prefix = '%m [%p] %q%u@%d:%a [%c] '}.
 *
 * <pre>
 * 2025-05-09 10:15:32.123 UTC [12345] app_user@shop:psql [6818a2b4.3039] LOG:  duration: 152.345 ms  statement: SELECT ...
 * </pre>
 */
@Slf4j
public class PostgresLineMatcher implements LogLineMatcher {

    private static final Pattern LINE_PATTERN = Pattern.compile(
            "^(\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}\\.\\d+)" +   // timestamp (group 1)
            " \\w+" +                                                // time zone
            " \\[(\\d+)]" +                                          // pid (group 2)
            " (?:(\\w+)@(\\w+):)?" +                                 // user (3) @ database (4)
            "(\\w+)" +                                               // application or database (5)
            " \\[([^\\]]*)]" +                                       // session id
            " (?:LOG|ERROR|WARNING):\\s+(.*)$"                       // message (group 7)
    );

    @Override
    public LogDialect dialect() {
        return LogDialect.POSTGRES;
    }

    @Override
    public Optional<LineMatch> tryMatch(String line) {
        Matcher matcher = LINE_PATTERN.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }

        String database = matcher.group(4) != null ? matcher.group(4) : matcher.group(5);
        log.trace("PostgreSQL line for database {}: {}", database, matcher.group(7));

        return Optional.of(new LineMatch(
                LogDialect.POSTGRES,
                matcher.group(1),
                matcher.group(2),
                database,
                matcher.group(7)
        ));
    }
}
