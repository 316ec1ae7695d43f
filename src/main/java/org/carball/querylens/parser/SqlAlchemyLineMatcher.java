package org.carball.querylens.parser;

import org.carball.querylens.model.query.LogDialect;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches SQLAlchemy engine log lines ({@code %(asctime)s - %(levelname)s - %(message)s}).
 *
 * <p>Applications that relay engine output through their own logger write
 * {@code <ts> - INFO - Matched SQLAlchemy log line: <ts> | <message>}; the inner timestamp and
 * message are used for those lines.</p>
 */
public class SqlAlchemyLineMatcher implements LogLineMatcher {

    /**
     * SQLAlchemy logs do not name the database, every statement is attributed to this label.
     */
    public static final String DATABASE_SENTINEL = "sqlalchemy";

    private static final Pattern LINE_PATTERN = Pattern.compile(
            "^(\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2},\\d+) - (\\w+) - (.+)$"
    );

    private static final Pattern RELAYED_PATTERN = Pattern.compile(
            "^Matched \\w+ log line: (\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2},\\d+) \\| (.*)$"
    );

    @Override
    public LogDialect dialect() {
        return LogDialect.SQLALCHEMY;
    }

    @Override
    public Optional<LineMatch> tryMatch(String line) {
        Matcher matcher = LINE_PATTERN.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }

        String timestamp = matcher.group(1);
        String message = matcher.group(3).stripTrailing();

        Matcher relayed = RELAYED_PATTERN.matcher(message);
        if (relayed.matches()) {
            timestamp = relayed.group(1);
            message = relayed.group(2).stripTrailing();
        }

        return Optional.of(new LineMatch(
                LogDialect.SQLALCHEMY,
                timestamp,
                matcher.group(2),
                DATABASE_SENTINEL,
                message
        ));
    }
}
