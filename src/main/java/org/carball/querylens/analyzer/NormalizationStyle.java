package org.carball.querylens.analyzer;

import org.carball.querylens.model.query.LogDialect;

/**
 * Placeholder conventions used when turning a statement into a pattern.
 */
public enum NormalizationStyle {
    // digits -> N, strings -> 'S', UUID literals -> 'UUID'
    POSTGRES,
    // comments stripped, strings -> '?', digits -> ?
    SQLALCHEMY;

    public static NormalizationStyle forDialect(LogDialect dialect) {
        return dialect == LogDialect.SQLALCHEMY ? SQLALCHEMY : POSTGRES;
    }
}
