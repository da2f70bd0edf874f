package com.raditha.unnest.adapter;

import com.raditha.unnest.model.Dialect;

/**
 * Selects the adapter for a dialect.
 */
public final class DialectAdapters {

    private DialectAdapters() {
    }

    public static DialectAdapter forDialect(Dialect dialect) {
        return switch (dialect.strategy()) {
            case TREE -> new JavaTreeAdapter();
            case DELIMITER -> new DelimiterAdapter(dialect);
            case INDENTATION -> new IndentationAdapter(dialect);
        };
    }
}
