package com.tablette.core;

/**
 * The query expression a dimension or filter resolves to. Query construction itself lives
 * outside this library; only the rendered SQL fragment is exposed here.
 */
public interface Definition {
    Definition NULL = NullValue.INSTANCE;

    String toSql();

    static Definition of(String sql) {
        return new Sql(sql);
    }

    record Sql(String sql) implements Definition {
        @Override
        public String toSql() {
            return sql;
        }
    }

    /**
     * Selecting NULL for a dimension makes the database aggregate across all of its values,
     * which yields the totals row.
     */
    enum NullValue implements Definition {
        INSTANCE;

        @Override
        public String toSql() {
            return "NULL";
        }
    }
}
