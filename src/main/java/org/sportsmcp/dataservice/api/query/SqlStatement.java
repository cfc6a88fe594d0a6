package org.sportsmcp.dataservice.api.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parameterized SQL statement: statement text with positional {@code ?} placeholders plus
 * the values bound to them, in order.
 * <p>
 * Statements are assembled with {@link Builder}, which accepts text from three sources only:
 * <ul>
 *   <li>{@link Builder#keyword(String)} for fixed SQL syntax written in code</li>
 *   <li>{@link Builder#identifier(String)} for schema, table and column names, always quoted</li>
 *   <li>{@link Builder#parameter(Object)} for values, always bound and never inlined</li>
 * </ul>
 * Caller-supplied strings therefore never reach the statement text unquoted.
 *
 * @param sql        statement text
 * @param parameters bound values, one per placeholder
 */
public record SqlStatement(String sql, List<Object> parameters) {

    private static final char QUOTE = '"';

    public SqlStatement {
        // List.copyOf rejects nulls, and SQL NULL is a legal parameter value
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Quotes an identifier using SQL-standard double quotes. Embedded quotes are doubled.
     *
     * @param identifier raw identifier
     * @return quoted identifier
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier must not be empty");
        }
        if (identifier.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Identifier must not contain NUL characters");
        }
        StringBuilder quoted = new StringBuilder(identifier.length() + 2);
        quoted.append(QUOTE);
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (c == QUOTE) {
                quoted.append(QUOTE);
            }
            quoted.append(c);
        }
        return quoted.append(QUOTE).toString();
    }

    /**
     * Incremental statement builder. Tokens are separated by single spaces; list separators
     * added with {@link #comma()} attach to the previous token.
     */
    public static final class Builder {

        private final StringBuilder sql = new StringBuilder();
        private final List<Object> parameters = new ArrayList<>();

        private Builder() {
        }

        /**
         * Appends fixed SQL syntax. Must only be called with literals from code.
         */
        public Builder keyword(String keyword) {
            return token(keyword);
        }

        public Builder identifier(String identifier) {
            return token(quoteIdentifier(identifier));
        }

        /**
         * Appends {@code "schema"."table"}.
         */
        public Builder qualifiedName(String schema, String table) {
            return token(quoteIdentifier(schema) + "." + quoteIdentifier(table));
        }

        /**
         * Appends a comma-separated list of quoted identifiers.
         */
        public Builder identifierList(List<String> identifiers) {
            if (identifiers.isEmpty()) {
                throw new IllegalArgumentException("Identifier list must not be empty");
            }
            for (int i = 0; i < identifiers.size(); i++) {
                if (i > 0) {
                    comma();
                }
                identifier(identifiers.get(i));
            }
            return this;
        }

        /**
         * Appends a {@code ?} placeholder and binds {@code value} to it.
         */
        public Builder parameter(Object value) {
            parameters.add(value);
            return token("?");
        }

        public Builder comma() {
            sql.append(',');
            return this;
        }

        public SqlStatement build() {
            return new SqlStatement(sql.toString(), parameters);
        }

        private Builder token(String text) {
            if (sql.length() > 0) {
                sql.append(' ');
            }
            sql.append(text);
            return this;
        }
    }
}
