package org.sportsmcp.dataservice.api.query;

/**
 * Comparison operators supported by dataset filters.
 * <p>
 * The set is closed: the wire names {@code eq}, {@code gte} and {@code lte} are the only
 * accepted values.
 */
public enum FilterOp {
    EQ("eq"),
    GTE("gte"),
    LTE("lte");

    private final String wireName;

    FilterOp(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parses an operator from its wire name (case-sensitive).
     *
     * @param value wire name
     * @return the operator
     * @throws MalformedQueryException if the value is not one of the supported names
     */
    public static FilterOp fromWireName(String value) {
        for (FilterOp op : values()) {
            if (op.wireName.equals(value)) {
                return op;
            }
        }
        throw new MalformedQueryException("Unsupported filter operator '" + value + "', expected one of eq, gte, lte");
    }
}
