package org.otelbuffer.datapipeline.scan;

/**
 * Operators of a single-column predicate.
 */
public enum ComparisonOperator {
    EQUAL("="),
    NOT_EQUAL("<>"),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">="),
    IS_NULL("IS NULL"),
    IS_NOT_NULL("IS NOT NULL");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * @return true for the four range operators, which need an ordered column type
     */
    public boolean isOrdering() {
        return switch (this) {
            case LESS_THAN, LESS_THAN_OR_EQUAL, GREATER_THAN, GREATER_THAN_OR_EQUAL -> true;
            default -> false;
        };
    }

    /**
     * @return true for IS NULL and IS NOT NULL, which take no constant
     */
    public boolean isNullCheck() {
        return this == IS_NULL || this == IS_NOT_NULL;
    }

    /**
     * Applies the operator to the result of comparing a cell with the constant.
     *
     * @param comparison negative, zero or positive, as from {@link Comparable#compareTo}
     * @return whether the cell satisfies the operator
     * @throws IllegalStateException for null checks, which are not comparisons
     */
    public boolean accepts(int comparison) {
        return switch (this) {
            case EQUAL -> comparison == 0;
            case NOT_EQUAL -> comparison != 0;
            case LESS_THAN -> comparison < 0;
            case LESS_THAN_OR_EQUAL -> comparison <= 0;
            case GREATER_THAN -> comparison > 0;
            case GREATER_THAN_OR_EQUAL -> comparison >= 0;
            case IS_NULL, IS_NOT_NULL -> throw new IllegalStateException(symbol + " is not a comparison");
        };
    }
}
