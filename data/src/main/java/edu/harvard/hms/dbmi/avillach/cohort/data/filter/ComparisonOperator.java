package edu.harvard.hms.dbmi.avillach.cohort.data.filter;

import java.util.Locale;

public enum ComparisonOperator {
    GT(">"), GE(">="), LT("<"), LE("<="), EQ("="), NE("<>");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ComparisonOperator fromKey(String key) {
        return valueOf(key.toUpperCase(Locale.ROOT));
    }

    /**
     * @param comparison the result of comparing the column value to the operand
     */
    public boolean accepts(int comparison) {
        switch (this) {
            case GT:
                return comparison > 0;
            case GE:
                return comparison >= 0;
            case LT:
                return comparison < 0;
            case LE:
                return comparison <= 0;
            case EQ:
                return comparison == 0;
            case NE:
                return comparison != 0;
            default:
                throw new IllegalStateException("Unknown operator " + this);
        }
    }
}
