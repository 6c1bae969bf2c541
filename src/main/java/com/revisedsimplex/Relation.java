package com.revisedsimplex;

public enum Relation {
    LE("<="), GE(">="), EQ("=");

    private final String symbol;

    Relation(String symbol) { this.symbol = symbol; }

    /** The relation obtained by multiplying both sides by -1. */
    Relation flip() {
        switch (this) {
            case LE: return GE;
            case GE: return LE;
            default: return EQ;
        }
    }

    public String symbol() { return symbol; }
}
