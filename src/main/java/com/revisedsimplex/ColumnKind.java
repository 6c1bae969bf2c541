package com.revisedsimplex;

/** Origin of a column in the standardized constraint matrix. */
public enum ColumnKind {
    STRUCTURAL, SLACK, SURPLUS, ARTIFICIAL
}
