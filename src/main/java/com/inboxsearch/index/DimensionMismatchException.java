package com.inboxsearch.index;

public class DimensionMismatchException extends IllegalArgumentException {
    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("vector dimension mismatch: expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
