package com.astrofeather.exception;

public class DimensionalityException extends PreconditionException {
    public DimensionalityException(String what, int actual, int expected) {
        super(String.format("%s tiene NAXIS=%d, se esperaba %d", what, actual, expected));
    }
}
