package com.astrofeather.exception;

public class PreconditionException extends FeatherException {
    public PreconditionException(String message) {
        super("Condición previa violada: " + message);
    }
}
