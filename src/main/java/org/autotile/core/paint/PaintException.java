package org.autotile.core.paint;

public class PaintException extends RuntimeException {

    public PaintException(String message, Throwable cause) {
        super(message, cause);
    }
}
