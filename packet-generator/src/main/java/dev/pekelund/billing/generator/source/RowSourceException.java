package dev.pekelund.billing.generator.source;

public class RowSourceException extends RuntimeException {

    public RowSourceException(String message) {
        super(message);
    }

    public RowSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
