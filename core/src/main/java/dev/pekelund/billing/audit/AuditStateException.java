package dev.pekelund.billing.audit;

public class AuditStateException extends RuntimeException {

    public AuditStateException(String message) {
        super(message);
    }

    public AuditStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
