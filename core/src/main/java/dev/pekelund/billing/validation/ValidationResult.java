package dev.pekelund.billing.validation;

public record ValidationResult(boolean accepted, RejectReason reason) {

    private static final ValidationResult ACCEPTED = new ValidationResult(true, null);

    public ValidationResult {
        if (accepted && reason != null) {
            throw new IllegalArgumentException("An accepted row cannot carry a reject reason");
        }
        if (!accepted && reason == null) {
            throw new IllegalArgumentException("A rejected row needs a reject reason");
        }
    }

    public static ValidationResult accept() {
        return ACCEPTED;
    }

    public static ValidationResult reject(RejectReason reason) {
        return new ValidationResult(false, reason);
    }
}
