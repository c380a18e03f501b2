package com.opsdata.ticketingest.model;

public record ValidationResult(boolean ok, ValidationReason reason, String message) {

    private static final ValidationResult VALID = new ValidationResult(true, null, "Valid");

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(ValidationReason reason, String message) {
        return new ValidationResult(false, reason, message);
    }
}
