package com.syncline.core.events;

/**
 * Outcome of envelope validation.
 */
public record ValidationResult(boolean valid, String error) {

    private static final ValidationResult OK = new ValidationResult(true, null);

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult invalid(String error) {
        return new ValidationResult(false, error);
    }
}
