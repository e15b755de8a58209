package org.smilesforge.validation;

/**
 * Outcome of a syntax check.
 *
 * @param valid whether the text passed
 * @param error the first problem found, or null if valid
 */
public record ValidationResult(boolean valid, String error) {

    private static final ValidationResult OK = new ValidationResult(true, null);

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult failure(String error) {
        return new ValidationResult(false, error);
    }
}
