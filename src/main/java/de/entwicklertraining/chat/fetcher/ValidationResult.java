package de.entwicklertraining.chat.fetcher;

/**
 * Outcome of {@link PayloadValidator#validate}.
 */
public record ValidationResult(boolean valid, String reason) {

    private static final ValidationResult VALID = new ValidationResult(true, null);

    public static ValidationResult ok() {
        return VALID;
    }

    public static ValidationResult invalid(String reason) {
        return new ValidationResult(false, reason);
    }
}
