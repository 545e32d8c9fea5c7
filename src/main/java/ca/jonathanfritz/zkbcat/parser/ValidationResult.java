package ca.jonathanfritz.zkbcat.parser;

/**
 * Outcome of a statement pre-check. The reason is always set, and is meant to be shown to the user.
 */
public record ValidationResult(boolean valid, String reason) {

    public static ValidationResult valid(String reason) {
        return new ValidationResult(true, reason);
    }

    public static ValidationResult invalid(String reason) {
        return new ValidationResult(false, reason);
    }
}
