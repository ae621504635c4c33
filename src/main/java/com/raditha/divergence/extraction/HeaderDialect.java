package com.raditha.divergence.extraction;

/**
 * The two banner formats that open a pass snapshot in an IR dump.
 */
public enum HeaderDialect {
    /**
     * Legacy pass manager: {@code *** IR Dump After Early CSE (early-cse) ***}.
     * The pass name is the last parenthesized group; scope is never stated.
     */
    LEGACY,

    /**
     * New pass manager: {@code ; *** IR Dump After EarlyCSEPass on foo ***}.
     * The target is either {@code [module]} or a function name.
     */
    NEW_PM;

    /**
     * Convert a CLI or YAML value to a dialect.
     *
     * @param value {@code legacy} or {@code new-pm} (case-insensitive)
     * @throws IllegalArgumentException for anything else
     */
    public static HeaderDialect fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("HeaderDialect value cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "legacy" -> LEGACY;
            case "new-pm", "npm" -> NEW_PM;
            default -> throw new IllegalArgumentException(
                    "Invalid header dialect: " + value + ". Must be: legacy or new-pm");
        };
    }

    public String toCliString() {
        return switch (this) {
            case LEGACY -> "legacy";
            case NEW_PM -> "new-pm";
        };
    }
}
