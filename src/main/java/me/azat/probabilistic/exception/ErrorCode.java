package me.azat.probabilistic.exception;

/**
 * Error codes carried by every {@link ProbabilisticStructureException}.
 */
public enum ErrorCode {

    // 1xxx: construction
    INVALID_CONFIGURATION(1001, "Invalid structure configuration"),

    // 2xxx: cross-instance operations
    INCOMPATIBLE_STRUCTURE(2001, "Structures are not compatible"),

    // 3xxx: registry
    STRUCTURE_NOT_FOUND(3001, "Structure not found"),
    DUPLICATE_STRUCTURE(3002, "Structure already registered"),

    ;

    private final int code;
    private final String defaultMessage;

    ErrorCode(int code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public int getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
