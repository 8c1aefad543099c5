package me.azat.probabilistic.exception;

/**
 * Base class for every predictable failure raised by this library.
 * <p>
 * Capacity problems (a full Cuckoo filter, an overloaded Bloom filter) are not exceptions:
 * they show up in return values and in {@code getInfo()}.
 */
public class ProbabilisticStructureException extends RuntimeException {

    private final ErrorCode errorCode;

    public ProbabilisticStructureException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    public ProbabilisticStructureException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ProbabilisticStructureException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
