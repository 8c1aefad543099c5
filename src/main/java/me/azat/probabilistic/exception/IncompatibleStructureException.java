package me.azat.probabilistic.exception;

import com.google.common.base.Strings;

/**
 * Thrown by merge, union, intersection and similarity operations when the two operands do
 * not share dimensions, seeds or hashing.
 */
public class IncompatibleStructureException extends ProbabilisticStructureException {

    public IncompatibleStructureException(String message) {
        super(ErrorCode.INCOMPATIBLE_STRUCTURE, message);
    }

    public static void check(boolean expression, String template, Object... args) {
        if (!expression) {
            throw new IncompatibleStructureException(Strings.lenientFormat(template, args));
        }
    }
}
