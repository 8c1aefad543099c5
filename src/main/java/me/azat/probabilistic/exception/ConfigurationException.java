package me.azat.probabilistic.exception;

import com.google.common.base.Strings;

/**
 * Thrown when a structure or the defaults are built from invalid parameters.
 */
public class ConfigurationException extends ProbabilisticStructureException {

    public ConfigurationException(String message) {
        super(ErrorCode.INVALID_CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorCode.INVALID_CONFIGURATION, message, cause);
    }

    /**
     * Same contract as Guava's {@code Preconditions.checkArgument}, but raises a
     * {@link ConfigurationException}.
     */
    public static void check(boolean expression, String template, Object... args) {
        if (!expression) {
            throw new ConfigurationException(Strings.lenientFormat(template, args));
        }
    }
}
