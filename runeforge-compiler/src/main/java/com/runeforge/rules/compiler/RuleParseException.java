package com.runeforge.rules.compiler;

/**
 * Thrown when rule content cannot be read at all: malformed JSON or the wrong top-level
 * shape.
 *
 * <p>Unchecked so callers that load bundled content do not have to handle it. Problems inside
 * a single rule element never raise this exception; they degrade that element only.
 */
public class RuleParseException extends RuntimeException {

    public RuleParseException(String message) {
        super(message);
    }

    public RuleParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
