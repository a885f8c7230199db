package io.github.pyrox.ladder;

/**
 * The requested insertion target is outside the rung/rail bounds or not on the expected rail.
 * Editors treat it as a no-op.
 */
public class InvalidInsertionPointException extends LadderException {
    public InvalidInsertionPointException(String message) {
        super(message);
    }
}
