package io.github.pyrox.ladder;

/**
 * Base type for every failure raised by the ladder core. All subtypes are unchecked: structural
 * violations abort the operation and leave the model untouched, locator misses are recoverable.
 */
public abstract class LadderException extends RuntimeException {
    protected LadderException(String message) {
        super(message);
    }
}
