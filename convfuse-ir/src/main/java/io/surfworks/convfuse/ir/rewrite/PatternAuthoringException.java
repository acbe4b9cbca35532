package io.surfworks.convfuse.ir.rewrite;

/**
 * Thrown when a pattern graph or a match/replacement pair is malformed.
 *
 * <p>This signals a bug in the code that builds the patterns, never a property
 * of the graph being rewritten, so it is not meant to be caught.
 */
public class PatternAuthoringException extends IllegalStateException {

    public PatternAuthoringException(String message) {
        super(message);
    }
}
