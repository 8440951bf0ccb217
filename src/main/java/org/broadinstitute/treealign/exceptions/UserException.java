package org.broadinstitute.treealign.exceptions;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as malformed trees or inconsistent inputs.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException(final String msg) {
        super(msg);
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(String message) {
            super(String.format("Bad input: %s", message));
        }
    }

    /**
     * <p/>
     * For lineage trees that cannot be traversed, e.g. leaves without a cell identifier
     */
    public static class MalformedTree extends BadInput {
        private static final long serialVersionUID = 0L;

        public MalformedTree(final String message) {
            super(String.format("Malformed lineage tree: %s", message));
        }
    }
}
