package org.broadinstitute.treealign.exceptions;

/**
 * <p/>
 * Class TreeAlignException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures,
 * collaborators that break their contract and "this should never happen" kinds of scenarios.
 */
public class TreeAlignException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public TreeAlignException( String msg ) {
        super(msg);
    }

    /*
      Subtypes of TreeAlignException for common kinds of errors
     */

    /**
     * Thrown when a clone assigner returns a result that cannot be applied to the clade being visited.
     */
    public static class MalformedAssignerResult extends TreeAlignException {
        private static final long serialVersionUID = 0L;

        public MalformedAssignerResult( final String cladeName, final String message ) {
            super(String.format("Clone assigner returned a malformed result at clade \"%s\": %s", cladeName, message));
        }
    }
}
