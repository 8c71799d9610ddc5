package org.broadinstitute.fusionworkbook.exceptions;

/**
 * <p/>
 * Class FusionWorkbookException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures
 * and "this should never happen" kinds of scenarios.
 */
public class FusionWorkbookException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public FusionWorkbookException( String msg ) {
        super(msg);
    }

    public FusionWorkbookException( String message, Throwable throwable ) {
        super(message, throwable);
    }

    /*
      Subtypes of FusionWorkbookException for common kinds of errors
     */

    /**
     * <p/>
     * For wrapping errors that are believed to never be reachable
     */
    public static class ShouldNeverReachHereException extends FusionWorkbookException {
        private static final long serialVersionUID = 0L;
        public ShouldNeverReachHereException( final String s ) {
            super(s);
        }
        public ShouldNeverReachHereException( final String s, final Throwable throwable ) {
            super(s, throwable);
        }
    }
}
