package org.broadinstitute.pedsim.exceptions;

/**
 * <p/>
 * Class PedSimException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures
 * and "this should never happen" kinds of scenarios.
 */
public class PedSimException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public PedSimException( String msg ) {
        super(msg);
    }

    public PedSimException( String message, Throwable throwable ) {
        super(message, throwable);
    }

    /**
     * <p/>
     * For wrapping errors that are believed to never be reachable
     */
    public static class ShouldNeverReachHereException extends PedSimException {
        private static final long serialVersionUID = 0L;
        public ShouldNeverReachHereException( final String s ) {
            super(s);
        }
        public ShouldNeverReachHereException( final String s, final Throwable throwable ) {
            super(s, throwable);
        }
        public ShouldNeverReachHereException( final Throwable throwable) {this("Should never reach here.", throwable);}
    }

    /**
     * Thrown when a {@link org.broadinstitute.pedsim.utils.pedigree.PedigreeDefinition} is modified after it
     * has been handed downstream.
     */
    public static class DefinitionAlreadyFinalized extends PedSimException {
        private static final long serialVersionUID = 0L;

        public DefinitionAlreadyFinalized( final String name ) {
            super(String.format("Attempted to modify pedigree definition \"%s\" after it was finalized", name));
        }
    }
}
