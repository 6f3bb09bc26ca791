package org.broadinstitute.tensorcaller.exceptions;

/**
 * <p/>
 * Class TensorCallerException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures,
 * an upstream classifier handing back a malformed batch, or "this should never happen" kinds of scenarios.
 */
public class TensorCallerException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public TensorCallerException( final String msg ) {
        super(msg);
    }

    public TensorCallerException( final String message, final Throwable throwable ) {
        super(message, throwable);
    }

    /*
      Subtypes of TensorCallerException for common kinds of errors
     */

    /**
     * <p/>
     * For wrapping errors that are believed to never be reachable
     */
    public static class ShouldNeverReachHereException extends TensorCallerException {
        private static final long serialVersionUID = 0L;
        public ShouldNeverReachHereException( final String s ) {
            super(s);
        }
        public ShouldNeverReachHereException( final String s, final Throwable throwable ) {
            super(s, throwable);
        }
    }

    /**
     * The classifier returned a different number of predictions than there are sites in the evidence batch.
     */
    public static class InconsistentBatchShape extends TensorCallerException {
        private static final long serialVersionUID = 0L;

        public InconsistentBatchShape( final int evidenceBatchSize, final int predictionBatchSize ) {
            super(String.format("Inconsistent shape between input tensor and output predictions %d/%d",
                    evidenceBatchSize, predictionBatchSize));
        }
    }
}
