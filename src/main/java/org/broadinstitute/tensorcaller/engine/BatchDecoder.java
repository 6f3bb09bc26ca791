package org.broadinstitute.tensorcaller.engine;

/**
 * Consumes a batch together with the classifier's predictions for it, e.g. by turning them into output records.
 */
@FunctionalInterface
public interface BatchDecoder {

    /**
     * @throws org.broadinstitute.tensorcaller.exceptions.TensorCallerException.InconsistentBatchShape if the
     * predictions do not cover the batch site for site
     */
    void decode(EvidenceBatch batch, ClassifierPredictions predictions);
}
