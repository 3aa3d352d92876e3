package fr.lapetina.admission.conversion;

import fr.lapetina.admission.domain.model.ExecutableRequest;
import fr.lapetina.admission.domain.model.QueueItem;

/**
 * Turns an admitted request into the form the execution engine consumes.
 *
 * Called once per admitted request on the scheduling thread. A failure affects that request
 * only: it is reported and dropped, never retried.
 */
@FunctionalInterface
public interface RequestConverter {

    /**
     * @param item admitted request
     * @param rank rank the request was admitted on
     * @throws RequestConversionException if the request cannot be executed
     */
    ExecutableRequest convert(QueueItem item, int rank);
}
