/**
 * Domain model of the admission layer.
 *
 * <p>This package contains the immutable values that travel from producers to the execution
 * engine.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.admission.domain.model.GenerationRequest} - Request as submitted by a caller</li>
 *   <li>{@link fr.lapetina.admission.domain.model.SchedulingHint} - Pinned or preferred target rank</li>
 *   <li>{@link fr.lapetina.admission.domain.model.QueueItem} - Tagged normal/cancel/shutdown item</li>
 *   <li>{@link fr.lapetina.admission.domain.model.ExecutableRequest} - Admitted request handed to the engine</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>All types here are records holding immutable copies and can be shared freely between the
 * producer threads and the scheduling thread.
 */
package fr.lapetina.admission.domain.model;
