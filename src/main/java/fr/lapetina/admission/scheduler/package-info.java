/**
 * Per-tick admission: filtering, backlog, capacity accounting and rank placement.
 *
 * <h2>Tick Stages</h2>
 * <pre>
 * Drain → Filter → Backlog → Purge → Pull → Place → Convert
 * </pre>
 *
 * <p>Everything in this package runs on the scheduling thread unless documented otherwise.
 */
package fr.lapetina.admission.scheduler;
