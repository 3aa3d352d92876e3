/**
 * LMAX Disruptor-based ingress queue for generation requests.
 *
 * <p>Producers publish submissions, cancellations and the shutdown sentinel into a
 * pre-allocated ring buffer; the scheduling thread drains it through an
 * {@link com.lmax.disruptor.EventPoller}.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.admission.ingress.IngressQueue} - Id assignment, publishing and draining</li>
 *   <li>{@link fr.lapetina.admission.ingress.exception.BackpressureException} - Thrown when the ring buffer cannot take a batch</li>
 * </ul>
 *
 * @see fr.lapetina.admission.ingress.IngressQueue
 * @see com.lmax.disruptor.RingBuffer
 */
package fr.lapetina.admission.ingress;
