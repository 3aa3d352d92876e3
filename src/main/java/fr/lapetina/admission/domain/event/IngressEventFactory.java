package fr.lapetina.admission.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for creating IngressEvent instances in the Disruptor ring buffer.
 *
 * The Disruptor pre-allocates events at startup; slots are then reused by
 * re-initializing them on publish and clearing them on drain.
 */
public final class IngressEventFactory implements EventFactory<IngressEvent> {

    @Override
    public IngressEvent newInstance() {
        return new IngressEvent();
    }
}
