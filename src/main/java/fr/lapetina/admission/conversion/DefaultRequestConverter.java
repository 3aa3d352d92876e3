package fr.lapetina.admission.conversion;

import fr.lapetina.admission.domain.model.ExecutableRequest;
import fr.lapetina.admission.domain.model.GenerationRequest;
import fr.lapetina.admission.domain.model.QueueItem;

import java.time.Clock;
import java.util.Objects;

/**
 * Copies the request fields into an {@link ExecutableRequest} stamped with the admission time.
 */
public final class DefaultRequestConverter implements RequestConverter {

    private final Clock clock;

    public DefaultRequestConverter() {
        this(Clock.systemUTC());
    }

    public DefaultRequestConverter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public ExecutableRequest convert(QueueItem item, int rank) {
        if (!item.isNormal()) {
            throw new RequestConversionException(item.id(), "Only requests can be converted, got " + item.kind());
        }
        GenerationRequest request = item.request();
        return new ExecutableRequest(
                item.id(),
                rank,
                request.inputTokenIds(),
                request.maxNewTokens(),
                request.beamWidth(),
                request.requestType(),
                request.contextPhaseParams(),
                request.correlationId(),
                clock.instant()
        );
    }
}
