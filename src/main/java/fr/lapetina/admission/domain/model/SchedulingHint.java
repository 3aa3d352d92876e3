package fr.lapetina.admission.domain.model;

/**
 * Rank preference attached to a request.
 *
 * @param targetRank the data-parallel rank the caller wants the request to run on
 * @param relaxed    {@code false} pins the request to {@code targetRank}; {@code true} makes the
 *                   rank a preference that may fall back to the least loaded rank
 */
public record SchedulingHint(int targetRank, boolean relaxed) {

    public SchedulingHint {
        if (targetRank < 0) {
            throw new IllegalArgumentException("targetRank must not be negative: " + targetRank);
        }
    }

    public static SchedulingHint pinned(int rank) {
        return new SchedulingHint(rank, false);
    }

    public static SchedulingHint preferred(int rank) {
        return new SchedulingHint(rank, true);
    }

    public boolean isPinned() {
        return !relaxed;
    }
}
