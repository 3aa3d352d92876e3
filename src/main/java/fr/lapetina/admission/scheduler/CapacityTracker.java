package fr.lapetina.admission.scheduler;

import java.util.Arrays;
import java.util.Objects;

/**
 * Per-rank active request counters, bounded by a fixed per-rank capacity.
 *
 * <p>CONTRACT: the tracker wraps a caller-owned array without copying it. The caller fills the
 * array from the distributed state before a tick, the scheduler increments the entries of the
 * ranks it admits into, and the caller reads the array back afterwards to broadcast the new
 * counts. Index = rank number.
 *
 * Not thread-safe: used by the scheduling thread only.
 */
public final class CapacityTracker {

    private final int[] activeRequests;
    private final int perRankCapacity;

    public CapacityTracker(int[] activeRequests, int perRankCapacity) {
        Objects.requireNonNull(activeRequests, "activeRequests");
        if (activeRequests.length == 0) {
            throw new IllegalArgumentException("At least one rank is required");
        }
        if (perRankCapacity < 0) {
            throw new IllegalArgumentException("perRankCapacity must not be negative");
        }
        this.activeRequests = activeRequests;
        this.perRankCapacity = perRankCapacity;
    }

    public static CapacityTracker of(int perRankCapacity, int... activeRequests) {
        return new CapacityTracker(activeRequests, perRankCapacity);
    }

    /**
     * Tracker for {@code numRanks} idle ranks.
     */
    public static CapacityTracker idle(int numRanks, int perRankCapacity) {
        return new CapacityTracker(new int[numRanks], perRankCapacity);
    }

    public int numRanks() {
        return activeRequests.length;
    }

    public int getPerRankCapacity() {
        return perRankCapacity;
    }

    public int get(int rank) {
        return activeRequests[rank];
    }

    public boolean hasCapacity(int rank) {
        return activeRequests[rank] < perRankCapacity;
    }

    /**
     * Takes one slot on {@code rank} if it has one.
     *
     * @return true if the slot was reserved
     */
    public boolean tryReserve(int rank) {
        if (!hasCapacity(rank)) {
            return false;
        }
        activeRequests[rank]++;
        return true;
    }

    /**
     * Gives back one slot on {@code rank}, e.g. when a request finished on that rank.
     */
    public void release(int rank) {
        if (activeRequests[rank] == 0) {
            throw new IllegalStateException("No active request to release on rank " + rank);
        }
        activeRequests[rank]--;
    }

    public int sum() {
        int total = 0;
        for (int count : activeRequests) {
            total += count;
        }
        return total;
    }

    public int max() {
        int highest = Integer.MIN_VALUE;
        for (int count : activeRequests) {
            highest = Math.max(highest, count);
        }
        return highest;
    }

    /**
     * Cluster-wide capacity minus cluster-wide active requests; never negative.
     */
    public int totalHeadroom() {
        return Math.max(perRankCapacity * activeRequests.length - sum(), 0);
    }

    public boolean isValidRank(int rank) {
        return rank >= 0 && rank < activeRequests.length;
    }

    /**
     * Detached copy for scratch accounting; mutating it leaves this tracker untouched.
     */
    public CapacityTracker copy() {
        return new CapacityTracker(activeRequests.clone(), perRankCapacity);
    }

    /**
     * Copy of the current counters.
     */
    public int[] toArray() {
        return activeRequests.clone();
    }

    @Override
    public String toString() {
        return "CapacityTracker{active=" + Arrays.toString(activeRequests)
                + ", perRankCapacity=" + perRankCapacity + '}';
    }
}
