package fr.lapetina.admission.domain.strategy;

import fr.lapetina.admission.domain.model.GenerationRequest;
import fr.lapetina.admission.domain.model.QueueItem;
import fr.lapetina.admission.scheduler.CapacityTracker;
import fr.lapetina.admission.scheduler.RankAssignment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PlacementStrategyTest {

    private static QueueItem item(long id, int promptLength) {
        return QueueItem.normal(id, GenerationRequest.ofTokens(Collections.nCopies(promptLength, 1), 4));
    }

    @Nested
    @DisplayName("LeastLoadedPlacementStrategy")
    class LeastLoadedTests {

        private LeastLoadedPlacementStrategy strategy;

        @BeforeEach
        void setUp() {
            strategy = new LeastLoadedPlacementStrategy();
        }

        @Test
        @DisplayName("should round-robin equal prompts over idle ranks")
        void shouldRoundRobin() {
            List<QueueItem> pool = new ArrayList<>();
            for (long id = 0; id < 6; id++) {
                pool.add(item(id, 3));
            }
            RankAssignment assignment = new RankAssignment(3);

            strategy.place(pool, CapacityTracker.idle(3, 8), assignment);

            assertThat(assignment.idsByRank().get(0)).containsExactly(0L, 3L);
            assertThat(assignment.idsByRank().get(1)).containsExactly(1L, 4L);
            assertThat(assignment.idsByRank().get(2)).containsExactly(2L, 5L);
        }

        @Test
        @DisplayName("should start with the rank holding the fewest active requests")
        void shouldPreferLeastActive() {
            RankAssignment assignment = new RankAssignment(3);

            strategy.place(List.of(item(1, 3)), CapacityTracker.of(8, 4, 2, 5), assignment);

            assertThat(assignment.idsByRank().get(1)).containsExactly(1L);
        }

        @Test
        @DisplayName("should weigh ranks by prompt tokens placed in the same call")
        void shouldWeighByPlacedTokens() {
            RankAssignment assignment = new RankAssignment(2);

            strategy.place(List.of(item(1, 10), item(2, 1), item(3, 1)), CapacityTracker.idle(2, 8), assignment);

            assertThat(assignment.idsByRank().get(0)).containsExactly(1L);
            assertThat(assignment.idsByRank().get(1)).containsExactly(2L, 3L);
        }

        @Test
        @DisplayName("should defer what does not fit and reserve what does")
        void shouldDeferWhenFull() {
            CapacityTracker tracker = CapacityTracker.of(2, 2, 1);
            RankAssignment assignment = new RankAssignment(2);

            strategy.place(List.of(item(1, 3), item(2, 3)), tracker, assignment);

            assertThat(assignment.idsByRank().get(1)).containsExactly(1L);
            assertThat(assignment.getDeferred()).extracting(QueueItem::id).containsExactly(2L);
            assertThat(tracker.toArray()).containsExactly(2, 2);
        }

        @Test
        @DisplayName("should have correct name")
        void shouldHaveCorrectName() {
            assertThat(strategy.getName()).isEqualTo("least-loaded");
        }
    }

    @Nested
    @DisplayName("LongestPromptFirstPlacementStrategy")
    class LongestPromptFirstTests {

        private LongestPromptFirstPlacementStrategy strategy;

        @BeforeEach
        void setUp() {
            strategy = new LongestPromptFirstPlacementStrategy();
        }

        @Test
        @DisplayName("should place the longest prompt first")
        void shouldPlaceLongestFirst() {
            RankAssignment assignment = new RankAssignment(2);

            strategy.place(List.of(item(1, 2), item(2, 9), item(3, 2)), CapacityTracker.idle(2, 8), assignment);

            assertThat(assignment.idsByRank().get(0)).containsExactly(2L);
            assertThat(assignment.idsByRank().get(1)).containsExactly(1L, 3L);
        }

        @Test
        @DisplayName("should not reorder the caller's pool")
        void shouldNotModifyPool() {
            List<QueueItem> pool = List.of(item(1, 1), item(2, 5));

            strategy.place(pool, CapacityTracker.idle(1, 8), new RankAssignment(1));

            assertThat(pool).extracting(QueueItem::id).containsExactly(1L, 2L);
        }

        @Test
        @DisplayName("should have correct name")
        void shouldHaveCorrectName() {
            assertThat(strategy.getName()).isEqualTo("longest-prompt-first");
        }
    }
}
