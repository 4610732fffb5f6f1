package com.jreinhal.annotator.visibility;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.jreinhal.annotator.TestFixtures;
import com.jreinhal.annotator.model.AnnotationRecord;
import com.jreinhal.annotator.model.Direction;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class VisibilityIndexTest {
    private final VisibilityIndex index = new VisibilityIndex();

    @Test
    void showsUnclaimedAndOwnRecordsInStoreOrder() {
        Map<String, AnnotationRecord> all = new LinkedHashMap<>();
        all.put("c", TestFixtures.record("c", "alice"));
        all.put("a", TestFixtures.record("a", "bob"));
        all.put("b", TestFixtures.record("b"));

        assertThat(index.refresh(all, "alice")).containsExactly("c", "b");
        assertThat(index.refresh(all, "bob")).containsExactly("a", "b");
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {
        private final List<String> ids = List.of("a", "b", "c");

        @Test
        void explicitIdWins() {
            assertEquals(new Position(2, "c"), index.resolve(ids, 0, "c"));
        }

        @Test
        void unknownExplicitIdFallsBackToPosition() {
            assertEquals(new Position(1, "b"), index.resolve(ids, 1, "zzz"));
        }

        @Test
        void positionIsClamped() {
            assertEquals(new Position(2, "c"), index.resolve(ids, 99, null));
            assertEquals(new Position(0, "a"), index.resolve(ids, -3, null));
        }

        @Test
        void emptyListResolvesToEmpty() {
            Position position = index.resolve(List.of(), 4, "a");

            assertEquals(Position.EMPTY, position);
            assertThat(position.isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("step")
    class Step {
        private final List<String> ids = List.of("a", "b", "c");

        @Test
        void movesOneAndStopsAtBounds() {
            assertEquals(new Position(2, "c"), index.step(ids, 1, "b", Direction.NEXT));
            assertEquals(new Position(2, "c"), index.step(ids, 2, "c", Direction.NEXT));
            assertEquals(new Position(0, "a"), index.step(ids, 0, "a", Direction.PREV));
        }

        @Test
        void followsCurrentRecordWhenItShifted() {
            assertEquals(new Position(2, "c"), index.step(ids, 0, "b", Direction.NEXT));
        }

        @Test
        void vanishedCurrentRecordAnchorsOnOldSlot() {
            assertEquals(new Position(1, "b"), index.step(ids, 1, "gone", Direction.NEXT));
            assertEquals(new Position(0, "a"), index.step(ids, 1, "gone", Direction.PREV));
        }
    }
}
