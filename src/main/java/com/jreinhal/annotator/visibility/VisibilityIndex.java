package com.jreinhal.annotator.visibility;

import com.jreinhal.annotator.model.AnnotationRecord;
import com.jreinhal.annotator.model.Direction;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Computes which records a user may browse and where a cursor lands in that list.
 * Stateless; the ordered id list is owned by the caller.
 */
@Component
public class VisibilityIndex {

    /**
     * Ids of records that are unclaimed or owned by {@code user}, in the snapshot's order.
     */
    public List<String> refresh(Map<String, AnnotationRecord> allRecords, String user) {
        List<String> visible = new ArrayList<>();
        for (AnnotationRecord record : allRecords.values()) {
            if (record.isVisibleTo(user)) {
                visible.add(record.id());
            }
        }
        return visible;
    }

    /**
     * An explicit id that is in the list wins; otherwise {@code position} is clamped into range.
     */
    public Position resolve(List<String> orderedIds, int position, String explicitId) {
        if (orderedIds.isEmpty()) {
            return Position.EMPTY;
        }
        if (explicitId != null && !explicitId.isBlank()) {
            int found = orderedIds.indexOf(explicitId.trim());
            if (found >= 0) {
                return new Position(found, orderedIds.get(found));
            }
        }
        int clamped = clamp(position, orderedIds.size());
        return new Position(clamped, orderedIds.get(clamped));
    }

    /**
     * One step from the current record, clamped at both ends. When the current record is no
     * longer in the list its old index is the anchor: the record that slid into that slot is
     * the next one.
     */
    public Position step(List<String> orderedIds, int currentIndex, String currentId, Direction direction) {
        if (orderedIds.isEmpty()) {
            return Position.EMPTY;
        }
        int anchor = currentId == null ? -1 : orderedIds.indexOf(currentId);
        int target;
        if (anchor >= 0) {
            target = anchor + direction.delta();
        } else {
            target = direction == Direction.NEXT ? currentIndex : currentIndex - 1;
        }
        int clamped = clamp(target, orderedIds.size());
        return new Position(clamped, orderedIds.get(clamped));
    }

    private static int clamp(int index, int size) {
        return Math.max(0, Math.min(index, size - 1));
    }
}
