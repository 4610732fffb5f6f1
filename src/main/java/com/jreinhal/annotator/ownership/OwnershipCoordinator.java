package com.jreinhal.annotator.ownership;

import com.jreinhal.annotator.model.AnnotationRecord;
import com.jreinhal.annotator.store.RecordStore;
import com.jreinhal.annotator.util.LogSanitizer;
import com.jreinhal.annotator.visibility.RecordSetCache;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Browse-to-own: viewing an unclaimed record makes the viewer its owner. There is no
 * release; ownership is permanent for the life of the record.
 */
@Service
public class OwnershipCoordinator {
    private static final Logger log = LoggerFactory.getLogger(OwnershipCoordinator.class);

    private final RecordStore recordStore;
    private final RecordSetCache recordSetCache;

    public OwnershipCoordinator(RecordStore recordStore, RecordSetCache recordSetCache) {
        this.recordStore = recordStore;
        this.recordSetCache = recordSetCache;
    }

    public ClaimOutcome claimOnView(String recordId, String user) {
        if (user == null || user.isBlank()) {
            throw new IllegalArgumentException("A user is required to view records");
        }
        Optional<AnnotationRecord> current = recordStore.get(recordId);
        if (current.isEmpty()) {
            recordSetCache.invalidate();
            return ClaimOutcome.NOT_FOUND;
        }
        if (current.get().isOwnedBy(user)) {
            return ClaimOutcome.ALREADY_OWNED;
        }
        boolean claimed = recordStore.claim(recordId, user);
        recordSetCache.invalidate();
        if (claimed) {
            if (log.isInfoEnabled()) {
                log.info("{} claimed record {}", LogSanitizer.sanitize(user), LogSanitizer.sanitize(recordId));
            }
            return ClaimOutcome.CLAIMED;
        }
        if (recordStore.get(recordId).isEmpty()) {
            return ClaimOutcome.NOT_FOUND;
        }
        log.info("{} lost record {} to another annotator", LogSanitizer.sanitize(user), LogSanitizer.sanitize(recordId));
        return ClaimOutcome.DENIED;
    }
}
