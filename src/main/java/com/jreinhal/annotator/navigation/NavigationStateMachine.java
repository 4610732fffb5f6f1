package com.jreinhal.annotator.navigation;

import com.jreinhal.annotator.model.AnnotationRecord;
import com.jreinhal.annotator.model.Direction;
import com.jreinhal.annotator.model.UserIdentity;
import com.jreinhal.annotator.ownership.ClaimOutcome;
import com.jreinhal.annotator.ownership.OwnershipCoordinator;
import com.jreinhal.annotator.schema.TaskSchema;
import com.jreinhal.annotator.session.EditSession;
import com.jreinhal.annotator.session.PersistedValues;
import com.jreinhal.annotator.store.RecordStore;
import com.jreinhal.annotator.store.SaveResult;
import com.jreinhal.annotator.util.LogSanitizer;
import com.jreinhal.annotator.visibility.Position;
import com.jreinhal.annotator.visibility.RecordSetCache;
import com.jreinhal.annotator.visibility.VisibilityIndex;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One annotator's browse/edit/confirm cycle.
 *
 * <p>Landing on a record claims it. Moving away from a dirty record stops in
 * {@link NavigationState.ConfirmPending} until the annotator saves, discards or cancels.
 * A failed save never moves and never drops the working edits.</p>
 *
 * <p>Not thread-safe; callers serialize access per instance.</p>
 */
public class NavigationStateMachine {
    private static final Logger log = LoggerFactory.getLogger(NavigationStateMachine.class);
    static final int MAX_CLAIM_ATTEMPTS = 5;

    private final UserIdentity user;
    private final RecordStore recordStore;
    private final OwnershipCoordinator ownershipCoordinator;
    private final VisibilityIndex visibilityIndex;
    private final RecordSetCache recordSetCache;
    private final TaskSchema schema;

    private NavigationState state = NavigationState.Viewing.nothing();
    private EditSession session;
    private List<String> visibleIds = List.of();
    private String lastError;

    public NavigationStateMachine(UserIdentity user, RecordStore recordStore, OwnershipCoordinator ownershipCoordinator,
                                  VisibilityIndex visibilityIndex, RecordSetCache recordSetCache, TaskSchema schema) {
        this.user = user;
        this.recordStore = recordStore;
        this.ownershipCoordinator = ownershipCoordinator;
        this.visibilityIndex = visibilityIndex;
        this.recordSetCache = recordSetCache;
        this.schema = schema;
    }

    /**
     * Initial load, or a jump to {@code explicitId} when the annotator can see it.
     *
     * <p>Refused while the open record has unsaved edits. A jump to a record the annotator
     * cannot see keeps the current record and reports it through {@link #lastError()}.</p>
     */
    public NavigationState open(int position, String explicitId) {
        NavigationState.Viewing viewing = requireViewing("open a record");
        if (session != null && session.isDirty()) {
            throw new IllegalStateException("Record " + viewing.recordId()
                + " has unsaved changes; save or discard them before opening another record");
        }
        String wanted = explicitId == null || explicitId.isBlank() ? null : explicitId.trim();
        if (wanted != null && session != null) {
            visibleIds = visibilityIndex.refresh(recordSetCache.snapshot(), user.username());
            if (!visibleIds.contains(wanted)) {
                lastError = "Record " + wanted + " is not available";
                return state;
            }
        }
        land(position, wanted);
        if (wanted != null && !wanted.equals(state.recordId())) {
            lastError = "Record " + wanted + " is not available";
        }
        return state;
    }

    public NavigationState requestNavigate(Direction direction) {
        NavigationState.Viewing viewing = requireViewing("navigate");
        if (session != null && session.isDirty()) {
            state = new NavigationState.ConfirmPending(direction, viewing.recordId(), viewing.index(), null);
            return state;
        }
        moveFrom(viewing.recordId(), viewing.index(), direction);
        return state;
    }

    public NavigationState saveAndContinue() {
        NavigationState.ConfirmPending pending = requireConfirmPending("save and continue");
        SaveResult result = persist(pending.recordId());
        if (!result.isSuccess()) {
            state = new NavigationState.ConfirmPending(pending.direction(), pending.recordId(), pending.index(), result.message());
            return state;
        }
        moveFrom(pending.recordId(), pending.index(), pending.direction());
        return state;
    }

    public NavigationState discardAndContinue() {
        NavigationState.ConfirmPending pending = requireConfirmPending("discard and continue");
        if (log.isDebugEnabled()) {
            log.debug("{} discarded edits on {}", LogSanitizer.sanitize(user.username()), LogSanitizer.sanitize(pending.recordId()));
        }
        moveFrom(pending.recordId(), pending.index(), pending.direction());
        return state;
    }

    public NavigationState cancel() {
        NavigationState.ConfirmPending pending = requireConfirmPending("cancel");
        state = new NavigationState.Viewing(pending.recordId(), pending.index());
        return state;
    }

    /**
     * Saves the open record in place. On success the session is re-snapshotted from the store.
     */
    public SaveResult save() {
        NavigationState.Viewing viewing = requireViewing("save");
        requireSession();
        SaveResult result = persist(viewing.recordId());
        if (result.isSuccess()) {
            lastError = null;
            recordStore.get(viewing.recordId()).ifPresent(saved -> session = EditSession.snapshot(saved, schema));
            visibleIds = visibilityIndex.refresh(recordSetCache.snapshot(), user.username());
        }
        return result;
    }

    public void edit(String field, Object value) {
        requireViewing("edit");
        requireSession().setValue(field, value);
    }

    public void flag(String field, boolean flagged) {
        requireViewing("flag a field");
        requireSession().setFlag(field, flagged);
    }

    /**
     * Applies a batch of edits as the UI submits them with a navigation request.
     */
    public void applyEdits(Map<String, Object> values, Map<String, Boolean> flags) {
        if (values != null) {
            values.forEach(this::edit);
        }
        if (flags != null) {
            flags.forEach((field, flagged) -> flag(field, Boolean.TRUE.equals(flagged)));
        }
    }

    public RecordView view() {
        String error = state instanceof NavigationState.ConfirmPending pending && pending.error() != null
            ? pending.error()
            : lastError;
        String pendingDirection = state instanceof NavigationState.ConfirmPending pending
            ? pending.direction().name()
            : null;
        String stateName = state instanceof NavigationState.ConfirmPending ? "CONFIRM_PENDING" : "VIEWING";
        if (session == null) {
            return new RecordView(stateName, null, 0, visibleIds.size(), null, false, false, pendingDirection,
                Map.of(), Map.of(), Map.of(), error);
        }
        AnnotationRecord source = session.source();
        return new RecordView(stateName, source.id(), state.index() + 1, visibleIds.size(), source.owner(),
            source.completed(), session.isDirty(), pendingDirection, session.workingValues(),
            session.displayValues(), session.workingFlags(), error);
    }

    public NavigationState state() {
        return state;
    }

    public Optional<EditSession> session() {
        return Optional.ofNullable(session);
    }

    public String lastError() {
        return lastError;
    }

    public UserIdentity user() {
        return user;
    }

    private void moveFrom(String currentId, int currentIndex, Direction direction) {
        visibleIds = visibilityIndex.refresh(recordSetCache.snapshot(), user.username());
        Position target = visibilityIndex.step(visibleIds, currentIndex, currentId, direction);
        land(target.index(), target.recordId());
    }

    // a claim lost to another annotator refreshes the list and resolves again
    private void land(int position, String explicitId) {
        String wanted = explicitId;
        int slot = position;
        for (int attempt = 0; attempt < MAX_CLAIM_ATTEMPTS; attempt++) {
            visibleIds = visibilityIndex.refresh(recordSetCache.snapshot(), user.username());
            Position resolved = visibilityIndex.resolve(visibleIds, slot, wanted);
            if (resolved.isEmpty()) {
                session = null;
                state = NavigationState.Viewing.nothing();
                lastError = null;
                return;
            }
            ClaimOutcome outcome = ownershipCoordinator.claimOnView(resolved.recordId(), user.username());
            if (outcome.grantsAccess()) {
                Optional<AnnotationRecord> record = recordStore.get(resolved.recordId());
                if (record.isPresent()) {
                    session = EditSession.snapshot(record.get(), schema);
                    state = new NavigationState.Viewing(resolved.recordId(), resolved.index());
                    lastError = null;
                    return;
                }
            }
            wanted = null;
            slot = resolved.index();
        }
        throw new IllegalStateException("Could not open a record after " + MAX_CLAIM_ATTEMPTS + " tries; reload and retry");
    }

    private SaveResult persist(String recordId) {
        PersistedValues values = requireSession().toPersisted();
        SaveResult result = recordStore.save(recordId, values.fields(), values.flags(), values.score(), user.username());
        if (result.isSuccess()) {
            recordSetCache.invalidate();
            if (log.isInfoEnabled()) {
                log.info("{} saved record {}", LogSanitizer.sanitize(user.username()), LogSanitizer.sanitize(recordId));
            }
        } else {
            lastError = result.message();
            log.warn("Save of {} by {} failed: {} {}", LogSanitizer.sanitize(recordId),
                LogSanitizer.sanitize(user.username()), result.status(), LogSanitizer.sanitize(result.message()));
        }
        return result;
    }

    private NavigationState.Viewing requireViewing(String action) {
        if (state instanceof NavigationState.Viewing viewing) {
            return viewing;
        }
        throw new IllegalStateException("Cannot " + action + " while a confirmation is pending");
    }

    private NavigationState.ConfirmPending requireConfirmPending(String action) {
        if (state instanceof NavigationState.ConfirmPending pending) {
            return pending;
        }
        throw new IllegalStateException("Nothing to confirm; cannot " + action);
    }

    private EditSession requireSession() {
        if (session == null) {
            throw new IllegalStateException("No record is open");
        }
        return session;
    }
}
