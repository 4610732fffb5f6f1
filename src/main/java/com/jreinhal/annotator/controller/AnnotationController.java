package com.jreinhal.annotator.controller;

import com.jreinhal.annotator.model.Direction;
import com.jreinhal.annotator.model.RecordStatistics;
import com.jreinhal.annotator.model.UserIdentity;
import com.jreinhal.annotator.navigation.AnnotationSessionRegistry;
import com.jreinhal.annotator.navigation.NavigationStateMachine;
import com.jreinhal.annotator.navigation.RecordView;
import com.jreinhal.annotator.store.ExportFilter;
import com.jreinhal.annotator.store.RecordStore;
import com.jreinhal.annotator.store.SaveResult;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Thin HTTP adapter over one annotator's {@link NavigationStateMachine}. Every call names its
 * session with the {@value #SESSION_HEADER} header returned by {@code /api/auth/login}.
 */
@RestController
@RequestMapping("/api/annotation")
public class AnnotationController {
    public static final String SESSION_HEADER = "X-Annotation-Session";

    private final AnnotationSessionRegistry sessionRegistry;
    private final RecordStore recordStore;

    public AnnotationController(AnnotationSessionRegistry sessionRegistry, RecordStore recordStore) {
        this.sessionRegistry = sessionRegistry;
        this.recordStore = recordStore;
    }

    public record OpenRequest(Integer position, String recordId) {
    }

    public record EditRequest(Map<String, Object> values, Map<String, Boolean> flags) {
    }

    public record SaveResponse(String status, String message, RecordView view) {
    }

    public record ExportRequest(String owner, boolean onlyCompleted) {
    }

    public record ExportResponse(String file, String directory) {
    }

    @GetMapping("/current")
    public ResponseEntity<RecordView> current(@RequestHeader(SESSION_HEADER) String token) {
        return ResponseEntity.ok(inSession(token, NavigationStateMachine::view));
    }

    @PostMapping("/open")
    public ResponseEntity<RecordView> open(@RequestHeader(SESSION_HEADER) String token,
                                           @RequestBody(required = false) OpenRequest request) {
        Integer requested = request != null ? request.position() : null;
        String recordId = request != null ? request.recordId() : null;
        return ResponseEntity.ok(inSession(token, machine -> {
            int position = requested != null ? requested : machine.state().index();
            machine.open(position, recordId);
            return machine.view();
        }));
    }

    @PostMapping("/edit")
    public ResponseEntity<RecordView> edit(@RequestHeader(SESSION_HEADER) String token, @RequestBody EditRequest request) {
        return ResponseEntity.ok(inSession(token, machine -> {
            machine.applyEdits(request.values(), request.flags());
            return machine.view();
        }));
    }

    /**
     * Moves to the previous or next record. Edits sent along are applied first, so a dirty
     * record stops in the confirmation state.
     */
    @PostMapping("/navigate/{direction}")
    public ResponseEntity<RecordView> navigate(@RequestHeader(SESSION_HEADER) String token,
                                               @PathVariable String direction,
                                               @RequestBody(required = false) EditRequest request) {
        Direction parsed = Direction.fromString(direction);
        return ResponseEntity.ok(inSession(token, machine -> {
            if (request != null) {
                machine.applyEdits(request.values(), request.flags());
            }
            machine.requestNavigate(parsed);
            return machine.view();
        }));
    }

    @PostMapping("/confirm/{action}")
    public ResponseEntity<RecordView> confirm(@RequestHeader(SESSION_HEADER) String token, @PathVariable String action) {
        String normalized = action == null ? "" : action.trim().toLowerCase();
        return ResponseEntity.ok(inSession(token, machine -> {
            switch (normalized) {
                case "save":
                    machine.saveAndContinue();
                    break;
                case "discard":
                    machine.discardAndContinue();
                    break;
                case "cancel":
                    machine.cancel();
                    break;
                default:
                    throw new IllegalArgumentException("Unknown confirmation: " + action);
            }
            return machine.view();
        }));
    }

    @PostMapping("/save")
    public ResponseEntity<SaveResponse> save(@RequestHeader(SESSION_HEADER) String token,
                                             @RequestBody(required = false) EditRequest request) {
        return inSession(token, machine -> {
            if (request != null) {
                machine.applyEdits(request.values(), request.flags());
            }
            SaveResult result = machine.save();
            SaveResponse body = new SaveResponse(result.status().name(), result.message(), machine.view());
            return ResponseEntity.status(statusFor(result)).body(body);
        });
    }

    @GetMapping("/stats")
    public ResponseEntity<RecordStatistics> stats(@RequestHeader(SESSION_HEADER) String token) {
        sessionRegistry.get(token);
        return ResponseEntity.ok(recordStore.statistics());
    }

    /**
     * Annotators export their own records; admins may export everything or any owner's.
     */
    @PostMapping("/export")
    public ResponseEntity<ExportResponse> export(@RequestHeader(SESSION_HEADER) String token,
                                                 @RequestBody(required = false) ExportRequest request) {
        UserIdentity user = sessionRegistry.get(token).user();
        boolean onlyCompleted = request != null && request.onlyCompleted();
        String owner = user.isAdmin() ? (request != null ? request.owner() : null) : user.username();
        Path file = recordStore.export(new ExportFilter(owner, onlyCompleted));
        return ResponseEntity.ok(new ExportResponse(file.getFileName().toString(), String.valueOf(file.getParent())));
    }

    private <T> T inSession(String token, Function<NavigationStateMachine, T> action) {
        return sessionRegistry.withSession(token, action);
    }

    private static HttpStatus statusFor(SaveResult result) {
        switch (result.status()) {
            case SAVED:
                return HttpStatus.OK;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CONFLICT:
                return HttpStatus.CONFLICT;
            default:
                return HttpStatus.SERVICE_UNAVAILABLE;
        }
    }
}
