package com.jreinhal.annotator.navigation;

import com.jreinhal.annotator.model.UserIdentity;
import com.jreinhal.annotator.ownership.OwnershipCoordinator;
import com.jreinhal.annotator.schema.TaskSchema;
import com.jreinhal.annotator.store.RecordStore;
import com.jreinhal.annotator.visibility.RecordSetCache;
import com.jreinhal.annotator.visibility.VisibilityIndex;
import org.springframework.stereotype.Component;

@Component
public class NavigationStateMachineFactory {
    private final RecordStore recordStore;
    private final OwnershipCoordinator ownershipCoordinator;
    private final VisibilityIndex visibilityIndex;
    private final RecordSetCache recordSetCache;
    private final TaskSchema schema;

    public NavigationStateMachineFactory(RecordStore recordStore, OwnershipCoordinator ownershipCoordinator,
                                         VisibilityIndex visibilityIndex, RecordSetCache recordSetCache, TaskSchema schema) {
        this.recordStore = recordStore;
        this.ownershipCoordinator = ownershipCoordinator;
        this.visibilityIndex = visibilityIndex;
        this.recordSetCache = recordSetCache;
        this.schema = schema;
    }

    public NavigationStateMachine create(UserIdentity user) {
        return new NavigationStateMachine(user, recordStore, ownershipCoordinator, visibilityIndex, recordSetCache, schema);
    }
}
