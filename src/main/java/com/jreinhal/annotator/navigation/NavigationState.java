package com.jreinhal.annotator.navigation;

import com.jreinhal.annotator.model.Direction;

/**
 * Where an annotator's interaction currently stands.
 */
public sealed interface NavigationState permits NavigationState.Viewing, NavigationState.ConfirmPending {

    String recordId();

    int index();

    /**
     * Showing a record, or nothing when {@code recordId} is {@code null}.
     */
    record Viewing(String recordId, int index) implements NavigationState {
        public static Viewing nothing() {
            return new Viewing(null, 0);
        }
    }

    /**
     * A move was requested with unsaved edits; waits for save, discard or cancel.
     * {@code error} holds the message of a failed save-and-continue.
     */
    record ConfirmPending(Direction direction, String recordId, int index, String error) implements NavigationState {
    }
}
