package io.jamsession.client;

import java.util.List;

/**
 * Full jam state, refetched after connecting and after every feed event.
 */
public record QueueState(String jamId, String status, String currentSongId, List<QueueEntry> queue) {

    public QueueState {
        queue = queue == null ? List.of() : List.copyOf(queue);
    }
}
