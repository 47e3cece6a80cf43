package io.jamsession.client;

import java.util.List;

public record VoteResult(String songId, boolean voted, int voteCount, List<QueueEntry> queue) {

    public VoteResult {
        queue = queue == null ? List.of() : List.copyOf(queue);
    }
}
