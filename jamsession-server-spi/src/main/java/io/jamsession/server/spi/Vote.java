package io.jamsession.server.spi;

import io.jamsession.core.ActorId;

import java.time.Instant;
import java.util.Objects;

/**
 * One actor's vote for one song in one jam. The row existing is the voted state.
 */
public record Vote(String jamId, String songId, ActorId actor, Instant votedAt) {

    public Vote {
        Objects.requireNonNull(jamId, "jamId");
        Objects.requireNonNull(songId, "songId");
        Objects.requireNonNull(actor, "actor");
    }
}
