package io.jamsession.server.core;

public record VoteStatus(String songId, boolean voted, int voteCount) {}
