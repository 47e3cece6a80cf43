package io.jamsession.client;

public record VoteStatus(String songId, boolean voted, int voteCount) {}
