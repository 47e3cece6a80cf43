package io.jamsession.server.core;

public record UnregisterResult(String songId, String attendeeId, int activeCount) {}
