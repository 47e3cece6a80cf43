package io.jamsession.server.core;

public record PlayResult(String songId, boolean played) {}
