package io.jamsession.server.core;

public record JamStatusResult(String jamId, String status) {}
