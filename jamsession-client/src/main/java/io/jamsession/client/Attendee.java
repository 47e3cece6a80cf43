package io.jamsession.client;

import java.time.Instant;

public record Attendee(String attendeeId, String name, Instant registeredAt) {}
