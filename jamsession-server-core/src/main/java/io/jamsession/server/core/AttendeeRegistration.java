package io.jamsession.server.core;

/**
 * Result of joining a jam under a display name.
 *
 * @param created false when an existing name was re-bound to the caller's session
 * @param claimedVotes anonymous votes of the session that now count for the attendee
 */
public record AttendeeRegistration(String attendeeId, String name, boolean created, int claimedVotes) {}
