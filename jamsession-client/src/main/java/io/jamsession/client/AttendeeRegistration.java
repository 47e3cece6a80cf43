package io.jamsession.client;

/**
 * Result of joining a jam under a display name.
 *
 * @param created false when the name already existed and was re-bound to this client's session
 * @param claimedVotes anonymous votes of this session now counted for the attendee
 */
public record AttendeeRegistration(String attendeeId, String name, boolean created, int claimedVotes) {}
