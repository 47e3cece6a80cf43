package io.jamsession.client;

/**
 * One song of a jam's queue as served by the API.
 *
 * @param order performance order, 1-based
 */
public record QueueEntry(int order, String songId, String title, String artist, int voteCount, boolean played) {}
