package io.jamsession.client;

/**
 * Identity and lifecycle status of a jam looked up by slug.
 */
public record JamInfo(String jamId, String name, String slug, String status) {}
