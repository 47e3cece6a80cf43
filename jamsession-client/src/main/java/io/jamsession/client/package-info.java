/**
 * Java client for jam sessions: {@link io.jamsession.client.JamSessionClient} for the HTTP API and
 * {@link io.jamsession.client.JamFeedClient} for the live event feed.
 */
package io.jamsession.client;
