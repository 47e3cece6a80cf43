/**
 * Server-side SPI for jam sessions.
 *
 * <p>The persistence SPI is blocking and minimal. Framework integrations decide where the calls run;
 * the server core adds retries, ranking and broadcast on top of it.
 */
package io.jamsession.server.spi;
