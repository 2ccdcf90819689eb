/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>Structured logging uses Log4j2 with ThreadContext keys for correlating HTTP requests,
 * commands and sentinel ticks across asynchronous boundaries.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request, set by
 *       {@link com.phillippitts.ambient.config.logging.MdcFilter}</li>
 *   <li>{@code commandId} - Identifier of a command while it is routed and executed</li>
 *   <li>{@code sentinel} - {@code screen} or {@code audio} on sentinel threads</li>
 * </ul>
 *
 * <p>Log Format (see {@code log4j2-spring.xml}):
 * <pre>
 * 2026-03-02 09:14:05.118 INFO  [command-pool-1] c.p.a.s.c.CommandService [req=.. cmd=.. sentinel=] - message
 * </pre>
 *
 * @see com.phillippitts.ambient.config.logging.MdcFilter
 */
package com.phillippitts.ambient.config.logging;
