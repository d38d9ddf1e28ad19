/**
 * Process-backed transports.
 *
 * <p>{@link com.ryuqq.fleet.adapter.transport.LocalTransport} runs commands through a
 * local shell, {@link com.ryuqq.fleet.adapter.transport.SshTransport} through the system
 * {@code ssh} binary. {@link com.ryuqq.fleet.adapter.transport.TransportRouter} picks one
 * per host. Timeouts surface as
 * {@link com.ryuqq.fleet.core.exception.CommandTimeoutException}.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
package com.ryuqq.fleet.adapter.transport;
