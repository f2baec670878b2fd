/**
 * PBX Transport Ports
 * =============================================================================
 *
 * These interfaces define the framework-agnostic boundary between a concrete
 * networking implementation (Netty TCP in production, in-memory fakes in
 * tests) and the PBX core.
 *
 * <p>Everything above the transport sees only:</p>
 * <ul>
 *   <li>{@link com.questrail.pbx.transport.TuConnection} handles</li>
 *   <li>Complete inbound lines as {@code String}</li>
 *   <li>Connection lifecycle notifications (opened/closed)</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations MUST:
 * <ul>
 *   <li>Perform transport I/O only (no command interpretation)</li>
 *   <li>Keep framework types inside their own package</li>
 *   <li>Deliver outbound lines in the order {@code writeLine} was called</li>
 * </ul>
 */
package com.questrail.pbx.transport;
