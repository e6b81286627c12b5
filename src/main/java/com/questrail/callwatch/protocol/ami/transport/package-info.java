/**
 * Manager Protocol Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty TCP, a simulator, or a
 * test double) and the transport session.
 *
 * <p>Everything above the adapter sees only:</p>
 * <ul>
 *   <li>Raw inbound chunks as {@code byte[]}</li>
 *   <li>Connection lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no framing, no parsing)</li>
 *   <li>Not retry connections or schedule timers of their own</li>
 *   <li>Not report a connection the caller closed as lost</li>
 * </ul>
 *
 * <p>All protocol behavior lives in
 * {@code com.questrail.callwatch.protocol.ami.internal.session.AmiSession}.</p>
 */
package com.questrail.callwatch.protocol.ami.transport;
