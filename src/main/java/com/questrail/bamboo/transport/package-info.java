/**
 * Script Endpoint Ports
 * =============================================================================
 *
 * These interfaces define the byte-level boundary between a bridge channel and
 * whatever actually carries payloads to the page: an embedded engine's message
 * router, an in-process loopback, or a renderer helper process reached over
 * loopback datagrams.
 *
 * <p>Everything above this boundary sees only:</p>
 * <ul>
 *   <li>Complete payloads as {@code byte[]}</li>
 *   <li>Transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations MUST:
 * <ul>
 *   <li>Perform transport I/O only</li>
 *   <li>Never decode or interpret bridge messages</li>
 *   <li>Deliver each payload as one atomic unit</li>
 * </ul>
 *
 * <p>Marshaling onto the owner thread is the channel's job, not the endpoint's.</p>
 */
package com.questrail.bamboo.transport;
