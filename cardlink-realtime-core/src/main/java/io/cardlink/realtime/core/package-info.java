/**
 * Protocol-centric core for the Cardlink real-time channels.
 *
 * <p>This module is deliberately transport-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants (paths, query keys, discriminants, close codes)</li>
 *   <li>Endpoint and URL helpers</li>
 *   <li>Connection state, disconnect reasons and the exception hierarchy</li>
 *   <li>The credential lookup contract</li>
 * </ul>
 *
 * <p>Socket transports, JSON handling and the channel clients live in other modules.
 */
package io.cardlink.realtime.core;
