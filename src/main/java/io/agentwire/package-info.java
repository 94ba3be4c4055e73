/**
 * AgentWire source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentwire.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.agentwire.model.EnvelopeCodec} defines the wire format of envelopes and descriptors.</li>
 *   <li>{@code io.agentwire.server.MessageServer} exposes a handler over HTTP.</li>
 *   <li>{@code io.agentwire.client.MessageClient} sends requests and caches discovered agents.</li>
 * </ul>
 */
package io.agentwire;
