/**
 * Envelope and discovery types shared by server and client.
 *
 * <p>The kind of an envelope is its type: {@link io.agentwire.model.RequestEnvelope} never carries
 * a correlation id and {@link io.agentwire.model.ResponseEnvelope} always does.
 * {@link io.agentwire.model.EnvelopeCodec} enforces the same rules on decode.
 */
package io.agentwire.model;
