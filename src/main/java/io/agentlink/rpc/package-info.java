/**
 * Request/reply plumbing shared by agents and the registry.
 *
 * <p>{@link io.agentlink.rpc.EnvelopeServer} accepts connections and answers frames through an
 * {@link io.agentlink.rpc.EnvelopeHandler}, which may write several replies to one request;
 * {@link io.agentlink.rpc.EnvelopeClient} sends one request at a time and enforces the call
 * deadline.
 */
package io.agentlink.rpc;
