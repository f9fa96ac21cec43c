/**
 * Server side: {@link io.agentlink.server.LocalAgent} exports an agent on an endpoint.
 */
package io.agentlink.server;
