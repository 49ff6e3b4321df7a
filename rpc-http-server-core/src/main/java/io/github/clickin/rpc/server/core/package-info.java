/**
 * Framework-neutral server core for procedure calls over HTTP.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.github.clickin.rpc.server.core.RpcRequestHandler} (classification, input extraction,
 *   batch dispatch and response building)</li>
 *   <li>{@link io.github.clickin.rpc.server.core.ResponseEnvelope} (wire envelopes)</li>
 *   <li>Request-bound hooks: context factory, error listener and response meta provider</li>
 * </ul>
 *
 * <p>Framework integrations adapt {@link io.github.clickin.rpc.server.core.ServerRequest} and
 * {@link io.github.clickin.rpc.server.core.ServerResponse} to their HTTP runtimes.
 */
package io.github.clickin.rpc.server.core;
