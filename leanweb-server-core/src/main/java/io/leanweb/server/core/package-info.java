/**
 * Listener-neutral server core.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.leanweb.server.core.AcceptLoop} and {@link io.leanweb.server.core.ConnectionAdmission} (bounded accept cycle)</li>
 *   <li>{@link io.leanweb.server.core.RequestPipeline} (parse, session, dispatch, respond)</li>
 *   <li>{@link io.leanweb.server.core.InMemorySessionStore} (reference session store)</li>
 *   <li>{@link io.leanweb.server.core.CsrfTokenPostProcessor} (default HTML rewrite)</li>
 * </ul>
 *
 * <p>Listener integrations adapt their exchanges to {@link io.leanweb.server.core.InboundConnection}
 * and {@link io.leanweb.server.core.ServerResponse}, and supply a
 * {@link io.leanweb.server.core.ConnectionSource}.
 */
package io.leanweb.server.core;
