/**
 * Listener integration for Javalin, and the {@link io.leanweb.server.javalin.LeanWebServer}
 * bootstrap that wires it to the server core.
 */
package io.leanweb.server.javalin;
