/**
 * Extension points implemented by applications and storage backends.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.leanweb.server.spi.Dispatcher} (routing)</li>
 *   <li>{@link io.leanweb.server.spi.SessionStore} and {@link io.leanweb.server.spi.Session}</li>
 *   <li>{@link io.leanweb.server.spi.ErrorRedirects} and {@link io.leanweb.server.spi.PostProcessor} hooks</li>
 * </ul>
 */
package io.leanweb.server.spi;
