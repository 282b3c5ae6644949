/**
 * Request execution and orchestration.
 *
 * <ul>
 *   <li>{@link io.httpr.client.Service} and {@link io.httpr.client.Request} describe calls</li>
 *   <li>{@link io.httpr.client.RequestExecutor} runs one request with hooks and fixed-delay retries</li>
 *   <li>{@link io.httpr.client.Group} runs many requests as a gated sequence or a parallel batch</li>
 * </ul>
 *
 * <p>The HTTP library underneath is chosen through {@code io.httpr.http.spi.HttpClientAdapter}.
 */
package io.httpr.client;
