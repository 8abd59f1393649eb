/**
 * Remote call outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for the result of a single
 * attempt against the remote API.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.autoquant.resilience.core.outcome.Success} - Completed with a value</li>
 *   <li>{@link com.autoquant.resilience.core.outcome.TransientFailure} - Temporary failure (retryable)</li>
 *   <li>{@link com.autoquant.resilience.core.outcome.PermanentFailure} - Permanent failure (never retried)</li>
 *   <li>{@link com.autoquant.resilience.core.outcome.Timeout} - Attempt timed out or was cancelled (retryable)</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Outcome&lt;Order&gt; outcome = classifier.classify(exception, elapsedMs);
 * circuitBreaker.record(permit, outcome);
 * if (outcome instanceof Success&lt;Order&gt; success) {
 *     return success.value();
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author AutoQuant Team
 */
package com.autoquant.resilience.core.outcome;
