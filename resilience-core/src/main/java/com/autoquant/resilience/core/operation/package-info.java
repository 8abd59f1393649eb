/**
 * Remote operation abstraction and outcome classification.
 *
 * <p>The core consumes only {@link com.autoquant.resilience.core.operation.RemoteOperation}.
 * Vendor errors are normalized outside the core; the classifiers here map the normalized
 * exceptions to {@link com.autoquant.resilience.core.outcome.Outcome} values.</p>
 *
 * @since 1.0.0
 * @author AutoQuant Team
 */
package com.autoquant.resilience.core.operation;
