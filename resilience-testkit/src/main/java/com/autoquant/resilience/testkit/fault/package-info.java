/**
 * Fault injection harness.
 *
 * <p>Wrappers around a real {@link com.autoquant.resilience.core.operation.RemoteOperation}
 * that substitute normalized failures per invocation, used by unit and stress tests.</p>
 *
 * <h2>Modes</h2>
 * <ul>
 *   <li>{@link com.autoquant.resilience.testkit.fault.ScriptedFaultInjector} - ordered, replayable script</li>
 *   <li>{@link com.autoquant.resilience.testkit.fault.RandomFaultInjector} - seeded probability with optional burst window</li>
 * </ul>
 *
 * @since 1.0.0
 * @author AutoQuant Team
 */
package com.autoquant.resilience.testkit.fault;
