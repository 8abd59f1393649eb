/**
 * Contract test bases that every protection implementation must pass.
 *
 * @since 1.0.0
 * @author AutoQuant Team
 */
package com.autoquant.resilience.testkit.contract;
