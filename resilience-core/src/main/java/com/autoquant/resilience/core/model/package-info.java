/**
 * 호출 식별 모델.
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
package com.autoquant.resilience.core.model;
