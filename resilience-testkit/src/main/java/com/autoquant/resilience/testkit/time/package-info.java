/**
 * 결정적 테스트를 위한 가상 시간 도구.
 *
 * @since 1.0.0
 * @author AutoQuant Team
 */
package com.autoquant.resilience.testkit.time;
