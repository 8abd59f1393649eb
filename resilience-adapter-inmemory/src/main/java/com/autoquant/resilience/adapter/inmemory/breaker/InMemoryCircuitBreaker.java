package com.autoquant.resilience.adapter.inmemory.breaker;

import com.autoquant.resilience.core.model.CallTag;
import com.autoquant.resilience.core.outcome.Outcome;
import com.autoquant.resilience.core.protection.CircuitBreaker;
import com.autoquant.resilience.core.protection.CircuitBreakerConfig;
import com.autoquant.resilience.core.protection.CircuitBreakerSnapshot;
import com.autoquant.resilience.core.protection.CircuitBreakerState;
import com.autoquant.resilience.core.protection.CircuitPermit;
import com.autoquant.resilience.core.statemachine.CircuitTransition;
import com.autoquant.resilience.core.time.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 프로세스 로컬 Circuit Breaker 구현체.
 *
 * <p>보호 대상 리소스마다 하나씩 생성하여 프로세스 수명 동안 공유합니다.
 * 프로세스 간 상태 공유나 재시작 후 복원은 하지 않습니다.</p>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>상태와 카운터는 단일 {@link ReentrantLock}으로 보호</li>
 *   <li>allow()의 상태 확인과 전이가 하나의 임계 구역에서 수행되어,
 *       HALF_OPEN probe가 동시에 둘 이상 허용되지 않음</li>
 *   <li>잠금 안에서는 시계 조회와 카운터 갱신만 수행 (원격 호출, 대기 없음)</li>
 * </ul>
 *
 * <p><strong>Probe 소유자:</strong></p>
 * <ul>
 *   <li>OPEN → HALF_OPEN 전이를 일으킨 호출자, 또는 빈 probe 슬롯을 얻은 호출자에게 probe 허가 발급</li>
 *   <li>소유자는 {@link CircuitPermit} 인스턴스로 판단. 같은 {@link CallTag}를 쓰는 다른 호출은 소유자가 아님</li>
 *   <li>HALF_OPEN에서 probe 허가가 아닌 성공 보고(CLOSED 시절에 허용된 늦은 호출)는 무시</li>
 *   <li>HALF_OPEN에서 실패 보고는 보고자와 무관하게 즉시 OPEN</li>
 * </ul>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public final class InMemoryCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Ticker ticker;
    private final ReentrantLock lock = new ReentrantLock();

    // 아래 필드는 모두 lock으로 보호
    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private final Deque<Long> failureTimestamps = new ArrayDeque<>();
    private int successCount;
    private long lastTripAtNanos;
    private long tripCount;
    private CircuitPermit probePermit;

    /**
     * 생성자 (시스템 Ticker 사용).
     *
     * @param name 보호 대상 리소스 이름
     * @param config 설정
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     */
    public InMemoryCircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Ticker.system());
    }

    /**
     * 생성자 (Ticker 주입).
     *
     * @param name 보호 대상 리소스 이름
     * @param config 설정
     * @param ticker 단조 시계
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     */
    public InMemoryCircuitBreaker(String name, CircuitBreakerConfig config, Ticker ticker) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (ticker == null) {
            throw new IllegalArgumentException("ticker cannot be null");
        }
        this.name = name;
        this.config = config;
        this.ticker = ticker;
    }

    @Override
    public CircuitPermit allow(CallTag tag) {
        if (tag == null) {
            throw new IllegalArgumentException("tag cannot be null");
        }
        lock.lock();
        try {
            return switch (state) {
                case CLOSED -> CircuitPermit.granted(tag);
                case OPEN -> tryStartProbe(tag);
                case HALF_OPEN -> tryAcquireProbeSlot(tag);
            };
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void record(CircuitPermit permit, Outcome<?> outcome) {
        if (permit == null) {
            throw new IllegalArgumentException("permit cannot be null");
        }
        if (!permit.isGranted()) {
            throw new IllegalArgumentException("Cannot record outcome of a rejected permit: " + permit);
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        lock.lock();
        try {
            switch (state) {
                case CLOSED -> recordWhileClosed(outcome);
                case HALF_OPEN -> recordWhileHalfOpen(permit, outcome);
                case OPEN -> log.debug("Circuit '{}' ignored {} from {} while OPEN", name, outcome.kind(), permit);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            pruneExpiredFailures(ticker.nanoTime());
            return new CircuitBreakerSnapshot(
                name,
                state,
                failureTimestamps.size(),
                successCount,
                tripCount,
                lastTripAtNanos,
                probePermit != null
            );
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            CircuitBreakerState previous = state;
            state = CircuitBreakerState.CLOSED;
            clearCounters();
            log.info("Circuit '{}' manually reset: {} → {}", name, previous, CircuitBreakerState.CLOSED);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 설정 조회.
     *
     * @return 설정
     */
    public CircuitBreakerConfig getConfig() {
        return config;
    }

    /**
     * OPEN 상태에서 cooldown 경과 여부 확인 후 probe 시작.
     */
    private CircuitPermit tryStartProbe(CallTag tag) {
        long elapsedNanos = ticker.nanoTime() - lastTripAtNanos;
        if (elapsedNanos < config.openDurationMs() * 1_000_000L) {
            return CircuitPermit.rejected(tag);
        }
        state = CircuitTransition.transition(state, CircuitBreakerState.HALF_OPEN);
        successCount = 0;
        probePermit = CircuitPermit.probe(tag);
        log.info("Circuit '{}' {} → {}: {}", name, CircuitBreakerState.OPEN, state, probePermit);
        return probePermit;
    }

    /**
     * HALF_OPEN 상태에서 probe 슬롯 획득 시도.
     */
    private CircuitPermit tryAcquireProbeSlot(CallTag tag) {
        if (probePermit != null) {
            return CircuitPermit.rejected(tag);
        }
        probePermit = CircuitPermit.probe(tag);
        log.debug("Circuit '{}' {} ({}/{} successes)", name, probePermit, successCount, config.closeThreshold());
        return probePermit;
    }

    private void recordWhileClosed(Outcome<?> outcome) {
        long now = ticker.nanoTime();
        if (outcome.isSuccess()) {
            failureTimestamps.clear();
            return;
        }
        pruneExpiredFailures(now);
        failureTimestamps.addLast(now);
        if (failureTimestamps.size() >= config.failureThreshold()) {
            int failures = failureTimestamps.size();
            state = CircuitTransition.transition(state, CircuitBreakerState.OPEN);
            lastTripAtNanos = now;
            tripCount++;
            clearCounters();
            log.warn("Circuit '{}' {} → {} after {} failure(s), last: {} (trip #{})",
                name, CircuitBreakerState.CLOSED, state, failures, outcome.kind(), tripCount);
        }
    }

    private void recordWhileHalfOpen(CircuitPermit permit, Outcome<?> outcome) {
        if (outcome.isFailure()) {
            state = CircuitTransition.transition(state, CircuitBreakerState.OPEN);
            lastTripAtNanos = ticker.nanoTime();
            clearCounters();
            log.warn("Circuit '{}' {} → {}: {} failed with {}",
                name, CircuitBreakerState.HALF_OPEN, state, permit, outcome.kind());
            return;
        }
        if (permit != probePermit) {
            log.debug("Circuit '{}' ignored success from {}, not the current probe", name, permit);
            return;
        }
        successCount++;
        probePermit = null;
        if (successCount >= config.closeThreshold()) {
            state = CircuitTransition.transition(state, CircuitBreakerState.CLOSED);
            clearCounters();
            log.info("Circuit '{}' {} → {}: recovered", name, CircuitBreakerState.HALF_OPEN, state);
        }
    }

    /**
     * 슬라이딩 윈도우 밖의 실패 제거 (고정 카운터 모드에서는 아무 동작 안 함).
     */
    private void pruneExpiredFailures(long now) {
        if (!config.isSlidingWindow()) {
            return;
        }
        long windowNanos = config.failureWindowMs() * 1_000_000L;
        while (!failureTimestamps.isEmpty() && now - failureTimestamps.peekFirst() > windowNanos) {
            failureTimestamps.pollFirst();
        }
    }

    private void clearCounters() {
        failureTimestamps.clear();
        successCount = 0;
        probePermit = null;
    }
}
