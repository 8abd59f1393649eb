package com.autoquant.resilience.core.protection;

import com.autoquant.resilience.core.model.CallTag;

import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link CircuitBreaker#allow(CallTag)}가 돌려주는 허가 1건.
 *
 * <p>허가마다 새 인스턴스가 발급되며, 동등성은 인스턴스 동일성(identity)입니다.
 * 같은 {@link CallTag}를 가진 호출이 여럿이어도 Circuit Breaker는 허가 객체로
 * Half-Open probe 소유자를 구분합니다.</p>
 *
 * <p><strong>종류:</strong></p>
 * <ul>
 *   <li>{@link #granted(CallTag)}: CLOSED 상태의 일반 허가</li>
 *   <li>{@link #probe(CallTag)}: HALF_OPEN 상태의 probe 허가 (동시에 최대 1개)</li>
 *   <li>{@link #rejected(CallTag)}: 거부. {@code record()}에 전달할 수 없음</li>
 * </ul>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public final class CircuitPermit {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final long id;
    private final CallTag tag;
    private final boolean granted;
    private final boolean probe;

    private CircuitPermit(CallTag tag, boolean granted, boolean probe) {
        if (tag == null) {
            throw new IllegalArgumentException("tag cannot be null");
        }
        this.id = SEQUENCE.incrementAndGet();
        this.tag = tag;
        this.granted = granted;
        this.probe = probe;
    }

    /**
     * 일반 허가 발급.
     *
     * @param tag 호출 태그
     * @return 새 허가
     */
    public static CircuitPermit granted(CallTag tag) {
        return new CircuitPermit(tag, true, false);
    }

    /**
     * Half-Open probe 허가 발급.
     *
     * @param tag 호출 태그
     * @return 새 probe 허가
     */
    public static CircuitPermit probe(CallTag tag) {
        return new CircuitPermit(tag, true, true);
    }

    /**
     * 거부 결과 생성.
     *
     * @param tag 호출 태그
     * @return 거부된 허가
     */
    public static CircuitPermit rejected(CallTag tag) {
        return new CircuitPermit(tag, false, false);
    }

    /**
     * 발급 순번 (로깅용).
     *
     * @return 프로세스 내에서 증가하는 순번
     */
    public long getId() {
        return id;
    }

    public CallTag getTag() {
        return tag;
    }

    public boolean isGranted() {
        return granted;
    }

    public boolean isProbe() {
        return probe;
    }

    @Override
    public String toString() {
        String kind = probe ? "probe" : granted ? "granted" : "rejected";
        return "CircuitPermit{#" + id + ", " + kind + ", " + tag.getValue() + '}';
    }
}
