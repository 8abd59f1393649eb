package com.autoquant.resilience.testkit.fault;

import java.util.ArrayList;
import java.util.List;

/**
 * 순서가 정해진 재생 가능한 장애 시나리오.
 *
 * <p>호출마다 한 항목씩 소비하며, 모두 소비하면 {@link Fault#PASS}를 반환합니다.
 * {@link #rewind()}로 처음부터 다시 재생할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * FaultScript script = FaultScript.builder()
 *     .fail(FaultType.TRANSIENT, 2)
 *     .pass()
 *     .build();
 * }</pre>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public final class FaultScript {

    private final List<Fault> faults;
    private int cursor;

    private FaultScript(List<Fault> faults) {
        this.faults = List.copyOf(faults);
    }

    /**
     * 주어진 순서의 스크립트 생성.
     *
     * @param faults 장애 목록
     * @return FaultScript
     * @throws IllegalArgumentException faults가 null이거나 null 항목을 포함하는 경우
     */
    public static FaultScript of(Fault... faults) {
        if (faults == null) {
            throw new IllegalArgumentException("faults cannot be null");
        }
        List<Fault> list = new ArrayList<>();
        for (Fault fault : faults) {
            if (fault == null) {
                throw new IllegalArgumentException("fault entries cannot be null");
            }
            list.add(fault);
        }
        return new FaultScript(list);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 다음 장애 소비.
     *
     * @return 다음 Fault, 소진되었으면 {@link Fault#PASS}
     */
    public synchronized Fault next() {
        if (cursor >= faults.size()) {
            return Fault.PASS;
        }
        return faults.get(cursor++);
    }

    /**
     * 처음부터 다시 재생.
     */
    public synchronized void rewind() {
        cursor = 0;
    }

    /**
     * 남은 항목 수.
     *
     * @return 아직 소비되지 않은 항목 수
     */
    public synchronized int remaining() {
        return faults.size() - cursor;
    }

    public synchronized boolean isExhausted() {
        return cursor >= faults.size();
    }

    /**
     * 스크립트 전체 항목 (불변).
     *
     * @return 항목 목록
     */
    public List<Fault> entries() {
        return faults;
    }

    /**
     * FaultScript 빌더.
     */
    public static final class Builder {

        private final List<Fault> faults = new ArrayList<>();

        private Builder() {
        }

        public Builder pass() {
            faults.add(Fault.PASS);
            return this;
        }

        /**
         * 같은 종류의 실패를 count번 추가.
         *
         * @param type 장애 종류 (TIMEOUT은 지연 0)
         * @param count 반복 횟수
         * @return this
         */
        public Builder fail(FaultType type, int count) {
            if (count < 0) {
                throw new IllegalArgumentException("count cannot be negative (current: " + count + ")");
            }
            for (int i = 0; i < count; i++) {
                faults.add(new Fault(type, 0));
            }
            return this;
        }

        public Builder timeout(long delayMs) {
            faults.add(Fault.timeout(delayMs));
            return this;
        }

        public Builder add(Fault fault) {
            if (fault == null) {
                throw new IllegalArgumentException("fault cannot be null");
            }
            faults.add(fault);
            return this;
        }

        public FaultScript build() {
            return new FaultScript(faults);
        }
    }
}
