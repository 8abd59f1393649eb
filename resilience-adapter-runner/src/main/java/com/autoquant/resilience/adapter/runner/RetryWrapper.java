package com.autoquant.resilience.adapter.runner;

import com.autoquant.resilience.core.exception.CallCancelledException;
import com.autoquant.resilience.core.exception.CircuitOpenException;
import com.autoquant.resilience.core.exception.PermanentFailureException;
import com.autoquant.resilience.core.exception.RemoteTimeoutException;
import com.autoquant.resilience.core.exception.RetryExhaustedException;
import com.autoquant.resilience.core.executor.RetryExecutor;
import com.autoquant.resilience.core.model.CallTag;
import com.autoquant.resilience.core.operation.DefaultOutcomeClassifier;
import com.autoquant.resilience.core.operation.OutcomeClassifier;
import com.autoquant.resilience.core.operation.RemoteOperation;
import com.autoquant.resilience.core.outcome.Outcome;
import com.autoquant.resilience.core.outcome.PermanentFailure;
import com.autoquant.resilience.core.outcome.Success;
import com.autoquant.resilience.core.protection.CircuitBreaker;
import com.autoquant.resilience.core.protection.CircuitBreakerSnapshot;
import com.autoquant.resilience.core.protection.CircuitPermit;
import com.autoquant.resilience.core.retry.RetryPolicy;
import com.autoquant.resilience.core.time.Deadline;
import com.autoquant.resilience.core.time.Sleeper;
import com.autoquant.resilience.core.time.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Retry Wrapper 구현체.
 *
 * <p>원격 작업을 Circuit Breaker를 거쳐 실행하고, 결과 분류에 따라
 * 백오프와 지터를 적용하여 재시도합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * execute(tag, operation, policy, deadline)
 *   ↓
 * For attempt = 1..maxAttempts:
 *   0. 데드라인까지 1ms 미만 → RetryExhaustedException (허가 요청, 기록 없음)
 *   1. circuitBreaker.allow(tag) → 거부면 CircuitOpenException (시도 아님, 백오프 없음)
 *   2. operation.call() → classifier.classify() → Outcome
 *   3. circuitBreaker.record(permit, outcome) → 재시도 판단 전에 항상 기록
 *   4. 분기:
 *      - Success          → 값 반환
 *      - PermanentFailure → PermanentFailureException (재시도 없음)
 *      - 재시도 대상 아님   → RetryExhaustedException
 *      - 재시도 대상       → backoff(attempt) 대기 후 계속
 *                           (대기가 데드라인을 넘기면 RetryExhaustedException)
 * 시도 소진 → RetryExhaustedException (마지막 원인 포함)
 * </pre>
 *
 * <p><strong>시도 실행 방식:</strong></p>
 * <ul>
 *   <li>시도 타임아웃과 데드라인이 모두 없으면 호출 스레드에서 직접 실행</li>
 *   <li>둘 중 하나라도 있으면 attempt executor에서 실행하고 남은 시간만큼만 대기,
 *       초과 시 작업을 취소하고 Timeout으로 분류</li>
 * </ul>
 *
 * <p><strong>취소:</strong> 시도 도중 호출 스레드가 인터럽트되면 진행 중인 작업을 취소하고,
 * Circuit Breaker에 Timeout을 기록한 뒤 {@link CallCancelledException}을 던집니다.
 * 인터럽트 플래그는 복원됩니다.</p>
 *
 * <p><strong>예상치 못한 예외:</strong> 허가를 받은 뒤 시도 실행 중에 발생한 {@link RuntimeException}
 * (예: executor의 {@code RejectedExecutionException}, 분류기 오류)과 {@link Error}는
 * PermanentFailure로 기록한 뒤 그대로 전파합니다. 발급받은 허가는 어떤 경로로 끝나든
 * 정확히 한 번 기록됩니다.</p>
 *
 * <p><strong>동시성:</strong> 인스턴스는 thread-safe합니다. 백오프 대기는 호출 스레드만 멈추며,
 * 공유 상태는 Circuit Breaker와 통계 카운터뿐입니다.</p>
 *
 * @author AutoQuant Team
 * @since 1.0.0
 */
public final class RetryWrapper implements RetryExecutor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RetryWrapper.class);

    private final CircuitBreaker circuitBreaker;
    private final OutcomeClassifier classifier;
    private final BackoffCalculator backoffCalculator;
    private final Sleeper sleeper;
    private final Ticker ticker;
    private final ExecutorService attemptExecutor;
    private final boolean ownsAttemptExecutor;

    private final AtomicLong calls = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong exhausted = new AtomicLong();
    private final AtomicLong permanentFailures = new AtomicLong();
    private final AtomicLong circuitOpenRejections = new AtomicLong();
    private final AtomicLong cancellations = new AtomicLong();

    /**
     * 생성자 (기본 분류기, 백오프 계산기, 시스템 시계/Sleeper 사용).
     *
     * @param circuitBreaker 공유 Circuit Breaker
     * @throws IllegalArgumentException circuitBreaker가 null인 경우
     */
    public RetryWrapper(CircuitBreaker circuitBreaker) {
        this(circuitBreaker, new DefaultOutcomeClassifier(), new BackoffCalculator(), Sleeper.system(), Ticker.system());
    }

    /**
     * 생성자 (협력 객체 주입, attempt executor는 내부 생성).
     *
     * @param circuitBreaker 공유 Circuit Breaker
     * @param classifier 예외 분류기
     * @param backoffCalculator 백오프 계산기
     * @param sleeper 백오프 대기
     * @param ticker 단조 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryWrapper(CircuitBreaker circuitBreaker, OutcomeClassifier classifier,
                        BackoffCalculator backoffCalculator, Sleeper sleeper, Ticker ticker) {
        this(circuitBreaker, classifier, backoffCalculator, sleeper, ticker,
            Executors.newCachedThreadPool(new AttemptThreadFactory()), true);
    }

    /**
     * 생성자 (attempt executor 주입).
     *
     * <p>주입된 executor의 수명은 호출자가 관리합니다. {@link #close()}는 이를 종료하지 않습니다.</p>
     *
     * @param circuitBreaker 공유 Circuit Breaker
     * @param classifier 예외 분류기
     * @param backoffCalculator 백오프 계산기
     * @param sleeper 백오프 대기
     * @param ticker 단조 시계
     * @param attemptExecutor 시간 제한이 있는 시도를 실행할 executor
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryWrapper(CircuitBreaker circuitBreaker, OutcomeClassifier classifier,
                        BackoffCalculator backoffCalculator, Sleeper sleeper, Ticker ticker,
                        ExecutorService attemptExecutor) {
        this(circuitBreaker, classifier, backoffCalculator, sleeper, ticker, attemptExecutor, false);
    }

    private RetryWrapper(CircuitBreaker circuitBreaker, OutcomeClassifier classifier,
                         BackoffCalculator backoffCalculator, Sleeper sleeper, Ticker ticker,
                         ExecutorService attemptExecutor, boolean ownsAttemptExecutor) {
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (ticker == null) {
            throw new IllegalArgumentException("ticker cannot be null");
        }
        if (attemptExecutor == null) {
            throw new IllegalArgumentException("attemptExecutor cannot be null");
        }

        this.circuitBreaker = circuitBreaker;
        this.classifier = classifier;
        this.backoffCalculator = backoffCalculator;
        this.sleeper = sleeper;
        this.ticker = ticker;
        this.attemptExecutor = attemptExecutor;
        this.ownsAttemptExecutor = ownsAttemptExecutor;
    }

    @Override
    public <T> T execute(CallTag tag, RemoteOperation<T> operation, RetryPolicy policy, Deadline deadline) {
        validateInput(tag, operation, policy, deadline);
        calls.incrementAndGet();

        Outcome<T> last = null;
        int attempt = 1;
        while (true) {
            // 0. 남은 시간이 1ms 미만이면 허가 요청 없이 종료
            if (isOutOfTime(deadline)) {
                exhausted.incrementAndGet();
                log.warn("Deadline reached before attempt {} of {}", attempt, tag);
                throw new RetryExhaustedException(tag, attempt - 1,
                    last == null ? null : last.kind(), true, last == null ? null : last.causeOrNull());
            }

            // 1. Circuit Breaker 허가 (거부는 시도로 세지 않음)
            CircuitPermit permit = circuitBreaker.allow(tag);
            if (!permit.isGranted()) {
                circuitOpenRejections.incrementAndGet();
                log.warn("Circuit '{}' rejected {} before attempt {}", circuitBreaker.getName(), tag, attempt);
                throw new CircuitOpenException(tag, circuitBreaker.getName(), circuitBreaker.getState(),
                    last == null ? null : last.causeOrNull());
            }

            // 2. 실행 및 분류
            Outcome<T> outcome = runGuarded(permit, operation, policy, deadline, attempt);

            // 3. 재시도 판단 전에 항상 기록
            circuitBreaker.record(permit, outcome);
            last = outcome;

            // 4. 분기
            if (outcome instanceof Success<T> success) {
                successes.incrementAndGet();
                log.debug("Call {} succeeded on attempt {}/{}", tag, attempt, policy.maxAttempts());
                return success.value();
            }
            if (outcome instanceof PermanentFailure<T> permanent) {
                permanentFailures.incrementAndGet();
                log.error("Call {} failed permanently on attempt {}: {}", tag, attempt, permanent.cause().toString());
                throw new PermanentFailureException(tag, attempt, permanent.cause());
            }
            if (!policy.isRetryable(outcome.kind())) {
                exhausted.incrementAndGet();
                log.warn("Call {} stopped on non-retryable {} at attempt {}", tag, outcome.kind(), attempt);
                throw new RetryExhaustedException(tag, attempt, outcome.kind(), false, outcome.causeOrNull());
            }
            if (attempt >= policy.maxAttempts()) {
                break;
            }

            long delayMs = backoffCalculator.calculate(policy, attempt);
            if (!deadline.allows(delayMs)) {
                exhausted.incrementAndGet();
                log.warn("Call {} stopped after attempt {}: backoff {}ms would pass {}", tag, attempt, delayMs, deadline);
                throw new RetryExhaustedException(tag, attempt, outcome.kind(), true, outcome.causeOrNull());
            }

            retries.incrementAndGet();
            log.warn("Call {} got {} on attempt {}/{}, retrying in {}ms",
                tag, outcome.kind(), attempt, policy.maxAttempts(), delayMs);
            backoff(tag, attempt, delayMs);
            attempt++;
        }

        exhausted.incrementAndGet();
        log.error("Call {} exhausted {} attempt(s), last outcome: {}", tag, attempt, last.kind());
        throw new RetryExhaustedException(tag, attempt, last.kind(), false, last.causeOrNull());
    }

    /**
     * 누적 통계 스냅샷 조회.
     *
     * @return RetryStats
     */
    public RetryStats stats() {
        return new RetryStats(
            calls.get(),
            retries.get(),
            successes.get(),
            exhausted.get(),
            permanentFailures.get(),
            circuitOpenRejections.get(),
            cancellations.get()
        );
    }

    /**
     * 공유 Circuit Breaker 스냅샷 조회.
     *
     * @return CircuitBreakerSnapshot
     */
    public CircuitBreakerSnapshot circuitSnapshot() {
        return circuitBreaker.snapshot();
    }

    /**
     * 내부에서 생성한 attempt executor 종료.
     *
     * <p>주입받은 executor는 종료하지 않습니다.</p>
     */
    @Override
    public void close() {
        if (ownsAttemptExecutor) {
            attemptExecutor.shutdownNow();
        }
    }

    /**
     * 입력 유효성 검증.
     *
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    private void validateInput(CallTag tag, RemoteOperation<?> operation, RetryPolicy policy, Deadline deadline) {
        if (tag == null) {
            throw new IllegalArgumentException("tag cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (deadline == null) {
            throw new IllegalArgumentException("deadline cannot be null");
        }
    }

    /**
     * 허가를 받은 시도 1회 실행.
     *
     * <p>취소 외의 경로로 예외가 빠져나가면 PermanentFailure를 기록해 허가를 반납한 뒤 전파합니다.</p>
     */
    private <T> Outcome<T> runGuarded(CircuitPermit permit, RemoteOperation<T> operation, RetryPolicy policy,
                                      Deadline deadline, int attempt) {
        try {
            return runAttempt(permit, operation, policy, deadline, attempt);
        } catch (CallCancelledException e) {
            throw e;
        } catch (RuntimeException | Error e) {
            circuitBreaker.record(permit, Outcome.permanentFailure(e));
            permanentFailures.incrementAndGet();
            log.error("Attempt {} of {} aborted by unexpected {}", attempt, permit.getTag(), e.toString());
            throw e;
        }
    }

    /**
     * 시도 1회 실행 및 분류.
     *
     * <p>호출자 취소 시에는 Timeout을 직접 기록한 뒤 {@link CallCancelledException}을 던집니다.</p>
     */
    private <T> Outcome<T> runAttempt(CircuitPermit permit, RemoteOperation<T> operation, RetryPolicy policy,
                                      Deadline deadline, int attempt) {
        long startNanos = ticker.nanoTime();
        long boundMs = attemptBoundMs(policy, deadline);
        if (boundMs < 0) {
            return runInline(permit, operation, attempt, startNanos);
        }
        return runBounded(permit, operation, attempt, startNanos, boundMs);
    }

    private <T> Outcome<T> runInline(CircuitPermit permit, RemoteOperation<T> operation, int attempt, long startNanos) {
        try {
            return Outcome.success(operation.call());
        } catch (InterruptedException e) {
            throw cancelled(permit, attempt, startNanos, e);
        } catch (Exception e) {
            return classifier.classify(e, elapsedMs(startNanos));
        }
    }

    private <T> Outcome<T> runBounded(CircuitPermit permit, RemoteOperation<T> operation, int attempt,
                                      long startNanos, long boundMs) {
        Callable<T> task = operation::call;
        Future<T> future = attemptExecutor.submit(task);
        try {
            return Outcome.success(future.get(boundMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            long elapsed = elapsedMs(startNanos);
            log.debug("Attempt {} of {} timed out after {}ms", attempt, permit.getTag(), elapsed);
            return Outcome.timeout(elapsed, new RemoteTimeoutException("Attempt exceeded " + boundMs + "ms", e));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof Error error) {
                throw error;
            }
            return classifier.classify(cause, elapsedMs(startNanos));
        } catch (InterruptedException e) {
            future.cancel(true);
            throw cancelled(permit, attempt, startNanos, e);
        }
    }

    /**
     * 호출자 취소 처리: Timeout 기록, 인터럽트 플래그 복원.
     */
    private CallCancelledException cancelled(CircuitPermit permit, int attempt, long startNanos,
                                             InterruptedException e) {
        CallTag tag = permit.getTag();
        circuitBreaker.record(permit, Outcome.timeout(elapsedMs(startNanos), e));
        Thread.currentThread().interrupt();
        cancellations.incrementAndGet();
        log.warn("Call {} cancelled during attempt {}", tag, attempt);
        return new CallCancelledException(tag, attempt, e);
    }

    /**
     * 백오프 대기. 대기 중 인터럽트는 취소로 처리합니다 (직전 결과는 이미 기록됨).
     */
    private void backoff(CallTag tag, int attempt, long delayMs) {
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellations.incrementAndGet();
            log.warn("Call {} cancelled during backoff after attempt {}", tag, attempt);
            throw new CallCancelledException(tag, attempt, e);
        }
    }

    /**
     * 이번 시도의 최대 대기 시간 계산.
     *
     * @return 밀리초, 제한이 없으면 -1
     */
    private long attemptBoundMs(RetryPolicy policy, Deadline deadline) {
        long bound = -1;
        if (policy.hasAttemptTimeout()) {
            bound = policy.attemptTimeoutMs();
        }
        if (deadline.isBounded()) {
            long remaining = deadline.remainingMs();
            bound = bound < 0 ? remaining : Math.min(bound, remaining);
        }
        return bound;
    }

    /**
     * 데드라인까지 시도 하나를 실행할 시간(1ms)도 남지 않았는지 확인.
     */
    private boolean isOutOfTime(Deadline deadline) {
        return deadline.isBounded() && deadline.remainingMs() == 0;
    }

    private long elapsedMs(long startNanos) {
        return Math.max(0L, (ticker.nanoTime() - startNanos) / 1_000_000L);
    }

    /**
     * 시도 실행용 데몬 스레드 팩토리.
     */
    private static final class AttemptThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "retry-attempt-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
