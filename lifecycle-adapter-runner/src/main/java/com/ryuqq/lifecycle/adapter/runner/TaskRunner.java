package com.ryuqq.lifecycle.adapter.runner;

import com.ryuqq.lifecycle.core.failure.ResourceFailure;
import com.ryuqq.lifecycle.core.poll.PollPhase;
import com.ryuqq.lifecycle.core.poll.PollResult;
import com.ryuqq.lifecycle.core.resource.ResourceInstance;
import com.ryuqq.lifecycle.core.spi.RemoteNotFoundException;
import com.ryuqq.lifecycle.core.spi.TransportException;
import com.ryuqq.lifecycle.core.statemachine.ResourceAction;
import com.ryuqq.lifecycle.core.task.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Task 실행기 (Task 1개당 1개).
 *
 * <p>Task를 "변경 호출 1회 → probe 반복 → 종료 상태 확정" 순서로 진행시킵니다.
 * 블로킹 방식({@link #run(long)})과 단계 방식({@link #start(long)} + {@link #step()}) 둘 다 지원하며,
 * 단계 방식은 {@link CooperativeScheduler}가 여러 Task를 번갈아 진행할 때 사용합니다.</p>
 *
 * <p><strong>step 한 번의 처리 순서:</strong></p>
 * <ol>
 *   <li>이미 종료됨 → true</li>
 *   <li>취소 요청됨 → 마지막 probe 1회(로그용) 후 Cancelled 실패</li>
 *   <li>제한 시간 초과 → Timeout 실패</li>
 *   <li>probe 후 분류: IN_PROGRESS → false, COMPLETE → 완료, FAILED → ResourceInError,
 *       그 외 → ResourceUnknownStatus</li>
 * </ol>
 *
 * <p><strong>원격 미존재 처리:</strong></p>
 * <ul>
 *   <li>DELETE 중: 이미 삭제된 것으로 보고 (DELETE, COMPLETE)</li>
 *   <li>그 외 액션: NotFound 실패</li>
 * </ul>
 *
 * <p><strong>스레드 모델:</strong> {@link #cancel()}만 다른 스레드에서 호출할 수 있습니다.
 * start/step/run은 한 번에 한 스레드에서만 호출해야 합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    private final Task task;
    private final TaskRunnerConfig config;
    private final BackoffCalculator backoffCalculator;
    private final LongSupplier nanoClock;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    private volatile boolean started;
    private volatile boolean done;
    private long startedAtNanos;
    private long timeoutMs;
    private int consecutiveProbeFailures;

    /**
     * 생성자 (시스템 시계 사용).
     *
     * @param task 실행할 Task
     * @param config 실행 설정
     */
    public TaskRunner(Task task, TaskRunnerConfig config) {
        this(task, config, System::nanoTime);
    }

    /**
     * 생성자 (시계 주입).
     *
     * @param task 실행할 Task
     * @param config 실행 설정
     * @param nanoClock 경과 시간 측정용 단조 시계 (나노초)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public TaskRunner(Task task, TaskRunnerConfig config, LongSupplier nanoClock) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (nanoClock == null) {
            throw new IllegalArgumentException("nanoClock cannot be null");
        }
        this.task = task;
        this.config = config;
        this.backoffCalculator = new BackoffCalculator(config);
        this.nanoClock = nanoClock;
    }

    /**
     * 종료 상태까지 블로킹 실행.
     *
     * <p>대기 중 인터럽트되면 취소로 처리합니다 (인터럽트 플래그는 복원).</p>
     *
     * @param timeoutMs 전체 제한 시간 (밀리초)
     * @throws ResourceFailure 실패 시 (리소스는 (action, FAILED))
     */
    public void run(long timeoutMs) {
        start(timeoutMs);
        while (!step()) {
            sleep(nextDelayMs());
        }
    }

    /**
     * 변경 호출 실행 (Task당 1회).
     *
     * <p>시작 전에 취소가 요청된 경우 변경 호출 없이 Cancelled로 종료합니다.</p>
     *
     * @param timeoutMs 전체 제한 시간 (밀리초, 양수)
     * @throws IllegalArgumentException timeoutMs가 양수가 아닌 경우 (리소스는 (action, FAILED))
     * @throws IllegalStateException 이미 시작된 경우
     * @throws ResourceFailure 변경 호출 실패 시
     */
    public void start(long timeoutMs) {
        if (started) {
            throw new IllegalStateException(task + " was already started");
        }
        started = true;
        if (timeoutMs <= 0) {
            IllegalArgumentException rejected =
                new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
            abort(rejected);
            throw rejected;
        }
        this.timeoutMs = timeoutMs;
        this.startedAtNanos = nanoClock.getAsLong();

        ResourceInstance resource = task.resource();
        if (cancelRequested.get()) {
            throw fail(ResourceFailure.cancelled(resource.name(), task.action()));
        }

        log.info("{} {} started (timeout: {}ms)", task.action(), resource.name(), timeoutMs);
        try {
            task.invoke();
        } catch (RemoteNotFoundException e) {
            onRemoteNotFound();
        } catch (TransportException e) {
            throw fail(ResourceFailure.transport(resource.name(), task.action(), e));
        } catch (ResourceFailure e) {
            throw fail(e);
        } catch (RuntimeException e) {
            abort(e);
            throw e;
        }
    }

    /**
     * 한 단계 진행.
     *
     * @return 종료되었으면 true, 아직 진행 중이면 false
     * @throws IllegalStateException 시작 전 호출 시
     * @throws ResourceFailure 이번 단계에서 실패가 확정된 경우
     */
    public boolean step() {
        if (!started) {
            throw new IllegalStateException(task + " was not started");
        }
        if (done) {
            return true;
        }

        ResourceInstance resource = task.resource();
        ResourceAction action = task.action();

        if (cancelRequested.get()) {
            probeBeforeAbandon();
            throw fail(ResourceFailure.cancelled(resource.name(), action));
        }
        if (elapsedMs() > timeoutMs) {
            throw fail(ResourceFailure.timeout(resource.name(), action, timeoutMs));
        }

        PollResult result;
        try {
            result = task.probe();
            consecutiveProbeFailures = 0;
        } catch (RemoteNotFoundException e) {
            return onRemoteNotFound();
        } catch (TransportException e) {
            consecutiveProbeFailures++;
            if (consecutiveProbeFailures <= config.probeRetryLimit()) {
                log.warn("{} {} probe failed ({}/{}), retrying: {}",
                    action, resource.name(), consecutiveProbeFailures, config.probeRetryLimit(), e.getMessage());
                return false;
            }
            throw fail(ResourceFailure.transport(resource.name(), action, e));
        } catch (RuntimeException e) {
            abort(e);
            throw e;
        }

        PollPhase phase = result.classify(action);
        log.debug("{} {} probe #{}: {} ({})", action, resource.name(), task.probeCount(), result.status(), phase);

        switch (phase) {
            case IN_PROGRESS -> {
                return false;
            }
            case COMPLETE -> {
                completeTask();
                return true;
            }
            case FAILED -> throw fail(ResourceFailure.inError(resource.name(), action, result.status(), result.reason()));
            default -> throw fail(ResourceFailure.unknownStatus(resource.name(), action, result.status()));
        }
    }

    /**
     * 취소 요청 (멱등, 스레드 안전).
     *
     * <p>다음 step에서 반영됩니다. 이미 종료된 Task에는 영향이 없습니다.</p>
     */
    public void cancel() {
        if (cancelRequested.compareAndSet(false, true) && !done) {
            log.info("{} {} cancellation requested", task.action(), task.resource().name());
        }
    }

    /**
     * 다음 step까지 대기할 시간.
     *
     * <p>직전 probe가 전송 오류였으면 backoff, 아니면 pollIntervalMs.
     * 시작된 Task는 제한 시간 직후까지만 기다리므로 Timeout이 poll 간격만큼 늦게 확정되지 않습니다.</p>
     *
     * @return 대기 시간 (밀리초, 1 이상)
     */
    public long nextDelayMs() {
        long delay = consecutiveProbeFailures > 0
            ? backoffCalculator.calculate(consecutiveProbeFailures)
            : config.pollIntervalMs();
        if (!started) {
            return delay;
        }
        long untilDeadline = timeoutMs - elapsedMs() + 1;
        return Math.max(1, Math.min(delay, untilDeadline));
    }

    public Task task() {
        return task;
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public boolean done() {
        return done;
    }

    private boolean onRemoteNotFound() {
        ResourceInstance resource = task.resource();
        if (task.action() == ResourceAction.DELETE) {
            log.info("{} {} already gone on backend, treating delete as complete",
                task.action(), resource.name());
            completeTask();
            return true;
        }
        throw fail(ResourceFailure.notFound(resource.name(), task.action()));
    }

    private void completeTask() {
        task.complete();
        task.resource().markComplete();
        done = true;
        log.info("{} {} complete after {} probe(s)", task.action(), task.resource().name(), task.probeCount());
    }

    private ResourceFailure fail(ResourceFailure failure) {
        done = true;
        task.resource().markFailed(failure.toString());
        log.error("{} {} failed: {}", task.action(), task.resource().name(), failure.toString());
        return failure;
    }

    private void abort(RuntimeException e) {
        done = true;
        task.resource().markFailed(e.toString());
        log.error("{} {} aborted by unexpected error", task.action(), task.resource().name(), e);
    }

    private void probeBeforeAbandon() {
        try {
            PollResult last = task.probe();
            log.warn("{} {} cancelled while remote status was {}",
                task.action(), task.resource().name(), last.status());
        } catch (RuntimeException e) {
            log.warn("{} {} cancelled, final probe failed: {}",
                task.action(), task.resource().name(), e.toString());
        }
    }

    private long elapsedMs() {
        return (nanoClock.getAsLong() - startedAtNanos) / 1_000_000L;
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
        }
    }

    @Override
    public String toString() {
        return "TaskRunner{" + task + ", done=" + done + '}';
    }
}
