package com.ryuqq.lifecycle.adapter.runner;

import com.ryuqq.lifecycle.application.runtime.Runtime;
import com.ryuqq.lifecycle.application.runtime.TaskHandle;
import com.ryuqq.lifecycle.application.runtime.TaskScheduler;
import com.ryuqq.lifecycle.core.failure.ResourceFailure;
import com.ryuqq.lifecycle.core.resource.ResourceInstance;
import com.ryuqq.lifecycle.core.statemachine.ResourceState;
import com.ryuqq.lifecycle.core.task.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * 협조적 Task 스케줄러.
 *
 * <p>여러 Task를 스레드 하나로 번갈아 진행시킵니다. {@link #pump()} 한 번에
 * 대기 시간이 지난 Task들을 각각 한 단계({@link TaskRunner#step()})씩 진행하고,
 * 다음 probe 시각을 다시 계산합니다. 한 Task의 대기가 다른 Task를 막지 않습니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>submit: TaskRunner 생성 후 즉시 due 상태로 등록 (변경 호출은 다음 pump에서)</li>
 *   <li>pump: due인 Task마다 첫 진행이면 start + step, 이후는 step</li>
 *   <li>종료된 Task는 목록에서 제거하고 TaskHandle의 future를 완료</li>
 *   <li>취소 요청된 Task는 대기 시간과 무관하게 다음 pump에서 처리</li>
 * </ol>
 *
 * <p><strong>사용 방식:</strong></p>
 * <ul>
 *   <li>수동: 호출자가 {@link #pump()}를 직접 호출 (테스트, 외부 이벤트 루프)</li>
 *   <li>자동: {@link #start()}로 단일 타이머 스레드가 tickIntervalMs마다 pump</li>
 * </ul>
 *
 * <p>같은 리소스에 대해 동시에 둘 이상의 Task를 등록할 수 없습니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class CooperativeScheduler implements TaskScheduler, Runtime {

    private static final Logger log = LoggerFactory.getLogger(CooperativeScheduler.class);

    private final TaskRunnerConfig runnerConfig;
    private final SchedulerConfig config;
    private final LongSupplier nanoClock;

    private final Object lock = new Object();
    private final List<Entry> entries = new ArrayList<>();
    private final Set<ResourceInstance> activeResources = Collections.newSetFromMap(new IdentityHashMap<>());

    private ScheduledExecutorService timer;
    private boolean shutdown;

    /**
     * 생성자 (기본 설정).
     */
    public CooperativeScheduler() {
        this(new TaskRunnerConfig(), new SchedulerConfig());
    }

    /**
     * 생성자 (시스템 시계 사용).
     *
     * @param runnerConfig Task 실행 설정
     * @param config 스케줄러 설정
     */
    public CooperativeScheduler(TaskRunnerConfig runnerConfig, SchedulerConfig config) {
        this(runnerConfig, config, System::nanoTime);
    }

    /**
     * 생성자 (시계 주입).
     *
     * @param runnerConfig Task 실행 설정
     * @param config 스케줄러 설정
     * @param nanoClock 단조 시계 (나노초)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CooperativeScheduler(TaskRunnerConfig runnerConfig, SchedulerConfig config, LongSupplier nanoClock) {
        if (runnerConfig == null) {
            throw new IllegalArgumentException("runnerConfig cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (nanoClock == null) {
            throw new IllegalArgumentException("nanoClock cannot be null");
        }
        this.runnerConfig = runnerConfig;
        this.config = config;
        this.nanoClock = nanoClock;
    }

    /**
     * {@inheritDoc}
     *
     * <p>거부된 Task의 리소스는 (action, FAILED)로 종료됩니다. 종료된 스케줄러는 Cancelled,
     * 잘못된 제한 시간은 예외 문자열을 사유로 기록합니다. 단, 같은 리소스에 이미 등록된 Task가 있으면
     * 그 리소스는 기존 Task의 소유이므로 상태를 건드리지 않습니다.</p>
     */
    @Override
    public TaskHandle submit(Task task, long timeoutMs) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }

        Entry entry = new Entry(new TaskRunner(task, runnerConfig, nanoClock), timeoutMs, nanoClock.getAsLong());
        synchronized (lock) {
            if (activeResources.contains(task.resource())) {
                throw new IllegalStateException(task.resource().name() + " already has a task in flight");
            }
            if (shutdown) {
                ResourceFailure cancelled = ResourceFailure.cancelled(task.resource().name(), task.action());
                reject(task, cancelled.toString());
                throw new IllegalStateException("Scheduler is shut down, cannot accept " + task, cancelled);
            }
            if (timeoutMs <= 0) {
                IllegalArgumentException invalid =
                    new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
                reject(task, invalid.toString());
                throw invalid;
            }
            activeResources.add(task.resource());
            entries.add(entry);
        }
        log.debug("Submitted {} (timeout: {}ms)", task, timeoutMs);
        return new TaskHandle(task, entry.completion, entry.runner::cancel);
    }

    @Override
    public int inFlightCount() {
        synchronized (lock) {
            return entries.size();
        }
    }

    /**
     * due인 Task들을 한 단계씩 진행.
     *
     * <p>동시에 두 스레드가 호출해도 한 번에 하나씩만 실행됩니다.</p>
     */
    @Override
    public synchronized void pump() {
        long now = nanoClock.getAsLong();
        List<Entry> due = new ArrayList<>();
        synchronized (lock) {
            for (Entry entry : entries) {
                if (entry.runner.isCancelRequested() || now - entry.dueAtNanos >= 0) {
                    due.add(entry);
                }
            }
        }
        for (Entry entry : due) {
            advance(entry);
        }
    }

    /**
     * 백그라운드 타이머 시작 (tickIntervalMs마다 pump).
     *
     * @throws IllegalStateException 이미 시작되었거나 종료된 경우
     */
    public void start() {
        synchronized (lock) {
            if (shutdown) {
                throw new IllegalStateException("Scheduler is shut down");
            }
            if (timer != null) {
                throw new IllegalStateException("Scheduler already started");
            }
            timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "lifecycle-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            timer.scheduleWithFixedDelay(this::pumpFromTimer, 0, config.tickIntervalMs(), TimeUnit.MILLISECONDS);
        }
        log.info("Scheduler started (tick: {}ms)", config.tickIntervalMs());
    }

    /**
     * Graceful Shutdown.
     *
     * <p>타이머를 멈추고, 남은 Task를 모두 취소한 뒤 마지막 pump로 Cancelled 처리합니다.
     * 모든 리소스는 종료 상태로 남습니다.</p>
     *
     * @throws InterruptedException 타이머 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        ScheduledExecutorService stopping;
        List<Entry> remaining;
        synchronized (lock) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            stopping = timer;
            remaining = new ArrayList<>(entries);
        }

        if (stopping != null) {
            stopping.shutdown();
            if (!stopping.awaitTermination(config.awaitTerminationMs(), TimeUnit.MILLISECONDS)) {
                stopping.shutdownNow();
            }
        }

        if (!remaining.isEmpty()) {
            log.warn("Scheduler shutting down with {} task(s) in flight, cancelling", remaining.size());
            for (Entry entry : remaining) {
                entry.runner.cancel();
            }
            pump();
        }
        log.info("Scheduler shut down");
    }

    private void pumpFromTimer() {
        try {
            pump();
        } catch (RuntimeException e) {
            // 예외가 전파되면 ScheduledExecutorService가 이후 실행을 멈춤
            log.error("Scheduler pump failed", e);
        }
    }

    private void advance(Entry entry) {
        TaskRunner runner = entry.runner;
        try {
            if (!runner.isStarted()) {
                runner.start(entry.timeoutMs);
            }
            if (runner.step()) {
                finish(entry);
                entry.completion.complete(runner.task().resource().state());
            } else {
                entry.dueAtNanos = nanoClock.getAsLong() + TimeUnit.MILLISECONDS.toNanos(runner.nextDelayMs());
            }
        } catch (RuntimeException e) {
            finish(entry);
            entry.completion.completeExceptionally(e);
        }
    }

    private static void reject(Task task, String reason) {
        ResourceInstance resource = task.resource();
        if (resource.state().isInFlight()) {
            resource.markFailed(reason);
        }
        log.warn("Rejected {}: {}", task, reason);
    }

    private void finish(Entry entry) {
        synchronized (lock) {
            entries.remove(entry);
            activeResources.remove(entry.runner.task().resource());
        }
    }

    private static final class Entry {

        private final TaskRunner runner;
        private final long timeoutMs;
        private final CompletableFuture<ResourceState> completion = new CompletableFuture<>();
        private volatile long dueAtNanos;

        private Entry(TaskRunner runner, long timeoutMs, long dueAtNanos) {
            this.runner = runner;
            this.timeoutMs = timeoutMs;
            this.dueAtNanos = dueAtNanos;
        }
    }
}
