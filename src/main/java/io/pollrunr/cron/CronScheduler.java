package io.pollrunr.cron;

import io.pollrunr.support.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory cron scheduler. Each registered task gets its own {@link TaskWorker} loop;
 * due fires are dispatched to a separate job pool without waiting for them to finish,
 * so executions of a slow job may overlap unless the task opts into
 * {@link OverlapPolicy#SKIP_IF_RUNNING}.
 *
 * <p>Nothing is persisted: schedules live for the lifetime of this instance.</p>
 */
public class CronScheduler {

    private static final Logger log = LoggerFactory.getLogger(CronScheduler.class);
    static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

    private final Clock clock;
    private final Sleeper sleeper;
    private final ZoneId zone;
    private final ExecutorService workerExecutor;
    private final ExecutorService jobExecutor;

    private final Map<String, Registration> registrations = new LinkedHashMap<>();
    private boolean stopped;

    public CronScheduler(Clock clock, Sleeper sleeper, ZoneId zone) {
        this(clock, sleeper, zone,
                Executors.newCachedThreadPool(daemonThreads("pollrunr-worker-")),
                Executors.newCachedThreadPool(daemonThreads("pollrunr-job-")));
    }

    CronScheduler(Clock clock, Sleeper sleeper, ZoneId zone,
                  ExecutorService workerExecutor, ExecutorService jobExecutor) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.workerExecutor = workerExecutor;
        this.jobExecutor = jobExecutor;
    }

    /**
     * Registers a task and starts its worker immediately. Overlapping executions are allowed.
     *
     * @param name           unique task name
     * @param job            the work to run on every fire
     * @param cronExpression 5-field cron expression
     * @param args           arguments bound to every invocation
     * @throws InvalidCronExpressionException if the expression does not parse; the task is not registered
     */
    public TaskView addTask(String name, TaskJob job, String cronExpression, Object... args) {
        return addTask(name, OverlapPolicy.ALLOW, job, cronExpression, args);
    }

    /**
     * Registers a task with an explicit overlap policy and starts its worker immediately.
     */
    public synchronized TaskView addTask(String name, OverlapPolicy overlapPolicy, TaskJob job,
                                         String cronExpression, Object... args) {
        Objects.requireNonNull(name, "name");
        if (stopped) {
            throw new IllegalStateException("Scheduler is stopped; cannot add task '" + name + "'");
        }
        if (registrations.containsKey(name)) {
            throw new IllegalArgumentException("Task already registered: " + name);
        }

        CronSchedule schedule = CronSchedule.parse(cronExpression, zone);
        ScheduledTask task = ScheduledTask.of(name, job, schedule, overlapPolicy, args);
        Registration registration = new Registration(task);
        registrations.put(name, registration);
        registration.worker.start(workerExecutor);

        log.info("Added task '{}' ({}, {})", name, schedule.expression(), task.overlapPolicy());
        return registration.view();
    }

    /**
     * Runs a task's job once, now, in addition to its schedule.
     *
     * @throws IllegalArgumentException if no task has that name
     */
    public JobExecution triggerNow(String name) {
        Registration registration;
        synchronized (this) {
            if (stopped) {
                throw new IllegalStateException("Scheduler is stopped; cannot trigger task '" + name + "'");
            }
            registration = registrations.get(name);
        }
        if (registration == null) {
            throw new IllegalArgumentException("Task not found: " + name);
        }
        log.info("Triggering task '{}' immediately", name);
        return dispatch(registration, clock.instant(), true);
    }

    /**
     * Returns a snapshot of every registered task, in registration order.
     */
    public synchronized List<TaskView> listTasks() {
        return registrations.values().stream().map(Registration::view).toList();
    }

    /**
     * Returns a task snapshot by name, or null if not found.
     */
    public synchronized TaskView getTask(String name) {
        Registration registration = registrations.get(name);
        return registration != null ? registration.view() : null;
    }

    /**
     * Cancels every worker and waits for each to terminate, then shuts down the job pool.
     * Executions already dispatched are left to finish on their own. Calling this again
     * waits on the same workers.
     */
    public void stop() {
        List<TaskWorker> workers;
        synchronized (this) {
            stopped = true;
            workers = registrations.values().stream().map(r -> r.worker).toList();
        }

        workers.forEach(TaskWorker::cancel);
        int terminated = 0;
        for (TaskWorker worker : workers) {
            try {
                if (worker.awaitTermination(STOP_TIMEOUT)) {
                    terminated++;
                } else {
                    log.warn("Worker for task '{}' did not terminate within {}", worker.task().name(), STOP_TIMEOUT);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for task workers to stop");
                break;
            }
        }
        workerExecutor.shutdown();
        // running jobs may still finish; no new ones are accepted
        jobExecutor.shutdown();
        log.info("Scheduler stopped: {}/{} worker(s) terminated", terminated, workers.size());
    }

    public synchronized boolean isStopped() {
        return stopped;
    }

    /**
     * Waits for all currently running executions to finish.
     *
     * @return true if they all finished within the timeout
     */
    public boolean awaitDispatched(Duration timeout) throws InterruptedException {
        List<CompletableFuture<Void>> pending = new ArrayList<>();
        synchronized (this) {
            for (Registration registration : registrations.values()) {
                registration.running.forEach(execution -> pending.add(execution.future()));
            }
        }
        if (pending.isEmpty()) {
            return true;
        }
        try {
            CompletableFuture.allOf(pending.toArray(CompletableFuture[]::new))
                    .get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            // executions complete normally even when the job fails
            throw new IllegalStateException("Unexpected execution failure", e.getCause());
        }
    }

    private JobExecution dispatch(Registration registration, Instant fireTime, boolean manual) {
        ScheduledTask task = registration.task;
        if (!manual && task.overlapPolicy() == OverlapPolicy.SKIP_IF_RUNNING && !registration.running.isEmpty()) {
            registration.skipped.incrementAndGet();
            log.info("Skipping fire of task '{}' at {}: previous execution still running", task.name(), fireTime);
            return null;
        }

        CompletableFuture<Void> future = new CompletableFuture<>();
        JobExecution execution = new JobExecution(task.name(), fireTime, manual, future);
        registration.running.add(execution);
        if (!manual) {
            registration.fires.incrementAndGet();
        }
        log.debug("Dispatching task '{}' for {}", task.name(), fireTime);

        try {
            jobExecutor.execute(() -> runJob(registration, execution));
        } catch (RejectedExecutionException e) {
            registration.running.remove(execution);
            future.complete(null);
            throw e;
        }
        return execution;
    }

    private void runJob(Registration registration, JobExecution execution) {
        String name = registration.task.name();
        try {
            registration.task.invoke();
            log.debug("Task '{}' completed", name);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Task '{}' was interrupted", name);
        } catch (Exception e) {
            log.error("Task '{}' failed", name, e);
        } finally {
            registration.running.remove(execution);
            execution.future().complete(null);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private final class Registration {
        private final ScheduledTask task;
        private final TaskWorker worker;
        private final Set<JobExecution> running = ConcurrentHashMap.newKeySet();
        private final AtomicLong fires = new AtomicLong();
        private final AtomicLong skipped = new AtomicLong();

        Registration(ScheduledTask task) {
            this.task = task;
            this.worker = new TaskWorker(task, clock, sleeper, (t, fireTime) -> dispatch(this, fireTime, false));
        }

        TaskView view() {
            return TaskView.of(task, worker, fires.get(), skipped.get(), List.copyOf(running));
        }
    }
}
