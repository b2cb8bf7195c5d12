package com.phillippitts.parlcorpus.service.orchestration;

import com.phillippitts.parlcorpus.domain.SessionId;
import com.phillippitts.parlcorpus.exception.ParlCorpusException;
import com.phillippitts.parlcorpus.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default implementation of the parallel session service.
 *
 * <p>Every session of a run becomes one task on the {@code sessionExecutor}. Sessions share no
 * state, so they are processed in any order and on any worker. Key features:
 * <ul>
 *   <li><b>Isolation:</b> a failing session is caught inside its own task and turned into a
 *       FAILED report; the other sessions carry on</li>
 *   <li><b>Single Barrier:</b> the call returns only after every task has reached a terminal
 *       state or the overall timeout has expired</li>
 *   <li><b>Interrupting Cancellation:</b> unfinished tasks are cancelled with
 *       {@code Future.cancel(true)}, which interrupts their workers; the session pipeline checks
 *       for the interrupt before it writes anything</li>
 *   <li><b>Quiescence:</b> after cancelling, the call waits up to {@link #CANCEL_GRACE_MS} for
 *       interrupted tasks to unwind, so the assembler does not run next to a live session</li>
 * </ul>
 *
 * <p><b>Thread Model:</b> tasks are submitted through {@link AsyncTaskExecutor#submit(Callable)}
 * when the executor is a Spring task executor (the {@code sessionExecutor} pool is); any other
 * {@link Executor} receives a {@link FutureTask}, which cancels the same way. A
 * caller-runs rejection policy on the pool runs overflow sessions on the calling thread.
 *
 * <p><b>Error Handling:</b> a {@link ParlCorpusException} is an expected session failure and
 * logged at WARN; any other runtime exception is logged at ERROR with its stack trace. Both end
 * as FAILED reports. Sessions cut off by the timeout are reported as TIMED_OUT.
 *
 * @see ParallelSessionService
 * @see SessionPipeline
 * @see com.phillippitts.parlcorpus.config.ThreadPoolConfig
 * @since 0.1
 */
@Service
public class DefaultParallelSessionService implements ParallelSessionService {

    private static final Logger LOG = LogManager.getLogger(DefaultParallelSessionService.class);

    /** Longest wait for cancelled session tasks to finish unwinding. */
    static final long CANCEL_GRACE_MS = 5_000;

    private final SessionPipeline pipeline;
    private final Executor executor;
    private final long defaultTimeoutMs;

    /**
     * Constructs the service with dependency injection.
     *
     * @param pipeline  per-session processing
     * @param executor  bounded pool for session tasks (qualified as "sessionExecutor")
     * @param timeoutMs default timeout from {@code pipeline.session-timeout-ms}
     *                  (600000 ms when not positive)
     * @throws NullPointerException if pipeline or executor is null
     */
    public DefaultParallelSessionService(SessionPipeline pipeline,
                                         @Qualifier("sessionExecutor") Executor executor,
                                         @Value("${pipeline.session-timeout-ms:600000}") long timeoutMs) {
        this.pipeline = Objects.requireNonNull(pipeline);
        this.executor = Objects.requireNonNull(executor);
        this.defaultTimeoutMs = timeoutMs <= 0 ? 600_000 : timeoutMs;
    }

    @Override
    public List<SessionReport> processAll(List<SessionId> sessions, long timeoutMs) {
        Objects.requireNonNull(sessions, "sessions");
        final long toMs = timeoutMs > 0 ? timeoutMs : defaultTimeoutMs;

        List<SessionTask> tasks = new ArrayList<>(sessions.size());
        for (SessionId session : sessions) {
            SessionTask task = new SessionTask(session);
            task.future = submit(task);
            tasks.add(task);
        }

        if (!awaitAll(tasks, toMs)) {
            LOG.warn("Session processing timed out after {} ms", toMs);
            cancelAndAwait(tasks);
        }

        List<SessionReport> reports = new ArrayList<>(tasks.size());
        for (SessionTask task : tasks) {
            reports.add(reportOf(task, toMs));
        }
        return reports;
    }

    private Future<SessionReport> submit(SessionTask task) {
        if (executor instanceof AsyncTaskExecutor) {
            return ((AsyncTaskExecutor) executor).submit(task);
        }
        FutureTask<SessionReport> future = new FutureTask<>(task);
        executor.execute(future);
        return future;
    }

    /**
     * Waits for every task against one shared deadline.
     *
     * @return false if the deadline passed or the caller was interrupted
     */
    private static boolean awaitAll(List<SessionTask> tasks, long timeoutMs) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        for (SessionTask task : tasks) {
            try {
                task.future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException te) {
                return false;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return false;
            } catch (ExecutionException | CancellationException e) {
                // runSession reports failures itself; collected in reportOf
            }
        }
        return true;
    }

    private static void cancelAndAwait(List<SessionTask> tasks) {
        for (SessionTask task : tasks) {
            if (!task.future.isDone()) {
                task.future.cancel(true);
            }
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(CANCEL_GRACE_MS);
        for (SessionTask task : tasks) {
            if (!task.started) {
                continue;
            }
            try {
                if (!task.finished.await(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                    LOG.error("Session {} still running {} ms after cancellation", task.session, CANCEL_GRACE_MS);
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private static SessionReport reportOf(SessionTask task, long timeoutMs) {
        Future<SessionReport> f = task.future;
        if (!f.isDone() || f.isCancelled()) {
            return SessionReport.timedOut(task.session, timeoutMs);
        }
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SessionReport.failed(task.session, "interrupted", 0);
        } catch (ExecutionException e) {
            return SessionReport.failed(task.session, String.valueOf(e.getCause()), 0);
        }
    }

    private SessionReport runSession(SessionId session) {
        long t0 = System.nanoTime();
        try {
            return pipeline.process(session);
        } catch (ParlCorpusException e) {
            LOG.warn("Session {} failed: {}", session, e.getMessage());
            return SessionReport.failed(session, e.getMessage(), TimeUtils.elapsedMillis(t0));
        } catch (RuntimeException e) {
            LOG.error("Session {} unexpected error", session, e);
            return SessionReport.failed(session, e.getClass().getSimpleName() + ": " + e.getMessage(),
                    TimeUtils.elapsedMillis(t0));
        }
    }

    /**
     * One session's task; records whether its body started and when it left.
     */
    private final class SessionTask implements Callable<SessionReport> {

        private final SessionId session;
        private final CountDownLatch finished = new CountDownLatch(1);
        private volatile boolean started;
        private Future<SessionReport> future;

        SessionTask(SessionId session) {
            this.session = session;
        }

        @Override
        public SessionReport call() {
            started = true;
            try {
                return runSession(session);
            } finally {
                finished.countDown();
            }
        }
    }
}
