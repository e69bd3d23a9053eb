package co.fanki.flowgraph.flow.application;

import co.fanki.flowgraph.config.FlowGraphProperties;
import co.fanki.flowgraph.flow.domain.CancellationSignal;
import co.fanki.flowgraph.flow.domain.FlowGraphException;
import co.fanki.flowgraph.flow.domain.RawCompilationUnit;
import co.fanki.flowgraph.flow.domain.RawFlowGraph;
import co.fanki.flowgraph.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Application service that analyzes every member of a compilation unit.
 *
 * <p>Members run concurrently on the shared worker pool. Each member owns
 * its graph, so members never share state. A failing member is reported
 * with its reason and never stops the others.</p>
 *
 * <p>Cancellation is cooperative. Once the signal is raised, the member
 * being converted stops at its next stage boundary, members that did not
 * start are reported cancelled, and members that completed are kept.</p>
 *
 * <p>Each member has its own time budget, counted from the moment a worker
 * picks it up. Time spent queued behind other members is not charged to
 * it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class BatchFlowAnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(
            BatchFlowAnalysisService.class);

    private final MethodFlowAnalyzer analyzer;
    private final ExecutorService workerPool;
    private final Duration methodTimeout;

    /**
     * Creates a new batch service.
     *
     * @param theAnalyzer the per-member analyzer
     * @param theWorkerPool the pool members run on
     * @param theProperties the application settings
     */
    public BatchFlowAnalysisService(
            final MethodFlowAnalyzer theAnalyzer,
            final ExecutorService theWorkerPool,
            final FlowGraphProperties theProperties) {
        this.analyzer = Preconditions.requireNonNull(theAnalyzer,
                "Analyzer is required");
        this.workerPool = Preconditions.requireNonNull(theWorkerPool,
                "Worker pool is required");
        Preconditions.requireNonNull(theProperties, "Properties are required");
        this.methodTimeout = theProperties.batch().methodTimeout();
    }

    /**
     * Analyzes every member of a compilation unit.
     *
     * @param unit the compilation unit
     * @return the batch result
     */
    public BatchResult analyze(final RawCompilationUnit unit) {
        return analyze(unit, CancellationSignal.none());
    }

    /**
     * Analyzes every member of a compilation unit.
     *
     * @param unit the compilation unit
     * @param signal raised by the caller to stop the batch
     * @return the succeeded members and the failed ones with their reasons,
     *         both in declaration order
     */
    public BatchResult analyze(final RawCompilationUnit unit,
            final CancellationSignal signal) {
        Preconditions.requireNonNull(unit, "Compilation unit is required");
        Preconditions.requireNonNull(signal, "Cancellation signal is required");

        LOG.info("Analyzing {} members of {}", unit.memberCount(), unit.name());

        final List<MemberTask> tasks = new ArrayList<>(unit.memberCount());
        final List<Future<MethodFlowResult>> futures = new ArrayList<>(
                unit.memberCount());

        for (int i = 0; i < unit.memberCount(); i++) {
            final RawFlowGraph member = unit.members().get(i);
            final MemberTask task = new MemberTask(member == null
                    ? "<member " + i + " of " + unit.name() + ">"
                    : MethodFlowAnalyzer.identify(member), member, signal);
            tasks.add(task);
            futures.add(workerPool.submit(task));
        }

        final List<MethodFlowResult> succeeded = new ArrayList<>();
        final List<MethodFailure> failures = new ArrayList<>();

        for (int i = 0; i < futures.size(); i++) {
            final MemberTask task = tasks.get(i);
            final String identifier = task.identifier;
            final Future<MethodFlowResult> future = futures.get(i);
            try {
                succeeded.add(await(task, future));

            } catch (final TimeoutException e) {
                future.cancel(true);
                LOG.warn("Analysis of {} exceeded {} ms", identifier,
                        methodTimeout.toMillis());
                failures.add(new MethodFailure(identifier,
                        FailureReason.TIMED_OUT, "Exceeded "
                                + methodTimeout.toMillis() + " ms"));

            } catch (final ExecutionException e) {
                failures.add(failure(identifier, e.getCause()));

            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                signal.cancel();
                future.cancel(true);
                LOG.warn("Interrupted while waiting for {}", identifier);
                failures.add(new MethodFailure(identifier,
                        FailureReason.CANCELLED, "Interrupted"));
            }
        }

        LOG.info("Analysis of {} complete. Success: {}, Failed: {}",
                unit.name(), succeeded.size(), failures.size());

        return new BatchResult(unit.name(), succeeded, failures);
    }

    /**
     * Waits for a member until its budget, counted from its start, is spent.
     *
     * <p>While the member is queued the caller waits in slices of one full
     * budget and checks again.</p>
     */
    private MethodFlowResult await(final MemberTask task,
            final Future<MethodFlowResult> future)
            throws InterruptedException, ExecutionException, TimeoutException {
        while (true) {
            try {
                return future.get(Math.max(0L, task.remainingNanos()),
                        TimeUnit.NANOSECONDS);
            } catch (final TimeoutException e) {
                if (task.hasStarted() && task.remainingNanos() <= 0) {
                    throw e;
                }
            }
        }
    }

    private MethodFailure failure(final String identifier,
            final Throwable cause) {
        if (cause instanceof FlowGraphException flowError) {
            return new MethodFailure(identifier,
                    FailureReason.fromErrorCode(flowError.getErrorCode()),
                    flowError.getMessage());
        }
        LOG.error("Unexpected error analyzing {}: {}", identifier,
                cause.getMessage(), cause);
        return new MethodFailure(identifier, FailureReason.CONVERSION_FAILURE,
                cause.getMessage());
    }

    /** Analysis of one member, remembering when a worker picked it up. */
    private final class MemberTask implements Callable<MethodFlowResult> {

        private final String identifier;
        private final RawFlowGraph member;
        private final CancellationSignal signal;

        private volatile boolean started;
        private volatile long startedAt;

        private MemberTask(final String theIdentifier,
                final RawFlowGraph theMember,
                final CancellationSignal theSignal) {
            this.identifier = theIdentifier;
            this.member = theMember;
            this.signal = theSignal;
        }

        @Override
        public MethodFlowResult call() {
            startedAt = System.nanoTime();
            started = true;

            final CancellationSignal budgeted = signal.withBudget(
                    methodTimeout);
            final MethodFlowResult result = analyzer.analyze(member,
                    budgeted);
            if (budgeted.isExpired()) {
                throw FlowGraphException.timedOut(identifier, methodTimeout);
            }
            return result;
        }

        private boolean hasStarted() {
            return started;
        }

        /** A full budget while queued, what is left once running. */
        private long remainingNanos() {
            if (!started) {
                return methodTimeout.toNanos();
            }
            return startedAt + methodTimeout.toNanos() - System.nanoTime();
        }
    }

    /**
     * Outcome of analyzing a compilation unit.
     *
     * @param unitName the compilation unit name
     * @param succeeded the members that produced a graph
     * @param failures the members that did not, with their reasons
     */
    public record BatchResult(
            String unitName,
            List<MethodFlowResult> succeeded,
            List<MethodFailure> failures
    ) {

        /** Copies the lists. */
        public BatchResult {
            succeeded = List.copyOf(succeeded);
            failures = List.copyOf(failures);
        }

        /**
         * Checks if every member produced a graph.
         *
         * @return true when there are no failures
         */
        public boolean isComplete() {
            return failures.isEmpty();
        }

        public int successCount() {
            return succeeded.size();
        }

        public int failureCount() {
            return failures.size();
        }
    }

}
