package co.fanki.flowgraph.flow.domain;

import co.fanki.flowgraph.shared.Preconditions;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop request shared by the tasks of one batch.
 *
 * <p>Raising the signal never interrupts a stage; the pipeline checks it
 * between stages and stops there.</p>
 *
 * <p>A signal may also carry a time budget, see {@link #withBudget}. The
 * budgeted signal shares the stop request of the signal it came from, and
 * additionally expires once its budget is spent.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled;

    /** The time budget, null when the signal never expires. */
    private final Duration budget;

    /** The {@link System#nanoTime()} at which the budget is spent. */
    private final long deadline;

    /** Creates a signal that is not raised and never expires. */
    public CancellationSignal() {
        this(new AtomicBoolean(false), null, 0L);
    }

    private CancellationSignal(final AtomicBoolean theCancelled,
            final Duration theBudget, final long theDeadline) {
        this.cancelled = theCancelled;
        this.budget = theBudget;
        this.deadline = theDeadline;
    }

    /**
     * Creates a signal that is never raised.
     *
     * @return a fresh signal
     */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    /**
     * Creates a view of this signal whose budget starts now.
     *
     * <p>Raising either signal raises both.</p>
     *
     * @param theBudget the time the caller may spend, positive
     * @return the budgeted signal
     */
    public CancellationSignal withBudget(final Duration theBudget) {
        Preconditions.requireNonNull(theBudget, "Budget is required");
        Preconditions.require(!theBudget.isNegative() && !theBudget.isZero(),
                "Budget must be positive");
        return new CancellationSignal(cancelled, theBudget,
                System.nanoTime() + theBudget.toNanos());
    }

    /** Raises the signal. Raising it twice has no further effect. */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Checks if the time budget of this signal is spent.
     *
     * @return true once the budget elapsed, always false without a budget
     */
    public boolean isExpired() {
        return budget != null && System.nanoTime() - deadline >= 0;
    }

    /**
     * Stops the current conversion if the signal was raised, its budget is
     * spent or the running thread was interrupted.
     *
     * @param member the member being converted, for the error message
     * @throws FlowGraphException with {@link FlowGraphException#CANCELLED}
     *         or {@link FlowGraphException#TIMED_OUT}
     */
    public void throwIfCancelled(final String member) {
        if (cancelled.get()) {
            throw FlowGraphException.cancelled(member);
        }
        if (isExpired()) {
            throw FlowGraphException.timedOut(member, budget);
        }
        if (Thread.currentThread().isInterrupted()) {
            throw FlowGraphException.cancelled(member);
        }
    }

}
