package com.phillippitts.visqol.service.backend;

import com.phillippitts.visqol.exception.MeasurementCancelledException;
import com.phillippitts.visqol.exception.MeasurementException;
import com.phillippitts.visqol.exception.VisqolException;

/**
 * Lifecycle template for {@link QualityBackend} implementations.
 *
 * <p>State transitions are synchronized on {@link #lock}. {@link #initialize()} and
 * {@link #close()} are idempotent; subclasses supply {@link #doInitialize()} and {@link #doClose()}.
 * {@link #compare} itself is not synchronized, so implementations must be safe for concurrent
 * calls.
 */
public abstract class AbstractQualityBackend implements QualityBackend {

    protected final Object lock = new Object();

    /** Guarded by {@link #lock}. */
    protected boolean initialized = false;

    /** Guarded by {@link #lock}. */
    protected boolean closed = false;

    @Override
    public final void initialize() {
        synchronized (lock) {
            if (initialized && !closed) {
                return;
            }
            doInitialize();
            closed = false;
            initialized = true;
        }
    }

    /**
     * Called under {@link #lock}.
     *
     * @throws MeasurementException if initialization fails
     */
    protected abstract void doInitialize();

    @Override
    public final boolean isHealthy() {
        synchronized (lock) {
            return initialized && !closed;
        }
    }

    @Override
    public final void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            doClose();
            closed = true;
            initialized = false;
        }
    }

    /**
     * Called under {@link #lock}. Must not throw; log instead.
     */
    protected abstract void doClose();

    /**
     * @throws MeasurementException if not initialized or already closed
     */
    protected final void ensureInitialized() {
        synchronized (lock) {
            if (!initialized || closed) {
                throw new MeasurementException(getBackendName() + " backend not initialized or closed",
                        getBackendName());
            }
        }
    }

    /**
     * @throws MeasurementCancelledException if the current thread has been interrupted
     */
    protected final void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new MeasurementCancelledException(getBackendName() + " measurement interrupted");
        }
    }

    /**
     * Rethrows measurement-domain exceptions unchanged and wraps anything else with backend context.
     *
     * <pre>{@code
     * try {
     *     return doCompare(pair);
     * } catch (Exception e) {
     *     throw handleCompareError(e);
     * }
     * }</pre>
     */
    protected final VisqolException handleCompareError(Exception exception) {
        if (exception instanceof VisqolException ve) {
            throw ve;
        }
        throw new MeasurementException(getBackendName() + " comparison failed: " + exception.getMessage(),
                getBackendName(), exception);
    }
}
