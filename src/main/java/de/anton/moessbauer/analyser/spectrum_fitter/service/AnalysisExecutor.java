package de.anton.moessbauer.analyser.spectrum_fitter.service;

import de.anton.moessbauer.analyser.spectrum_fitter.model.AnalysisOptions;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FailureKind;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitOutcome;
import de.anton.moessbauer.analyser.spectrum_fitter.model.RawSpectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs analyses on a fixed pool of daemon worker threads and enforces a wall-clock budget per
 * analysis. On expiry the worker is interrupted and the outcome is FAILED with FIT_TIMEOUT.
 */
public class AnalysisExecutor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisExecutor.class);
    private static final long SHUTDOWN_WAIT_SECONDS = 5;

    private final SpectrumAnalysisService service;
    private final ExecutorService executor;

    public AnalysisExecutor(SpectrumAnalysisService service) {
        this(service, Runtime.getRuntime().availableProcessors());
    }

    public AnalysisExecutor(SpectrumAnalysisService service, int threads) {
        this.service = Objects.requireNonNull(service, "service");
        if (threads < 1) throw new IllegalArgumentException("threads must be positive.");
        this.executor = Executors.newFixedThreadPool(threads, new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "spectrum-fit-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
    }

    public Future<FitOutcome> submit(RawSpectrum samples, AnalysisOptions options) {
        Objects.requireNonNull(samples, "samples");
        Objects.requireNonNull(options, "options");
        return executor.submit(() -> service.analyze(samples, options));
    }

    /**
     * Analyzes on a worker thread and waits at most {@code timeout}.
     *
     * @throws InterruptedException If the calling thread is interrupted while waiting; the worker is cancelled.
     */
    public FitOutcome analyze(RawSpectrum samples, AnalysisOptions options, Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        Future<FitOutcome> future = submit(samples, options);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.info("Analysis exceeded its budget of {} ms and was cancelled", timeout.toMillis());
            return FitOutcome.failed(FailureKind.FIT_TIMEOUT, "Fit exceeded the time budget of " + timeout.toMillis() + " ms.");
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("Unexpected failure in analysis worker", cause);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Analysis workers did not stop within {} s", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
