package de.anton.moessbauer.analyser.spectrum_fitter.service;

import de.anton.moessbauer.analyser.spectrum_fitter.SyntheticSpectra;
import de.anton.moessbauer.analyser.spectrum_fitter.model.AnalysisOptions;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FailureKind;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitOutcome;
import de.anton.moessbauer.analyser.spectrum_fitter.model.RawSpectrum;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnalysisExecutorTest {

    /** Blocks until interrupted and records that the interrupt arrived. */
    private static final class StuckService extends SpectrumAnalysisService {
        final CountDownLatch interrupted = new CountDownLatch(1);

        @Override
        public FitOutcome analyze(RawSpectrum samples, AnalysisOptions options) {
            try {
                Thread.sleep(10_000);
                return FitOutcome.failed(FailureKind.CANCELLED, "not interrupted");
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
                return FitOutcome.failed(FailureKind.CANCELLED, "Analysis cancelled.");
            }
        }
    }

    @Test
    void completesWithinBudget() throws Exception {
        try (AnalysisExecutor executor = new AnalysisExecutor(new SpectrumAnalysisService(), 2)) {
            FitOutcome outcome = executor.analyze(SyntheticSpectra.ferricDoublet(), AnalysisOptions.defaults(), Duration.ofSeconds(60));
            assertTrue(outcome.isSuccess());
        }
    }

    @Test
    void submitRunsOnNamedDaemonWorker() throws Exception {
        try (AnalysisExecutor executor = new AnalysisExecutor(new SpectrumAnalysisService() {
            @Override
            public FitOutcome analyze(RawSpectrum samples, AnalysisOptions options) {
                Thread t = Thread.currentThread();
                return FitOutcome.failed(FailureKind.CANCELLED, t.getName() + "/" + t.isDaemon());
            }
        }, 1)) {
            Future<FitOutcome> future = executor.submit(SyntheticSpectra.ferricDoublet(), AnalysisOptions.defaults());
            assertEquals("spectrum-fit-1/true", future.get(10, TimeUnit.SECONDS).failure().orElseThrow().message());
        }
    }

    @Test
    void timeoutCancelsWorker() throws Exception {
        StuckService stuck = new StuckService();
        try (AnalysisExecutor executor = new AnalysisExecutor(stuck, 1)) {
            FitOutcome outcome = executor.analyze(SyntheticSpectra.ferricDoublet(), AnalysisOptions.defaults(), Duration.ofMillis(200));

            assertEquals(FailureKind.FIT_TIMEOUT, outcome.failure().orElseThrow().kind());
            assertThat(outcome.failure().orElseThrow().message()).contains("200 ms");
            assertTrue(stuck.interrupted.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void rejectsEmptyPool() {
        assertThatThrownBy(() -> new AnalysisExecutor(new SpectrumAnalysisService(), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
