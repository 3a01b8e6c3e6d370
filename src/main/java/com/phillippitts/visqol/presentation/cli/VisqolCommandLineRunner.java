package com.phillippitts.visqol.presentation.cli;

import com.phillippitts.visqol.domain.BatchOutcome;
import com.phillippitts.visqol.domain.MeasurementResult;
import com.phillippitts.visqol.domain.QualityMode;
import com.phillippitts.visqol.exception.VisqolException;
import com.phillippitts.visqol.service.audio.AudioStats;
import com.phillippitts.visqol.service.audio.SignalLoader;
import com.phillippitts.visqol.service.batch.BatchMeasurementService;
import com.phillippitts.visqol.service.batch.BatchSummary;
import com.phillippitts.visqol.service.batch.ResultsJsonWriter;
import com.phillippitts.visqol.service.engine.VisqolEngine;
import com.phillippitts.visqol.service.engine.VisqolEngineFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;

/**
 * Command-line front end.
 *
 * <p>Single mode prints {@code MOS-LQO: x.xxx}; with {@code --verbose} it also prints the input
 * paths, their signal statistics, VNSIM and the backend. Batch mode prints one progress line per
 * pair and, when no {@code --results_csv} is given, the mean/min/max MOS-LQO of successful pairs.
 *
 * <p>Errors are printed to stderr with exit code 1, as is a batch in which no pair succeeded.
 * Disabled with {@code visqol.cli.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "visqol.cli.enabled", havingValue = "true", matchIfMissing = true)
public class VisqolCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger LOG = LogManager.getLogger(VisqolCommandLineRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;

    private final VisqolEngineFactory engineFactory;
    private final BatchMeasurementService batchService;
    private final PrintStream out;
    private final PrintStream err;

    private volatile int exitCode = EXIT_OK;

    @Autowired
    public VisqolCommandLineRunner(VisqolEngineFactory engineFactory, BatchMeasurementService batchService) {
        this(engineFactory, batchService, System.out, System.err);
    }

    VisqolCommandLineRunner(VisqolEngineFactory engineFactory, BatchMeasurementService batchService,
                            PrintStream out, PrintStream err) {
        this.engineFactory = engineFactory;
        this.batchService = batchService;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    // Visible for tests
    int execute(String... args) {
        return execute(new DefaultApplicationArguments(args));
    }

    private int execute(ApplicationArguments args) {
        CliOptions options;
        try {
            options = CliOptions.from(args);
        } catch (VisqolException e) {
            err.println("Error: " + e.getMessage());
            err.println(CliOptions.USAGE);
            return EXIT_ERROR;
        }
        if (options.help() || options.isEmpty()) {
            out.println(CliOptions.USAGE);
            return EXIT_OK;
        }
        try {
            return options.isBatch() ? runBatch(options) : runSingle(options);
        } catch (VisqolException e) {
            LOG.debug("Measurement failed", e);
            err.println("Error [" + e.getErrorKind() + "]: " + e.getMessage());
            return EXIT_ERROR;
        } catch (UncheckedIOException e) {
            LOG.debug("Output failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private int runSingle(CliOptions options) {
        VisqolEngine engine = engineFactory.engineFor(options.mode());
        MeasurementResult result = engine.measure(options.referenceFile(), options.degradedFile());
        if (options.verbose()) {
            printVerbose(options, engine, result);
        } else {
            out.println(String.format(Locale.ROOT, "MOS-LQO: %.6f", result.moslqo()));
        }
        if (options.outputDebug() != null) {
            ResultsJsonWriter.write(result, options.outputDebug());
        }
        return EXIT_OK;
    }

    private void printVerbose(CliOptions options, VisqolEngine engine, MeasurementResult result) {
        SignalLoader loader = new SignalLoader();
        QualityMode mode = options.mode();
        out.println("Reference: " + options.referenceFile() + " ("
                + AudioStats.of(loader.load(options.referenceFile(), mode)) + ")");
        out.println("Degraded:  " + options.degradedFile() + " ("
                + AudioStats.of(loader.load(options.degradedFile(), mode)) + ")");
        out.println("Mode:      " + mode.id());
        out.println("Backend:   " + engine.getBackendStatus().describe());
        out.println(String.format(Locale.ROOT, "MOS-LQO:   %.6f", result.moslqo()));
        out.println(String.format(Locale.ROOT, "VNSIM:     %.6f", result.vnsim()));
        double[] fvnsim = result.fvnsim();
        double[] bands = result.centerFreqBands();
        for (int i = 0; i < fvnsim.length; i++) {
            out.println(String.format(Locale.ROOT, "  %9.1f Hz  %.4f", bands[i], fvnsim[i]));
        }
    }

    private int runBatch(CliOptions options) {
        List<BatchOutcome> outcomes = batchService.measureCsv(options.batchInputCsv(), options.mode(),
                options.resultsCsv(), options.outputDebug());
        for (BatchOutcome o : outcomes) {
            String status = o.isSuccess()
                    ? String.format(Locale.ROOT, "MOS-LQO %.4f", o.result().moslqo())
                    : "FAILED [" + o.errorKind() + "] " + o.errorMessage();
            out.println(String.format(Locale.ROOT, "[%d/%d] %s vs %s: %s",
                    o.index() + 1, outcomes.size(), o.referenceId(), o.degradedId(), status));
        }
        BatchSummary summary = BatchSummary.of(outcomes);
        if (options.resultsCsv() == null) {
            if (summary.hasScores()) {
                out.println(String.format(Locale.ROOT, "Pairs: %d ok, %d failed. MOS-LQO mean=%.4f min=%.4f max=%.4f",
                        summary.succeeded(), summary.failed(), summary.meanMos(), summary.minMos(),
                        summary.maxMos()));
            } else {
                out.println("Pairs: 0 ok, " + summary.failed() + " failed.");
            }
        } else {
            out.println("Results written to " + options.resultsCsv());
        }
        return summary.hasScores() ? EXIT_OK : EXIT_ERROR;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
