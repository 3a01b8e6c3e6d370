package com.phillippitts.visqol.presentation.cli;

import com.phillippitts.visqol.config.engine.NativeVisqolConfig;
import com.phillippitts.visqol.config.engine.VisqolProperties;
import com.phillippitts.visqol.config.properties.BatchProperties;
import com.phillippitts.visqol.service.audio.WavWriter;
import com.phillippitts.visqol.service.backend.BackendProbe;
import com.phillippitts.visqol.service.batch.BatchMeasurementService;
import com.phillippitts.visqol.service.engine.VisqolEngineFactory;
import com.phillippitts.visqol.service.metrics.MeasurementMetrics;
import com.phillippitts.visqol.service.model.ModelRepository;
import com.phillippitts.visqol.testutil.SyncExecutor;
import com.phillippitts.visqol.testutil.TestSignals;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class VisqolCommandLineRunnerTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

    private VisqolEngineFactory factory;
    private VisqolCommandLineRunner runner;
    private Path ref;
    private Path deg;

    @BeforeEach
    void setUp() {
        factory = new VisqolEngineFactory(VisqolProperties.defaults(), NativeVisqolConfig.disabled(),
                new BatchProperties(), new ModelRepository(), BackendProbe.unavailable("disabled by configuration"),
                new SyncExecutor(), new MeasurementMetrics(new SimpleMeterRegistry()));
        runner = new VisqolCommandLineRunner(factory, new BatchMeasurementService(factory),
                new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8));

        double[] clean = TestSignals.harmonic(220, 1.0, 48_000);
        ref = tempDir.resolve("ref.wav");
        deg = tempDir.resolve("deg.wav");
        WavWriter.writeMono16(clean, 48_000, ref);
        WavWriter.writeMono16(TestSignals.withNoise(clean, 0.05, 3L), 48_000, deg);
    }

    @AfterEach
    void tearDown() {
        factory.closeAll();
    }

    private String out() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return stderr.toString(StandardCharsets.UTF_8);
    }

    @Test
    void noArgumentsPrintsUsage() {
        assertThat(runner.execute()).isEqualTo(VisqolCommandLineRunner.EXIT_OK);
        assertThat(out()).contains("Usage:");
    }

    @Test
    void identicalFilesPrintCeilingScore() {
        int code = runner.execute("--reference_file=" + ref, "--degraded_file=" + ref);

        assertThat(code).isEqualTo(VisqolCommandLineRunner.EXIT_OK);
        assertThat(out().trim()).isEqualTo("MOS-LQO: 4.730000");
    }

    @Test
    void verboseOutputIncludesStatisticsAndBands() {
        int code = runner.execute("--reference_file=" + ref, "--degraded_file=" + deg, "--verbose");

        assertThat(code).isEqualTo(VisqolCommandLineRunner.EXIT_OK);
        assertThat(out())
                .contains("Reference: " + ref)
                .contains("duration=1.000s")
                .contains("Mode:      audio")
                .contains("Backend:   APPROXIMATE (approximate): ")
                .contains("VNSIM:")
                .contains(" Hz  ");
    }

    @Test
    void debugJsonIsWrittenForSinglePair() throws Exception {
        Path json = tempDir.resolve("debug.json");

        runner.execute("--reference_file=" + ref, "--degraded_file=" + deg, "--output_debug=" + json);

        JSONObject debug = new JSONObject(Files.readString(json));
        assertThat(debug.getString("reference")).isEqualTo(ref.toString());
        assertThat(debug.getJSONArray("fvnsim").length()).isEqualTo(32);
    }

    @Test
    void missingFileReportsDecodeErrorAndExitCodeOne() {
        int code = runner.execute("--reference_file=" + tempDir.resolve("nope.wav"), "--degraded_file=" + deg);

        assertThat(code).isEqualTo(VisqolCommandLineRunner.EXIT_ERROR);
        assertThat(err()).startsWith("Error [DECODE]: ").contains("file not found");
    }

    @Test
    void badFlagsPrintUsageOnStderr() {
        int code = runner.execute("--reference_file=" + ref);

        assertThat(code).isEqualTo(VisqolCommandLineRunner.EXIT_ERROR);
        assertThat(err()).contains("both --reference_file and --degraded_file are required").contains("Usage:");
    }

    @Test
    void batchPrintsProgressAndSummary() throws Exception {
        Path csv = tempDir.resolve("pairs.csv");
        Files.writeString(csv, "reference,degraded\nref.wav,deg.wav\nref.wav,missing.wav\n");

        int code = runner.execute("--batch_input_csv=" + csv);

        assertThat(code).isEqualTo(VisqolCommandLineRunner.EXIT_OK);
        assertThat(out())
                .contains("[1/2] ")
                .contains("[2/2] ")
                .contains("FAILED [DECODE]")
                .contains("Pairs: 1 ok, 1 failed. MOS-LQO mean=");
    }

    @Test
    void batchWithResultsCsvWritesTable() throws Exception {
        Path csv = tempDir.resolve("pairs.csv");
        Path results = tempDir.resolve("results.csv");
        Files.writeString(csv, "reference,degraded\nref.wav,deg.wav\n");

        int code = runner.execute("--batch_input_csv=" + csv, "--results_csv=" + results);

        assertThat(code).isEqualTo(VisqolCommandLineRunner.EXIT_OK);
        assertThat(out()).contains("Results written to " + results);
        assertThat(Files.readAllLines(results)).hasSize(2);
    }

    @Test
    void batchWithoutAnySuccessExitsWithOne() throws Exception {
        Path csv = tempDir.resolve("pairs.csv");
        Files.writeString(csv, "reference,degraded\nmissing.wav,deg.wav\n");

        assertThat(runner.execute("--batch_input_csv=" + csv)).isEqualTo(VisqolCommandLineRunner.EXIT_ERROR);
        assertThat(out()).contains("Pairs: 0 ok, 1 failed.");
    }
}
