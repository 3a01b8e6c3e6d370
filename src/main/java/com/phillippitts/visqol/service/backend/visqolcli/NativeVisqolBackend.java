package com.phillippitts.visqol.service.backend.visqolcli;

import com.phillippitts.visqol.config.engine.NativeVisqolConfig;
import com.phillippitts.visqol.domain.MeasurementResult;
import com.phillippitts.visqol.domain.QualityMode;
import com.phillippitts.visqol.exception.MeasurementExceptionBuilder;
import com.phillippitts.visqol.service.align.AlignedPair;
import com.phillippitts.visqol.service.audio.WavWriter;
import com.phillippitts.visqol.service.backend.AbstractQualityBackend;
import com.phillippitts.visqol.service.backend.BackendMode;
import com.phillippitts.visqol.service.backend.BackendNames;
import com.phillippitts.visqol.service.backend.visqolcli.NativeVisqolOutputParser.NativeOutput;
import com.phillippitts.visqol.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * High-fidelity backend that delegates to the reference {@code visqol} executable.
 *
 * <p>Each comparison writes the aligned pair as 16-bit WAV files into a private temporary
 * directory, runs
 * <pre>
 *   ${binary} --reference_file R --degraded_file D --similarity_to_quality_model M
 *             [--use_speech_mode] --output_debug J
 * </pre>
 * and reads the debug JSON {@code J}. The directory is removed afterwards.
 *
 * <p>Scores outside the declared ranges are clamped so both backends honour the same result
 * contract.
 */
public final class NativeVisqolBackend extends AbstractQualityBackend {

    private static final Logger LOG = LogManager.getLogger(NativeVisqolBackend.class);

    private final NativeVisqolConfig cfg;
    private final QualityMode mode;
    private final VisqolProcessManager manager;

    public NativeVisqolBackend(NativeVisqolConfig cfg, QualityMode mode) {
        this(cfg, mode, new VisqolProcessManager());
    }

    public NativeVisqolBackend(NativeVisqolConfig cfg, QualityMode mode, VisqolProcessManager manager) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.manager = Objects.requireNonNull(manager, "manager");
    }

    @Override
    protected void doInitialize() {
        LOG.info("Native backend initialized: mode={}, bin={}, model={}, timeout={}s",
                mode, cfg.binaryPath(), cfg.modelPathFor(mode), cfg.timeoutSeconds());
    }

    @Override
    public MeasurementResult compare(AlignedPair pair) {
        Objects.requireNonNull(pair, "pair must not be null");
        ensureInitialized();
        Path workDir = null;
        long start = System.nanoTime();
        try {
            workDir = Files.createTempDirectory("visqol-");
            Path ref = workDir.resolve(NativeVisqolConstants.REFERENCE_FILE_NAME);
            Path deg = workDir.resolve(NativeVisqolConstants.DEGRADED_FILE_NAME);
            Path debug = workDir.resolve(NativeVisqolConstants.DEBUG_FILE_NAME);
            WavWriter.write(pair.reference(), ref);
            WavWriter.write(pair.degraded(), deg);
            checkInterrupted();

            String stdout = manager.run(buildCommand(ref, deg, debug), workDir, cfg);
            NativeOutput output = readOutput(debug, stdout);
            MeasurementResult result = toResult(output);
            LOG.debug("Native comparison in {} ms: moslqo={}, vnsim={}, bands={}",
                    TimeUtils.elapsedMillis(start), result.moslqo(), result.vnsim(), result.bandCount());
            return result;
        } catch (Exception e) {
            throw handleCompareError(e);
        } finally {
            deleteRecursively(workDir);
        }
    }

    // Visible for tests
    List<String> buildCommand(Path reference, Path degraded, Path debugJson) {
        List<String> cmd = new ArrayList<>();
        cmd.add(VisqolProcessManager.resolvePath(cfg.binaryPath()).toString());
        cmd.add(NativeVisqolConstants.FLAG_REFERENCE);
        cmd.add(reference.toAbsolutePath().toString());
        cmd.add(NativeVisqolConstants.FLAG_DEGRADED);
        cmd.add(degraded.toAbsolutePath().toString());
        cmd.add(NativeVisqolConstants.FLAG_MODEL);
        cmd.add(VisqolProcessManager.resolvePath(cfg.modelPathFor(mode)).toString());
        if (mode == QualityMode.SPEECH) {
            cmd.add(NativeVisqolConstants.FLAG_SPEECH_MODE);
        }
        cmd.add(NativeVisqolConstants.FLAG_OUTPUT_DEBUG);
        cmd.add(debugJson.toAbsolutePath().toString());
        return cmd;
    }

    private NativeOutput readOutput(Path debug, String stdout) throws IOException {
        String json = Files.isRegularFile(debug) ? Files.readString(debug, StandardCharsets.UTF_8) : null;
        Optional<NativeOutput> parsed = NativeVisqolOutputParser.parseDebugJson(json);
        if (parsed.isPresent()) {
            return parsed.get();
        }
        throw MeasurementExceptionBuilder.create(json == null ? "Native debug output missing" : "Native debug output malformed")
                .backend(BackendNames.NATIVE)
                .metadata("debugFile", debug)
                .metadata("consoleMos", NativeVisqolOutputParser.parseConsoleMos(stdout).orElse(null))
                .build();
    }

    private MeasurementResult toResult(NativeOutput output) {
        double[] fvnsim = output.fvnsim().clone();
        double[] bands = output.centerFreqBands();
        for (int i = 0; i < fvnsim.length; i++) {
            fvnsim[i] = clamp(finite(fvnsim[i], "fvnsim"), 0.0, 1.0);
        }
        double moslqo = finite(output.moslqo(), "moslqo");
        double vnsim = finite(output.vnsim(), "vnsim");
        if (moslqo < MeasurementResult.MIN_MOS || moslqo > MeasurementResult.MAX_MOS || vnsim < 0 || vnsim > 1) {
            LOG.warn("Native output out of range (moslqo={}, vnsim={}); clamping", moslqo, vnsim);
        }
        return MeasurementResult.of(clamp(moslqo, MeasurementResult.MIN_MOS, MeasurementResult.MAX_MOS),
                clamp(vnsim, 0.0, 1.0), fvnsim, bands, BackendNames.NATIVE);
    }

    private static double finite(double value, String field) {
        if (!Double.isFinite(value)) {
            throw MeasurementExceptionBuilder.create("Native output has non-finite " + field)
                    .backend(BackendNames.NATIVE)
                    .metadata(field, value)
                    .build();
        }
        return value;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    private static void deleteRecursively(Path dir) {
        if (dir == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            LOG.debug("Failed to remove temporary directory {}: {}", dir, e.toString());
        }
    }

    @Override
    public String getBackendName() {
        return BackendNames.NATIVE;
    }

    @Override
    public BackendMode getMode() {
        return BackendMode.HIGH_FIDELITY;
    }

    @Override
    protected void doClose() {
        manager.close();
        LOG.info("Native backend closed");
    }
}
