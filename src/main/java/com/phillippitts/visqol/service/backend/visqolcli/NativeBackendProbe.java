package com.phillippitts.visqol.service.backend.visqolcli;

import com.phillippitts.visqol.config.engine.NativeVisqolConfig;
import com.phillippitts.visqol.domain.QualityMode;
import com.phillippitts.visqol.exception.BackendUnavailableException;
import com.phillippitts.visqol.service.backend.BackendNames;
import com.phillippitts.visqol.service.backend.BackendProbe;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks whether the native binary and the mode's model file are present and usable.
 *
 * <p>The native backend is available when it is enabled in configuration, the binary is an
 * executable regular file, and the model configured for the mode is a regular file.
 */
public final class NativeBackendProbe implements BackendProbe {

    private static final Logger LOG = LogManager.getLogger(NativeBackendProbe.class);

    private final NativeVisqolConfig cfg;

    public NativeBackendProbe(NativeVisqolConfig cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    @Override
    public Optional<BackendUnavailableException> probe(QualityMode mode) {
        if (!cfg.enabled()) {
            return unavailable("disabled by configuration (visqol.native.enabled=false)");
        }
        if (cfg.binaryPath().isBlank()) {
            return unavailable("no binary path configured");
        }
        Path binary = VisqolProcessManager.resolvePath(cfg.binaryPath());
        if (!Files.isRegularFile(binary)) {
            return unavailable("binary not found: " + binary);
        }
        if (!Files.isExecutable(binary)) {
            return unavailable("binary not executable: " + binary + " (try: chmod +x '" + binary + "')");
        }
        String modelPath = cfg.modelPathFor(mode);
        if (modelPath.isBlank()) {
            return unavailable("no " + mode.id() + " model path configured");
        }
        Path model = VisqolProcessManager.resolvePath(modelPath);
        if (!Files.isRegularFile(model)) {
            return unavailable(mode.id() + " model not found: " + model);
        }
        LOG.debug("Native backend available for {}: binary={}, model={}", mode, binary, model);
        return Optional.empty();
    }

    private static Optional<BackendUnavailableException> unavailable(String reason) {
        return Optional.of(new BackendUnavailableException(BackendNames.NATIVE, reason));
    }
}
