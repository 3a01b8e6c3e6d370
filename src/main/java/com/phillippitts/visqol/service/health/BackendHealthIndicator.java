package com.phillippitts.visqol.service.health;

import com.phillippitts.visqol.config.engine.NativeVisqolConfig;
import com.phillippitts.visqol.domain.QualityMode;
import com.phillippitts.visqol.service.backend.BackendProbe;
import com.phillippitts.visqol.service.engine.VisqolEngine;
import com.phillippitts.visqol.service.engine.VisqolEngineFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Health indicator for measurement backends.
 *
 * <p>Reports, per mode, which backend is (or would be) selected and why:
 * <ul>
 *   <li>UP: every engine created so far is healthy</li>
 *   <li>DOWN: a created engine has been closed or failed to initialize its backend</li>
 * </ul>
 * A missing native binary is informational only: the approximate backend still serves requests.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class BackendHealthIndicator implements HealthIndicator {

    private final VisqolEngineFactory engineFactory;
    private final BackendProbe probe;
    private final NativeVisqolConfig nativeConfig;

    public BackendHealthIndicator(VisqolEngineFactory engineFactory,
                                  BackendProbe probe,
                                  NativeVisqolConfig nativeConfig) {
        this.engineFactory = engineFactory;
        this.probe = probe;
        this.nativeConfig = nativeConfig;
    }

    @Override
    public Health health() {
        Health.Builder builder = new Health.Builder().up();
        boolean allHealthy = true;
        for (QualityMode mode : QualityMode.values()) {
            Optional<VisqolEngine> engine = engineFactory.existing(mode);
            if (engine.isPresent()) {
                VisqolEngine e = engine.get();
                allHealthy &= e.isHealthy();
                builder.withDetail(mode.id(), (e.isHealthy() ? "" : "unhealthy: ") + e.getBackendStatus().describe());
            } else {
                builder.withDetail(mode.id(), probe.probe(mode)
                        .map(reason -> "not started, would use approximate: " + reason.getMessage())
                        .orElse("not started, would use native"));
            }
        }
        builder.withDetail("nativeBinary", formatBinaryStatus(Path.of(nativeConfig.binaryPath())));
        if (!allHealthy) {
            builder.down();
        }
        return builder.build();
    }

    private String formatBinaryStatus(Path path) {
        if (!nativeConfig.enabled()) {
            return "disabled";
        }
        if (!Files.isRegularFile(path)) {
            return "NOT FOUND at " + path;
        }
        if (!Files.isExecutable(path)) {
            return "not executable at " + path;
        }
        return "accessible and executable at " + path;
    }
}
