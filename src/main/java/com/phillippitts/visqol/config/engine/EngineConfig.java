package com.phillippitts.visqol.config.engine;

import com.phillippitts.visqol.service.backend.BackendProbe;
import com.phillippitts.visqol.service.backend.visqolcli.NativeBackendProbe;
import com.phillippitts.visqol.service.model.ModelRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring wiring for the engine's shared collaborators.
 *
 * <p>The engine itself stays plain Java; see
 * {@link com.phillippitts.visqol.service.engine.VisqolEngineFactory}.
 */
@Configuration
public class EngineConfig {

    private static final Logger LOG = LogManager.getLogger(EngineConfig.class);

    @Bean
    public ModelRepository modelRepository(VisqolProperties properties) {
        if (properties.hasModelDirectory()) {
            Path dir = Path.of(properties.modelDirectory());
            LOG.info("Model resources: {} (then classpath)", dir.toAbsolutePath());
            return new ModelRepository(dir);
        }
        return new ModelRepository();
    }

    @Bean
    public BackendProbe backendProbe(NativeVisqolConfig nativeConfig) {
        return new NativeBackendProbe(nativeConfig);
    }
}
