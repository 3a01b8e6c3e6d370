package com.phillippitts.visqol.config.engine;

import com.phillippitts.visqol.domain.QualityMode;
import com.phillippitts.visqol.service.backend.BackendProbe;
import com.phillippitts.visqol.service.model.ModeModel;
import com.phillippitts.visqol.service.model.ModelRepository;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Validates every mode's model resource at startup.
 *
 * Fail-fast: a missing or invalid model aborts startup with a
 * {@link com.phillippitts.visqol.exception.ModelLoadException}. Native backend availability is
 * only reported, never fatal.
 */
@Component
@ConditionalOnProperty(name = "visqol.validation.enabled", havingValue = "true", matchIfMissing = true)
class ModelValidationService {

    private static final Logger LOG = LogManager.getLogger(ModelValidationService.class);

    private final ModelRepository repository;
    private final BackendProbe probe;

    ModelValidationService(ModelRepository repository, BackendProbe probe) {
        this.repository = repository;
        this.probe = probe;
    }

    @PostConstruct
    void validateAllOnStartup() {
        LOG.info("Validating quality models... os={}, arch={}",
                System.getProperty("os.name"), System.getProperty("os.arch"));
        for (QualityMode mode : QualityMode.values()) {
            validateMode(mode);
        }
        LOG.info("Quality model validation complete");
    }

    // Visible for tests
    ModeModel validateMode(QualityMode mode) {
        ModeModel model = repository.load(mode);
        probe.probe(mode).ifPresentOrElse(
                reason -> LOG.info("{}: native backend unavailable ({}); approximate backend will be used",
                        mode, reason.getMessage()),
                () -> LOG.info("{}: native backend available", mode));
        return model;
    }
}
