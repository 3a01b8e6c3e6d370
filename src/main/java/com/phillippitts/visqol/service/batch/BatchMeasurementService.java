package com.phillippitts.visqol.service.batch;

import com.phillippitts.visqol.domain.BatchOutcome;
import com.phillippitts.visqol.domain.MeasurementPair;
import com.phillippitts.visqol.domain.QualityMode;
import com.phillippitts.visqol.service.engine.VisqolEngine;
import com.phillippitts.visqol.service.engine.VisqolEngineFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Runs CSV-described batches through the mode's engine.
 *
 * <p>Reads pairs with {@link BatchCsvReader}, measures them on the shared batch executor and
 * optionally writes the results CSV and a JSON debug export.
 */
@Service
public class BatchMeasurementService {

    private static final Logger LOG = LogManager.getLogger(BatchMeasurementService.class);

    private final VisqolEngineFactory engineFactory;

    public BatchMeasurementService(VisqolEngineFactory engineFactory) {
        this.engineFactory = Objects.requireNonNull(engineFactory);
    }

    public List<BatchOutcome> measure(List<MeasurementPair> pairs, QualityMode mode) {
        return engineFactory.engineFor(mode).measureBatch(pairs);
    }

    /**
     * @param inputCsv   pair list with {@code reference,degraded} header
     * @param mode       measurement mode
     * @param resultsCsv results table to write, may be null
     * @param debugJson  JSON export to write, may be null
     */
    public List<BatchOutcome> measureCsv(Path inputCsv, QualityMode mode, Path resultsCsv, Path debugJson) {
        List<MeasurementPair> pairs = BatchCsvReader.read(inputCsv);
        VisqolEngine engine = engineFactory.engineFor(mode);
        LOG.info("Batch {}: {} pair(s), mode={}, backend={}", inputCsv, pairs.size(), mode,
                engine.getBackendStatus().backendName());
        List<BatchOutcome> outcomes = resultsCsv == null
                ? engine.measureBatch(pairs)
                : engine.measureBatch(pairs, resultsCsv);
        if (debugJson != null) {
            ResultsJsonWriter.write(outcomes, debugJson);
        }
        return outcomes;
    }
}
