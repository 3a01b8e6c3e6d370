package com.phillippitts.visqol.service.backend.approximate;

import com.phillippitts.visqol.domain.MeasurementResult;
import com.phillippitts.visqol.service.align.AlignedPair;
import com.phillippitts.visqol.service.analysis.SpectralAnalyzer;
import com.phillippitts.visqol.service.analysis.Spectrogram;
import com.phillippitts.visqol.service.backend.AbstractQualityBackend;
import com.phillippitts.visqol.service.backend.BackendMode;
import com.phillippitts.visqol.service.backend.BackendNames;
import com.phillippitts.visqol.service.model.ModeModel;
import com.phillippitts.visqol.service.score.AggregateScore;
import com.phillippitts.visqol.service.score.ScoreAggregator;
import com.phillippitts.visqol.service.similarity.BandPatchScores;
import com.phillippitts.visqol.service.similarity.PatchSimilarityScorer;
import com.phillippitts.visqol.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * In-process backend: spectral analysis, patch similarity and score aggregation.
 *
 * <p>Stateless between calls and safe for concurrent use once initialized.
 */
public final class ApproximateBackend extends AbstractQualityBackend {

    private static final Logger LOG = LogManager.getLogger(ApproximateBackend.class);

    private final ModeModel model;
    private final SpectralAnalyzer analyzer;
    private final PatchSimilarityScorer scorer;
    private final ScoreAggregator aggregator;

    public ApproximateBackend(ModeModel model) {
        this.model = Objects.requireNonNull(model, "model");
        this.analyzer = new SpectralAnalyzer(model);
        this.scorer = new PatchSimilarityScorer(model);
        this.aggregator = new ScoreAggregator(model);
    }

    @Override
    protected void doInitialize() {
        LOG.info("Approximate backend initialized: model={}, bands={}, window={}, voiceActivity={}",
                model.id(), model.bandCount(), model.windowSize(), model.voiceActivity().enabled());
    }

    @Override
    public MeasurementResult compare(AlignedPair pair) {
        Objects.requireNonNull(pair, "pair must not be null");
        ensureInitialized();
        long start = System.nanoTime();
        try {
            Spectrogram ref = analyzer.analyze(pair.reference());
            checkInterrupted();
            Spectrogram deg = analyzer.analyze(pair.degraded());
            checkInterrupted();
            BandPatchScores scores = scorer.score(ref, deg);
            AggregateScore aggregate = aggregator.aggregate(scores);
            LOG.debug("Approximate comparison in {} ms: frames={}, active={}, patches={}, vnsim={}, moslqo={}",
                    TimeUtils.elapsedMillis(start), ref.frameCount(), ref.activeFrameCount(),
                    scores.totalScored(), aggregate.vnsim(), aggregate.moslqo());
            return MeasurementResult.of(aggregate.moslqo(), aggregate.vnsim(), aggregate.fvnsim(),
                    aggregate.centerFreqBands(), BackendNames.APPROXIMATE);
        } catch (Exception e) {
            throw handleCompareError(e);
        }
    }

    @Override
    public String getBackendName() {
        return BackendNames.APPROXIMATE;
    }

    @Override
    public BackendMode getMode() {
        return BackendMode.APPROXIMATE;
    }

    public ModeModel getModel() {
        return model;
    }

    @Override
    protected void doClose() {
        LOG.debug("Approximate backend closed");
    }
}
