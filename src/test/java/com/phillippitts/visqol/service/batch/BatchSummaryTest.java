package com.phillippitts.visqol.service.batch;

import com.phillippitts.visqol.domain.BatchOutcome;
import com.phillippitts.visqol.domain.MeasurementPair;
import com.phillippitts.visqol.domain.MeasurementResult;
import com.phillippitts.visqol.exception.ErrorKind;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BatchSummaryTest {

    private static final MeasurementPair PAIR = MeasurementPair.of(Path.of("r.wav"), Path.of("d.wav"));

    private static BatchOutcome scored(int index, double mos) {
        return BatchOutcome.success(index, PAIR,
                MeasurementResult.of(mos, 0.5, new double[] {0.5}, new double[] {100}, "approximate"));
    }

    @Test
    void statisticsCoverOnlySuccessfulPairs() {
        BatchSummary summary = BatchSummary.of(List.of(
                scored(0, 2.0),
                BatchOutcome.failure(1, PAIR, ErrorKind.DECODE, "bad"),
                scored(2, 4.0)));

        assertThat(summary.total()).isEqualTo(3);
        assertThat(summary.succeeded()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.meanMos()).isCloseTo(3.0, within(1e-12));
        assertThat(summary.minMos()).isEqualTo(2.0);
        assertThat(summary.maxMos()).isEqualTo(4.0);
        assertThat(summary.hasScores()).isTrue();
    }

    @Test
    void allFailedBatchHasNoScores() {
        BatchSummary summary = BatchSummary.of(List.of(BatchOutcome.failure(0, PAIR, ErrorKind.CANCELLED, "t")));

        assertThat(summary.hasScores()).isFalse();
        assertThat(summary.meanMos()).isNaN();
    }
}
