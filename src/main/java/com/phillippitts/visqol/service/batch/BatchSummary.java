package com.phillippitts.visqol.service.batch;

import com.phillippitts.visqol.domain.BatchOutcome;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Aggregate view of a finished batch.
 *
 * @param total     number of pairs
 * @param succeeded pairs with a result
 * @param failed    pairs with a failure marker
 * @param meanMos   mean MOS-LQO over successful pairs, NaN when none succeeded
 * @param minMos    minimum MOS-LQO over successful pairs, NaN when none succeeded
 * @param maxMos    maximum MOS-LQO over successful pairs, NaN when none succeeded
 */
public record BatchSummary(int total, int succeeded, int failed, double meanMos, double minMos, double maxMos) {

    public static BatchSummary of(List<BatchOutcome> outcomes) {
        double[] scores = outcomes.stream()
                .filter(BatchOutcome::isSuccess)
                .mapToDouble(o -> o.result().moslqo())
                .toArray();
        int succeeded = scores.length;
        OptionalDouble mean = Arrays.stream(scores).average();
        OptionalDouble min = Arrays.stream(scores).min();
        OptionalDouble max = Arrays.stream(scores).max();
        return new BatchSummary(outcomes.size(), succeeded, outcomes.size() - succeeded,
                mean.orElse(Double.NaN), min.orElse(Double.NaN), max.orElse(Double.NaN));
    }

    public boolean hasScores() {
        return succeeded > 0;
    }
}
