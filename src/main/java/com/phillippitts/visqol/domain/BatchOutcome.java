package com.phillippitts.visqol.domain;

import com.phillippitts.visqol.exception.ErrorKind;

import java.util.Objects;

/**
 * Result slot of one batch pair: either a measurement or a failure marker.
 *
 * @param index        position of the pair in the submitted batch
 * @param referenceId  reference description (path or "array")
 * @param degradedId   degraded description (path or "array")
 * @param result       measurement, null on failure
 * @param errorKind    failure classification, null on success
 * @param errorMessage failure message, null on success
 */
public record BatchOutcome(
        int index,
        String referenceId,
        String degradedId,
        MeasurementResult result,
        ErrorKind errorKind,
        String errorMessage
) {

    public BatchOutcome {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got: " + index);
        }
        Objects.requireNonNull(referenceId, "referenceId must not be null");
        Objects.requireNonNull(degradedId, "degradedId must not be null");
        if ((result == null) == (errorKind == null)) {
            throw new IllegalArgumentException("Exactly one of result or errorKind must be set");
        }
    }

    public static BatchOutcome success(int index, MeasurementPair pair, MeasurementResult result) {
        return new BatchOutcome(index, pair.reference().describe(), pair.degraded().describe(),
                Objects.requireNonNull(result, "result must not be null"), null, null);
    }

    public static BatchOutcome failure(int index, MeasurementPair pair, ErrorKind kind, String message) {
        return new BatchOutcome(index, pair.reference().describe(), pair.degraded().describe(),
                null, Objects.requireNonNull(kind, "kind must not be null"), message);
    }

    public boolean isSuccess() {
        return result != null;
    }
}
