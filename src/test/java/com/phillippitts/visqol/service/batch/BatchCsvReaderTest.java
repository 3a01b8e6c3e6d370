package com.phillippitts.visqol.service.batch;

import com.phillippitts.visqol.domain.MeasurementPair;
import com.phillippitts.visqol.exception.DecodeException;
import com.phillippitts.visqol.exception.InvalidInputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchCsvReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReadPairsInFileOrder() throws Exception {
        Path csv = tempDir.resolve("pairs.csv");
        Files.writeString(csv, """
                reference,degraded
                /data/a_ref.wav,/data/a_deg.wav
                /data/b_ref.wav,/data/b_deg.wav
                """);

        List<MeasurementPair> pairs = BatchCsvReader.read(csv);

        assertThat(pairs).hasSize(2);
        assertThat(pairs.get(0).reference().path()).isEqualTo(Path.of("/data/a_ref.wav"));
        assertThat(pairs.get(1).degraded().path()).isEqualTo(Path.of("/data/b_deg.wav"));
    }

    @Test
    void headerColumnsMayBeReorderedAndExtra() {
        List<MeasurementPair> pairs = BatchCsvReader.parse(List.of(
                "id,Degraded,REFERENCE",
                "1,/x/deg.wav,/x/ref.wav"), "inline", null);

        assertThat(pairs.get(0).reference().path()).isEqualTo(Path.of("/x/ref.wav"));
        assertThat(pairs.get(0).degraded().path()).isEqualTo(Path.of("/x/deg.wav"));
    }

    @Test
    void quotedFieldsMayContainCommas() {
        List<MeasurementPair> pairs = BatchCsvReader.parse(List.of(
                "reference,degraded",
                "\"/x/a,b.wav\",\"/x/say \"\"hi\"\".wav\""), "inline", null);

        assertThat(pairs.get(0).reference().path()).isEqualTo(Path.of("/x/a,b.wav"));
        assertThat(pairs.get(0).degraded().path()).isEqualTo(Path.of("/x/say \"hi\".wav"));
    }

    @Test
    void blankRowsAndIncompleteRowsAreSkipped() {
        List<MeasurementPair> pairs = BatchCsvReader.parse(List.of(
                "",
                "﻿reference,degraded",
                "/x/ref.wav,",
                "   ",
                "/x/ref.wav,/x/deg.wav"), "inline", null);

        assertThat(pairs).hasSize(1);
    }

    @Test
    void relativePathsResolveAgainstCsvDirectoryWhenPresent() throws Exception {
        Path ref = Files.createFile(tempDir.resolve("ref.wav"));
        Path csv = tempDir.resolve("pairs.csv");
        Files.writeString(csv, "reference,degraded\nref.wav,elsewhere.wav\n");

        MeasurementPair pair = BatchCsvReader.read(csv).get(0);

        assertThat(pair.reference().path()).isEqualTo(ref.toAbsolutePath());
        assertThat(pair.degraded().path()).isEqualTo(Path.of("elsewhere.wav"));
    }

    @Test
    void missingColumnShouldBeRejected() {
        assertThatThrownBy(() -> BatchCsvReader.parse(List.of("reference,other", "a,b"), "inline", null))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("'degraded'");
    }

    @Test
    void fileWithoutPairsShouldBeRejected() {
        assertThatThrownBy(() -> BatchCsvReader.parse(List.of("reference,degraded"), "inline", null))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("no valid reference/degraded pairs");
        assertThatThrownBy(() -> BatchCsvReader.parse(List.of(" "), "inline", null))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void missingFileShouldRaiseDecode() {
        assertThatThrownBy(() -> BatchCsvReader.read(tempDir.resolve("absent.csv")))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("batch file not found");
    }
}
