package com.phillippitts.visqol.presentation.cli;

import com.phillippitts.visqol.domain.QualityMode;
import com.phillippitts.visqol.exception.InvalidInputException;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Parsed command-line flags.
 *
 * <p>Value flags accept both {@code --flag=value} and {@code --flag value}. Boolean flags accept
 * {@code --flag}, {@code --flag=true} and {@code --flag=false}. Arguments not starting with
 * {@code --} and flags belonging to Spring ({@code --spring.*}, {@code --visqol.*},
 * {@code --logging.*}, {@code --management.*}) are ignored.
 *
 * @param referenceFile single-pair reference path, null in batch mode
 * @param degradedFile  single-pair degraded path, null in batch mode
 * @param batchInputCsv batch pair list, null in single mode
 * @param resultsCsv    batch results table, may be null
 * @param outputDebug   JSON debug export, may be null
 * @param speechMode    whether to measure in SPEECH mode
 * @param verbose       whether to print extended output
 * @param help          whether usage was requested
 */
public record CliOptions(
        Path referenceFile,
        Path degradedFile,
        Path batchInputCsv,
        Path resultsCsv,
        Path outputDebug,
        boolean speechMode,
        boolean verbose,
        boolean help
) {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  visqol --reference_file=REF.wav --degraded_file=DEG.wav [--use_speech_mode] [--verbose]"
                    + " [--output_debug=OUT.json]",
            "  visqol --batch_input_csv=PAIRS.csv [--results_csv=OUT.csv] [--use_speech_mode] [--verbose]"
                    + " [--output_debug=OUT.json]",
            "",
            "  --reference_file   reference (clean) audio file",
            "  --degraded_file    degraded audio file",
            "  --batch_input_csv  CSV with 'reference,degraded' header, one pair per row",
            "  --results_csv      write reference,degraded,moslqo,vnsim,status,error per pair",
            "  --output_debug     write JSON with per-band similarity and centre frequencies",
            "  --use_speech_mode  measure wideband speech at 16 kHz with voice-activity filtering",
            "  --verbose          print similarity, backend and signal statistics");

    private static final Set<String> VALUE_FLAGS = Set.of(
            "reference_file", "degraded_file", "batch_input_csv", "results_csv", "output_debug");
    private static final Set<String> BOOLEAN_FLAGS = Set.of("use_speech_mode", "verbose", "help");
    private static final List<String> FOREIGN_PREFIXES = List.of("spring.", "visqol.", "logging.", "management.",
            "debug", "trace");

    public QualityMode mode() {
        return speechMode ? QualityMode.SPEECH : QualityMode.AUDIO;
    }

    public boolean isBatch() {
        return batchInputCsv != null;
    }

    /**
     * @return true when no measurement flag was given at all
     */
    public boolean isEmpty() {
        return referenceFile == null && degradedFile == null && batchInputCsv == null && !help;
    }

    /**
     * Reads flags from Spring's parsed arguments. {@code --flag=value} comes from
     * {@link ApplicationArguments#getOptionValues(String)}; a value flag given without {@code =}
     * takes the next source argument.
     *
     * @throws InvalidInputException for unknown flags, missing values or inconsistent combinations
     */
    public static CliOptions from(ApplicationArguments args) {
        Flags flags = new Flags();
        List<String> source = List.of(args.getSourceArgs());
        for (String name : new TreeSet<>(args.getOptionNames())) {
            if (isForeign(name)) {
                continue;
            }
            List<String> values = args.getOptionValues(name);
            String value = values == null || values.isEmpty() ? null : values.get(values.size() - 1);
            if (value == null && VALUE_FLAGS.contains(name)) {
                value = followingValue(source, source.lastIndexOf("--" + name), name);
            }
            flags.accept(name, value);
        }
        return flags.build();
    }

    /**
     * @throws InvalidInputException for malformed arguments, unknown flags, missing values or
     *                               inconsistent combinations
     */
    public static CliOptions parse(String... args) {
        ApplicationArguments parsed;
        try {
            parsed = new DefaultApplicationArguments(args == null ? new String[0] : args);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("arguments", e.getMessage());
        }
        return from(parsed);
    }

    private static String followingValue(List<String> args, int flagIndex, String name) {
        if (flagIndex < 0 || flagIndex + 1 >= args.size() || args.get(flagIndex + 1).startsWith("--")) {
            throw new InvalidInputException("--" + name, "missing value");
        }
        return args.get(flagIndex + 1);
    }

    private static final class Flags {
        private Path reference;
        private Path degraded;
        private Path batch;
        private Path results;
        private Path debug;
        private boolean speech;
        private boolean verbose;
        private boolean help;

        void accept(String name, String value) {
            if (VALUE_FLAGS.contains(name)) {
                if (value.isBlank()) {
                    throw new InvalidInputException("--" + name, "missing value");
                }
                Path path = Path.of(value);
                switch (name) {
                    case "reference_file" -> reference = path;
                    case "degraded_file" -> degraded = path;
                    case "batch_input_csv" -> batch = path;
                    case "results_csv" -> results = path;
                    default -> debug = path;
                }
            } else if (BOOLEAN_FLAGS.contains(name)) {
                boolean on = value == null || parseBoolean(name, value);
                switch (name) {
                    case "use_speech_mode" -> speech = on;
                    case "verbose" -> verbose = on;
                    default -> help = on;
                }
            } else {
                throw new InvalidInputException("--" + name, "unknown flag");
            }
        }

        CliOptions build() {
            CliOptions options = new CliOptions(reference, degraded, batch, results, debug, speech, verbose, help);
            if (!help) {
                options.validate();
            }
            return options;
        }
    }

    private void validate() {
        if (batchInputCsv != null) {
            if (referenceFile != null || degradedFile != null) {
                throw new InvalidInputException("arguments",
                        "--batch_input_csv cannot be combined with --reference_file/--degraded_file");
            }
            return;
        }
        if ((referenceFile == null) != (degradedFile == null)) {
            throw new InvalidInputException("arguments", "both --reference_file and --degraded_file are required");
        }
        if (resultsCsv != null && referenceFile != null) {
            throw new InvalidInputException("arguments", "--results_csv requires --batch_input_csv");
        }
    }

    private static boolean parseBoolean(String name, String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.equals("true") || v.equals("1")) {
            return true;
        }
        if (v.equals("false") || v.equals("0")) {
            return false;
        }
        throw new InvalidInputException("--" + name, "expected true or false, got '" + value + "'");
    }

    private static boolean isForeign(String name) {
        for (String prefix : FOREIGN_PREFIXES) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
