package dev.pekelund.billing.generator;

import dev.pekelund.billing.config.InvalidConfigurationException;
import dev.pekelund.billing.config.PipelineConfig;
import dev.pekelund.billing.grouping.GroupingMode;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Configuration values resolved from the environment for one packet generation run. Every
 * recognized variable is parsed up front so a bad value fails the run before history is touched.
 */
public record PacketGeneratorSettings(
    PipelineConfig pipeline,
    Path inputPath,
    Path outputDirectory,
    Path historyPath,
    Path auditStatePath,
    Path exemptionListPath,
    HistoryBackend historyBackend,
    String historyBucket,
    List<String> historyResets
) {

    /**
     * {@code RESET_HISTORY} value that clears the whole history instead of single packets.
     */
    public static final String RESET_ALL = "all";

    static final String DEFAULT_OUTPUT_DIR = "generated_docs";
    static final String HISTORY_FILE_NAME = "hash_history.json";
    static final String AUDIT_STATE_FILE_NAME = "audit_state.json";
    static final String EXEMPTION_FILE_NAME = "exemption_list.json";

    public PacketGeneratorSettings {
        Objects.requireNonNull(pipeline, "pipeline");
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        Objects.requireNonNull(historyBackend, "historyBackend");
        if (historyBackend == HistoryBackend.GCS && !StringUtils.hasText(historyBucket)) {
            throw new InvalidConfigurationException("HISTORY_BUCKET must be set when HISTORY_BACKEND is 'gcs'");
        }
        historyResets = historyResets != null ? List.copyOf(historyResets) : List.of();
    }

    public boolean resetsAllHistory() {
        return historyResets.stream().anyMatch(RESET_ALL::equalsIgnoreCase);
    }

    public static PacketGeneratorSettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static PacketGeneratorSettings fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");

        PipelineConfig.Builder pipeline = PipelineConfig.builder();
        String force = env.get("FORCE_GENERATION");
        if (StringUtils.hasText(force)) {
            pipeline.forceRegeneration(parseBoolean("FORCE_GENERATION", force));
        }
        String variance = env.get("PRICE_VARIANCE_THRESHOLD");
        if (StringUtils.hasText(variance)) {
            pipeline.priceVarianceThreshold(parseDouble("PRICE_VARIANCE_THRESHOLD", variance));
        }
        String severity = env.get("HIGH_SEVERITY_DEVIATION");
        if (StringUtils.hasText(severity)) {
            pipeline.highSeverityDeviation(parseDouble("HIGH_SEVERITY_DEVIATION", severity));
        }
        String anomalyCount = env.get("HIGH_RISK_ANOMALY_COUNT");
        if (StringUtils.hasText(anomalyCount)) {
            pipeline.highRiskAnomalyCount(parseInt("HIGH_RISK_ANOMALY_COUNT", anomalyCount));
        }
        String weekday = env.get("WEEK_ENDING_WEEKDAY");
        if (StringUtils.hasText(weekday)) {
            pipeline.weekEndingWeekday(parseWeekday(weekday));
        }
        String extended = env.get("EXTENDED_CHANGE_DETECTION");
        if (StringUtils.hasText(extended)) {
            pipeline.extendedChangeDetection(parseBoolean("EXTENDED_CHANGE_DETECTION", extended));
        }
        String mode = env.get("RES_GROUPING_MODE");
        if (StringUtils.hasText(mode)) {
            pipeline.groupingMode(parseGroupingMode(mode));
        }
        String placeholder = env.get("PLACEHOLDER_CU_CODE");
        if (StringUtils.hasText(placeholder)) {
            pipeline.placeholderCuCode(placeholder.trim());
        }
        String workers = env.get("PIPELINE_WORKER_THREADS");
        if (StringUtils.hasText(workers)) {
            pipeline.workerThreads(parseInt("PIPELINE_WORKER_THREADS", workers));
        }

        Path outputDirectory = path("OUTPUT_DIR", env.getOrDefault("OUTPUT_DIR", DEFAULT_OUTPUT_DIR));
        if (outputDirectory == null) {
            outputDirectory = Path.of(DEFAULT_OUTPUT_DIR);
        }
        Path historyPath = path("HISTORY_PATH", env.get("HISTORY_PATH"));
        Path auditStatePath = path("AUDIT_STATE_PATH", env.get("AUDIT_STATE_PATH"));
        Path exemptionListPath = path("EXEMPTION_LIST_PATH", env.get("EXEMPTION_LIST_PATH"));

        return new PacketGeneratorSettings(
            pipeline.build(),
            path("INPUT_PATH", env.get("INPUT_PATH")),
            outputDirectory,
            historyPath != null ? historyPath : outputDirectory.resolve(HISTORY_FILE_NAME),
            auditStatePath != null ? auditStatePath : outputDirectory.resolve(AUDIT_STATE_FILE_NAME),
            exemptionListPath != null ? exemptionListPath : Path.of(EXEMPTION_FILE_NAME),
            HistoryBackend.parse(env.get("HISTORY_BACKEND")),
            StringUtils.hasText(env.get("HISTORY_BUCKET")) ? env.get("HISTORY_BUCKET").trim() : null,
            historyResets(env.get("RESET_HISTORY")));
    }

    /**
     * Packet ids to forget before the run, separated by commas or semicolons, or {@value #RESET_ALL}.
     */
    private static List<String> historyResets(String value) {
        if (!StringUtils.hasText(value)) {
            return List.of();
        }
        return Arrays.stream(value.split("[,;]"))
            .map(String::trim)
            .filter(StringUtils::hasText)
            .distinct()
            .toList();
    }

    private static boolean parseBoolean(String name, String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "y", "on" -> true;
            case "false", "0", "no", "n", "off" -> false;
            default -> throw new InvalidConfigurationException(name + " must be a boolean but was '" + value + "'");
        };
    }

    private static double parseDouble(String name, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ex) {
            throw new InvalidConfigurationException(name + " must be a number but was '" + value + "'", ex);
        }
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new InvalidConfigurationException(name + " must be an integer but was '" + value + "'", ex);
        }
    }

    private static DayOfWeek parseWeekday(String value) {
        try {
            return DayOfWeek.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new InvalidConfigurationException("WEEK_ENDING_WEEKDAY must name a weekday but was '" + value + "'",
                ex);
        }
    }

    private static GroupingMode parseGroupingMode(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "primary" -> GroupingMode.PRIMARY;
            // helper packets are produced the same way in both modes
            case "both", "helper" -> GroupingMode.BOTH;
            default -> throw new InvalidConfigurationException(
                "RES_GROUPING_MODE must be 'primary', 'helper' or 'both' but was '" + value + "'");
        };
    }

    private static Path path(String name, String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return Path.of(value.trim());
        } catch (InvalidPathException ex) {
            throw new InvalidConfigurationException(name + " is not a valid path: '" + value + "'", ex);
        }
    }
}
