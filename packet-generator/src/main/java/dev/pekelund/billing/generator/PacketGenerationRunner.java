package dev.pekelund.billing.generator;

import dev.pekelund.billing.generator.source.JsonRowSource;
import dev.pekelund.billing.history.HistoryStore;
import dev.pekelund.billing.pipeline.BillingPipeline;
import dev.pekelund.billing.pipeline.PipelineMdc;
import dev.pekelund.billing.pipeline.PipelineReport;
import dev.pekelund.billing.rows.RawRow;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;

/**
 * Runs the pipeline once over the configured input when the application starts. The exit code is
 * non-zero when any packet failed or the audit baseline could not be saved.
 */
public class PacketGenerationRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(PacketGenerationRunner.class);

    private final PacketGeneratorSettings settings;
    private final JsonRowSource rowSource;
    private final BillingPipeline pipeline;
    private final HistoryStore historyStore;
    private volatile PipelineReport lastReport;

    public PacketGenerationRunner(PacketGeneratorSettings settings, JsonRowSource rowSource,
        BillingPipeline pipeline, HistoryStore historyStore) {

        this.settings = Objects.requireNonNull(settings, "settings");
        this.rowSource = Objects.requireNonNull(rowSource, "rowSource");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.historyStore = Objects.requireNonNull(historyStore, "historyStore");
    }

    @Override
    public void run(String... args) {
        resetHistory();
        if (settings.inputPath() == null) {
            LOGGER.info("INPUT_PATH is not set; nothing to generate");
            return;
        }

        try (PipelineMdc.Context ignored = PipelineMdc.open(UUID.randomUUID().toString())) {
            PipelineMdc.setStage("read");
            List<RawRow> rows = rowSource.read(settings.inputPath());
            PipelineReport report = pipeline.run(rows);
            lastReport = report;
            report.warnings().forEach(warning -> LOGGER.warn("Helper fallback: {}", warning.message()));
            if (report.hasFailures()) {
                LOGGER.error("Billing {} completed with failures", report.summaryLine());
            }
        }
    }

    private void resetHistory() {
        if (settings.resetsAllHistory()) {
            historyStore.resetAll();
            LOGGER.warn("Cleared all packet history; every packet is generated again");
            return;
        }
        for (String packetId : settings.historyResets()) {
            if (!historyStore.reset(packetId)) {
                LOGGER.warn("No history recorded for packet {}; nothing to reset", packetId);
            }
        }
    }

    public PipelineReport lastReport() {
        return lastReport;
    }

    @Override
    public int getExitCode() {
        PipelineReport report = lastReport;
        return report != null && report.hasFailures() ? 1 : 0;
    }
}
