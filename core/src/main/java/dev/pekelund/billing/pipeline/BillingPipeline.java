package dev.pekelund.billing.pipeline;

import dev.pekelund.billing.audit.AuditBaselineStore;
import dev.pekelund.billing.audit.AuditEngine;
import dev.pekelund.billing.audit.AuditStateException;
import dev.pekelund.billing.audit.AuditSummary;
import dev.pekelund.billing.config.PipelineConfig;
import dev.pekelund.billing.decision.ArtifactLocator;
import dev.pekelund.billing.decision.ChangeDecision;
import dev.pekelund.billing.decision.ChangeDecisionEngine;
import dev.pekelund.billing.fingerprint.Fingerprint;
import dev.pekelund.billing.fingerprint.FingerprintEngine;
import dev.pekelund.billing.grouping.GroupingEngine;
import dev.pekelund.billing.grouping.GroupingResult;
import dev.pekelund.billing.grouping.Packet;
import dev.pekelund.billing.history.HistoryRecord;
import dev.pekelund.billing.history.HistoryStore;
import dev.pekelund.billing.history.HistoryStoreException;
import dev.pekelund.billing.rows.CanonicalRow;
import dev.pekelund.billing.rows.ColumnSynonymNormalizer;
import dev.pekelund.billing.rows.RawRow;
import dev.pekelund.billing.validation.ExemptionList;
import dev.pekelund.billing.validation.RejectReason;
import dev.pekelund.billing.validation.RowValidator;
import dev.pekelund.billing.validation.ValidationResult;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Runs one weekly billing pass: normalize and validate the raw rows, group them into packets,
 * decide per packet whether its artifact must be regenerated, render and commit history for the
 * packets that need it, then audit the accepted rows against the previous run.
 *
 * <p>Rows and packets are processed on a fixed worker pool sized by
 * {@link PipelineConfig#workerThreads()}. Results keep arrival and first-seen order regardless of
 * scheduling.
 */
public class BillingPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(BillingPipeline.class);

    private final PipelineConfig config;
    private final ColumnSynonymNormalizer normalizer;
    private final RowValidator validator;
    private final GroupingEngine groupingEngine;
    private final FingerprintEngine fingerprintEngine;
    private final ChangeDecisionEngine decisionEngine;
    private final AuditEngine auditEngine;
    private final HistoryStore historyStore;
    private final PacketRenderer renderer;
    private final AuditBaselineStore baselineStore;
    private final Clock clock;

    public BillingPipeline(PipelineConfig config, ExemptionList exemptions, HistoryStore historyStore,
        ArtifactLocator artifactLocator, PacketRenderer renderer, AuditBaselineStore baselineStore, Clock clock) {

        this(config, new ColumnSynonymNormalizer(), exemptions, historyStore, artifactLocator, renderer,
            baselineStore, clock);
    }

    public BillingPipeline(PipelineConfig config, ColumnSynonymNormalizer normalizer, ExemptionList exemptions,
        HistoryStore historyStore, ArtifactLocator artifactLocator, PacketRenderer renderer,
        AuditBaselineStore baselineStore, Clock clock) {

        this.config = Objects.requireNonNull(config, "config");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.historyStore = Objects.requireNonNull(historyStore, "historyStore");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.baselineStore = Objects.requireNonNull(baselineStore, "baselineStore");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.validator = new RowValidator(config.placeholderCuCode());
        this.groupingEngine = new GroupingEngine(config.weekEndingWeekday(), config.groupingMode(), exemptions);
        this.fingerprintEngine = new FingerprintEngine(config.extendedChangeDetection());
        this.decisionEngine = new ChangeDecisionEngine(config.forceRegeneration(), artifactLocator);
        this.auditEngine = new AuditEngine(config, clock);
    }

    public PipelineReport run(List<RawRow> rawRows) {
        Objects.requireNonNull(rawRows, "rawRows");
        String runId = StringUtils.hasText(PipelineMdc.currentRunId())
            ? PipelineMdc.currentRunId()
            : UUID.randomUUID().toString();

        ExecutorService executor = Executors.newFixedThreadPool(config.workerThreads(), new WorkerThreadFactory());
        try (PipelineMdc.Context ignored = PipelineMdc.open(runId)) {
            LOGGER.info("Starting billing run {} over {} rows (force={}, mode={}, workers={})", runId,
                rawRows.size(), config.forceRegeneration(), config.groupingMode(), config.workerThreads());

            PipelineMdc.setStage("validate");
            List<ScreenedRow> screened = invokeAll(executor, rawRows.stream()
                .map(raw -> (Callable<ScreenedRow>) () -> screen(raw))
                .toList());
            screened.sort(Comparator.comparingLong(row -> row.row().arrivalIndex()));

            List<CanonicalRow> accepted = new ArrayList<>();
            Map<RejectReason, Integer> rejected = new EnumMap<>(RejectReason.class);
            for (ScreenedRow row : screened) {
                if (row.result().accepted()) {
                    accepted.add(row.row());
                } else {
                    rejected.merge(row.result().reason(), 1, Integer::sum);
                }
            }
            LOGGER.info("Validated {} rows: {} accepted, rejected by reason {}", screened.size(), accepted.size(),
                rejected);

            PipelineMdc.setStage("group");
            GroupingResult grouping = groupingEngine.group(accepted);

            PipelineMdc.setStage("generate");
            List<PacketOutcome> outcomes = processPackets(executor, grouping.packets());

            PipelineMdc.setStage("audit");
            AuditSummary previous = baselineStore.loadPrevious().orElse(null);
            AuditSummary audit = auditEngine.audit(accepted, previous);
            boolean baselineSaved = saveBaseline(audit);

            PipelineReport report = new PipelineReport(runId, rawRows.size(), accepted.size(), rejected,
                grouping.exemptedRows(), grouping.warnings(), outcomes, audit, baselineSaved);
            LOGGER.info("Finished billing {}", report.summaryLine());
            return report;
        } finally {
            executor.shutdownNow();
        }
    }

    private ScreenedRow screen(RawRow raw) {
        CanonicalRow row = normalizer.normalize(raw);
        ValidationResult result = validator.validate(row);
        if (!result.accepted()) {
            LOGGER.debug("Rejected row {} (WR# {}): {}", row.arrivalIndex(), row.workRequest(), result.reason());
        }
        return new ScreenedRow(row, result);
    }

    private List<PacketOutcome> processPackets(ExecutorService executor, List<Packet> packets) {
        Map<String, HistoryRecord> history;
        try {
            history = historyStore.loadAll();
        } catch (HistoryStoreException ex) {
            LOGGER.error("Unable to read packet history; no packet will be rendered in this run", ex);
            String detail = "History unavailable: " + ex.getMessage();
            return packets.stream()
                .map(packet -> PacketOutcome.persistenceFailed(packet.key(), null, null, null, detail))
                .toList();
        }

        return invokeAll(executor, packets.stream()
            .map(packet -> (Callable<PacketOutcome>) () -> process(packet, history))
            .toList());
    }

    PacketOutcome process(Packet packet, Map<String, HistoryRecord> history) {
        PipelineMdc.attachPacket(packet.key());
        String packetId = packet.key().id();
        Fingerprint fingerprint = fingerprintEngine.fingerprint(packet);
        HistoryRecord previous = history.get(packetId);
        ChangeDecision decision = decisionEngine.decide(fingerprint, previous);

        if (!decision.shouldGenerate()) {
            LOGGER.info("Skipping packet {} ({} rows): {}", packetId, packet.rowCount(), decision.reason());
            return PacketOutcome.skipped(packet.key(), decision.reason(), fingerprint.value(),
                previous.artifactRef());
        }

        LOGGER.info("Generating packet {} ({} rows, total {}): {}", packetId, packet.rowCount(),
            packet.totalPrice().toPlainString(), decision.reason());
        RenderedArtifact artifact;
        try {
            artifact = renderer.render(packet, fingerprint);
        } catch (RuntimeException ex) {
            LOGGER.error("Rendering packet {} failed; history left unchanged", packetId, ex);
            return PacketOutcome.renderFailed(packet.key(), decision.reason(), fingerprint.value(), ex.getMessage());
        }

        HistoryRecord next = new HistoryRecord(fingerprint.value(), artifact.reference(), clock.instant(),
            packet.rowCount(), packet.foreman(), packet.key().weekCode());
        try {
            if (!historyStore.compareAndSet(packetId, previous, next)) {
                LOGGER.error("History for packet {} changed during the run; artifact {} is not recorded", packetId,
                    artifact.reference());
                return PacketOutcome.persistenceFailed(packet.key(), decision.reason(), fingerprint.value(),
                    artifact.reference(), "History changed concurrently");
            }
        } catch (HistoryStoreException ex) {
            LOGGER.error("Recording history for packet {} failed after rendering {}", packetId,
                artifact.reference(), ex);
            return PacketOutcome.persistenceFailed(packet.key(), decision.reason(), fingerprint.value(),
                artifact.reference(), ex.getMessage());
        }
        return PacketOutcome.generated(packet.key(), decision.reason(), fingerprint.value(), artifact.reference());
    }

    private boolean saveBaseline(AuditSummary audit) {
        try {
            baselineStore.save(audit);
            return true;
        } catch (AuditStateException ex) {
            LOGGER.error("Unable to save the audit baseline; the next run will compare against an older one", ex);
            return false;
        }
    }

    private static <T> List<T> invokeAll(ExecutorService executor, List<Callable<T>> tasks) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        for (Callable<T> task : tasks) {
            futures.add(executor.submit(() -> {
                try (PipelineMdc.Context ignored = PipelineMdc.inherit(context)) {
                    return task.call();
                }
            }));
        }

        List<T> results = new ArrayList<>(futures.size());
        try {
            for (Future<T> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            futures.forEach(future -> future.cancel(true));
            throw new IllegalStateException("Interrupted while waiting for billing workers", ex);
        } catch (ExecutionException ex) {
            futures.forEach(future -> future.cancel(true));
            if (ex.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Billing worker failed", ex.getCause());
        }
        return results;
    }

    private record ScreenedRow(CanonicalRow row, ValidationResult result) {
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "billing-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
