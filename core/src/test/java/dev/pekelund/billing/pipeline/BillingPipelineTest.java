package dev.pekelund.billing.pipeline;

import static dev.pekelund.billing.BillingFixtures.billableRow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import dev.pekelund.billing.audit.AnomalyKind;
import dev.pekelund.billing.audit.AuditBaselineStore;
import dev.pekelund.billing.audit.AuditStateException;
import dev.pekelund.billing.audit.InMemoryAuditBaselineStore;
import dev.pekelund.billing.audit.RiskDirection;
import dev.pekelund.billing.config.PipelineConfig;
import dev.pekelund.billing.decision.DecisionReason;
import dev.pekelund.billing.fingerprint.Fingerprint;
import dev.pekelund.billing.grouping.Packet;
import dev.pekelund.billing.grouping.PacketKey;
import dev.pekelund.billing.history.HistoryRecord;
import dev.pekelund.billing.history.HistoryStore;
import dev.pekelund.billing.history.HistoryStoreException;
import dev.pekelund.billing.history.InMemoryHistoryStore;
import dev.pekelund.billing.rows.BillingColumns;
import dev.pekelund.billing.rows.RawRow;
import dev.pekelund.billing.validation.ExemptionList;
import dev.pekelund.billing.validation.RejectReason;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BillingPipelineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-08-04T06:00:00Z"), ZoneOffset.UTC);
    private static final PacketKey FIRST_WEEK = PacketKey.primary("90093002", LocalDate.of(2025, 8, 3));
    private static final PacketKey SECOND_WEEK = PacketKey.primary("90093002", LocalDate.of(2025, 8, 10));
    private static final PacketKey OTHER = PacketKey.primary("88880001", LocalDate.of(2025, 8, 3));

    private InMemoryHistoryStore history;
    private InMemoryAuditBaselineStore baseline;
    private RecordingRenderer renderer;
    private PipelineConfig config;

    @BeforeEach
    void setUp() {
        history = new InMemoryHistoryStore();
        baseline = new InMemoryAuditBaselineStore();
        renderer = new RecordingRenderer();
        config = PipelineConfig.builder().workerThreads(4).build();
    }

    @Test
    void firstRunGeneratesEveryPacketAndRecordsHistory() {
        PipelineReport report = pipeline(config).run(rows());

        assertThat(report.outcomes()).extracting(PacketOutcome::key)
            .containsExactly(FIRST_WEEK, SECOND_WEEK, OTHER);
        assertThat(report.outcomes()).allSatisfy(outcome -> {
            assertThat(outcome.status()).isEqualTo(PacketStatus.GENERATED);
            assertThat(outcome.reason()).isEqualTo(DecisionReason.NEW_PACKET);
        });
        assertThat(history.loadAll()).containsOnlyKeys(FIRST_WEEK.id(), SECOND_WEEK.id(), OTHER.id());
        HistoryRecord recorded = history.find(FIRST_WEEK.id()).orElseThrow();
        assertThat(recorded.rowCount()).isEqualTo(2);
        assertThat(recorded.weekCode()).isEqualTo("080325");
        assertThat(recorded.generatedAt()).isEqualTo(CLOCK.instant());
        assertThat(report.hasFailures()).isFalse();
        assertThat(report.baselineSaved()).isTrue();
        assertThat(baseline.loadPrevious()).contains(report.audit());
    }

    @Test
    void unchangedRerunSkipsEveryPacket() {
        pipeline(config).run(rows());
        renderer.rendered.clear();

        PipelineReport second = pipeline(config).run(rows());

        assertThat(second.count(PacketStatus.SKIPPED)).isEqualTo(3);
        assertThat(second.outcomes()).extracting(PacketOutcome::reason).containsOnly(DecisionReason.UNCHANGED);
        assertThat(renderer.rendered).isEmpty();
    }

    @Test
    void forcedRerunRegeneratesUnchangedPackets() {
        pipeline(config).run(rows());

        PipelineReport forced = pipeline(config.toBuilder().forceRegeneration(true).build()).run(rows());

        assertThat(forced.count(PacketStatus.GENERATED)).isEqualTo(3);
        assertThat(forced.outcomes()).extracting(PacketOutcome::reason).containsOnly(DecisionReason.FORCED);
    }

    @Test
    void onlyChangedPacketIsRegenerated() {
        pipeline(config).run(rows());
        renderer.rendered.clear();
        List<RawRow> changed = List.of(
            billableRow(0, "90093002", "2025-08-01", "$1,200.00").build(),
            billableRow(1, "90093002", "2025-08-03", "1500.00").build(),
            billableRow(2, "90093002", "2025-08-05", "360").build(),
            billableRow(3, "88880001", "2025-08-02", "75.50").build());

        PipelineReport report = pipeline(config).run(changed);

        assertThat(report.outcome(FIRST_WEEK)).hasValueSatisfying(outcome ->
            assertThat(outcome.reason()).isEqualTo(DecisionReason.CONTENT_CHANGED));
        assertThat(report.count(PacketStatus.SKIPPED)).isEqualTo(2);
        assertThat(renderer.rendered).containsOnlyKeys(FIRST_WEEK.id());
    }

    @Test
    void deletedArtifactIsRegenerated() {
        pipeline(config).run(rows());
        String artifact = history.find(OTHER.id()).orElseThrow().artifactRef();
        renderer.rendered.remove(OTHER.id());
        renderer.existing.remove(artifact);

        PipelineReport report = pipeline(config).run(rows());

        assertThat(report.outcome(OTHER)).hasValueSatisfying(outcome -> {
            assertThat(outcome.status()).isEqualTo(PacketStatus.GENERATED);
            assertThat(outcome.reason()).isEqualTo(DecisionReason.ARTIFACT_MISSING);
        });
    }

    @Test
    void renderFailureLeavesHistoryUntouched() {
        renderer.failFor = OTHER.id();

        PipelineReport report = pipeline(config).run(rows());

        assertThat(report.outcome(OTHER)).hasValueSatisfying(outcome -> {
            assertThat(outcome.status()).isEqualTo(PacketStatus.RENDER_FAILED);
            assertThat(outcome.detail()).contains("disk full");
        });
        assertThat(history.find(OTHER.id())).isEmpty();
        assertThat(report.count(PacketStatus.GENERATED)).isEqualTo(2);
        assertThat(report.hasFailures()).isTrue();

        renderer.failFor = null;
        PipelineReport retry = pipeline(config).run(rows());
        assertThat(retry.outcome(OTHER)).hasValueSatisfying(outcome ->
            assertThat(outcome.reason()).isEqualTo(DecisionReason.NEW_PACKET));
    }

    @Test
    void unreadableHistoryRendersNothing() {
        HistoryStore broken = mock(HistoryStore.class);
        when(broken.loadAll()).thenThrow(new HistoryStoreException("bucket unavailable"));

        PipelineReport report = new BillingPipeline(config, ExemptionList.empty(), broken, renderer::exists,
            renderer, baseline, CLOCK).run(rows());

        assertThat(report.outcomes()).hasSize(3).allSatisfy(outcome -> {
            assertThat(outcome.status()).isEqualTo(PacketStatus.PERSISTENCE_FAILED);
            assertThat(outcome.detail()).contains("bucket unavailable");
        });
        assertThat(renderer.rendered).isEmpty();
        assertThat(report.audit()).isNotNull();
    }

    @Test
    void lostHistoryUpdateIsReportedAsPersistenceFailure() {
        HistoryStore conflicting = mock(HistoryStore.class);
        when(conflicting.loadAll()).thenReturn(Map.of());
        when(conflicting.compareAndSet(anyString(), any(), any())).thenReturn(false);

        PipelineReport report = new BillingPipeline(config, ExemptionList.empty(), conflicting, renderer::exists,
            renderer, baseline, CLOCK).run(rows());

        assertThat(report.count(PacketStatus.PERSISTENCE_FAILED)).isEqualTo(3);
        assertThat(report.outcomes()).allSatisfy(outcome -> assertThat(outcome.artifactRef()).isNotBlank());
    }

    @Test
    void reportsRejectedAndExemptedRows() {
        List<RawRow> rows = List.of(
            billableRow(0, "90093002", "2025-08-01", "100").build(),
            billableRow(1, "90093002", "2025-08-01", "100").with(BillingColumns.UNITS_COMPLETED, false).build(),
            billableRow(2, "90093002", "2025-08-01", "0").build(),
            billableRow(3, "90093002", "2025-08-01", "100").with(BillingColumns.CU, "#NO MATCH").build(),
            billableRow(4, "", "2025-08-01", "100").build(),
            billableRow(5, "90093002", "soon", "100").build(),
            billableRow(6, "12345678.0", "2025-08-01", "100").build());

        PipelineReport report = new BillingPipeline(config, ExemptionList.of(List.of("12345678")), history,
            renderer::exists, renderer, baseline, CLOCK).run(rows);

        assertThat(report.rowsRead()).isEqualTo(7);
        assertThat(report.rowsAccepted()).isEqualTo(2);
        assertThat(report.rowsRejected()).isEqualTo(5);
        assertThat(report.rejectedByReason()).containsOnly(
            Map.entry(RejectReason.NOT_COMPLETED, 1),
            Map.entry(RejectReason.NON_POSITIVE_PRICE, 1),
            Map.entry(RejectReason.PLACEHOLDER_CU, 1),
            Map.entry(RejectReason.MISSING_WORK_REQUEST, 1),
            Map.entry(RejectReason.MISSING_OR_INVALID_DATE, 1));
        assertThat(report.exemptedRows()).isEqualTo(1);
        assertThat(report.outcomes()).singleElement()
            .satisfies(outcome -> assertThat(outcome.key()).isEqualTo(FIRST_WEEK));
    }

    @Test
    void absurdPriceCellIsRejectedWithoutAbortingTheRun() {
        List<RawRow> rows = List.of(
            billableRow(0, "90093002", "2025-08-01", "100.00").build(),
            billableRow(1, "90093002", "2025-08-01", "1E+999999999").build(),
            billableRow(2, "90093002", "2025-08-01", "100.00").with(BillingColumns.QUANTITY, "1E+999999999").build());

        PipelineReport report = pipeline(config).run(rows);

        assertThat(report.rowsAccepted()).isEqualTo(2);
        assertThat(report.rejected(RejectReason.NON_POSITIVE_PRICE)).isEqualTo(1);
        assertThat(report.outcome(FIRST_WEEK)).hasValueSatisfying(outcome ->
            assertThat(outcome.status()).isEqualTo(PacketStatus.GENERATED));
    }

    @Test
    void auditSeesOnlyValidatedRows() {
        List<RawRow> rows = List.of(
            billableRow(0, "90093002", "2025-08-01", "100").build(),
            billableRow(1, "90093002", "2025-08-01", "100").with(BillingColumns.QUANTITY, "0").build(),
            billableRow(2, "90093002", "2025-08-01", "($40.00)").build(),
            billableRow(3, "", "2025-08-01", "100").build());

        PipelineReport report = pipeline(config).run(rows);

        assertThat(report.audit().rowsAudited()).isEqualTo(2);
        assertThat(report.audit().count(AnomalyKind.ZERO_QUANTITY)).isEqualTo(1);
        assertThat(report.audit().count(AnomalyKind.NEGATIVE_PRICE)).isZero();
        assertThat(report.audit().count(AnomalyKind.MISSING_WORK_REQUEST)).isZero();
        assertThat(report.rejected(RejectReason.NON_POSITIVE_PRICE)).isEqualTo(1);
        assertThat(report.rejected(RejectReason.MISSING_WORK_REQUEST)).isEqualTo(1);
    }

    @Test
    void auditTrendComparesWithPreviousRun() {
        pipeline(config).run(List.of(
            billableRow(0, "1", "2025-08-01", "100").build(),
            billableRow(1, "1", "2025-08-01", "400").build()));

        PipelineReport second = pipeline(config).run(rows());

        assertThat(second.audit().trend().previousAnomalyCount()).isEqualTo(2);
        assertThat(second.audit().anomalyCount()).isEqualTo(2);
        assertThat(second.audit().trend().direction()).isEqualTo(RiskDirection.STABLE);
    }

    @Test
    void failedBaselineSaveIsSurfacedWithoutUndoingPackets() {
        AuditBaselineStore failing = mock(AuditBaselineStore.class);
        when(failing.loadPrevious()).thenReturn(java.util.Optional.empty());
        org.mockito.Mockito.doThrow(new AuditStateException("read-only")).when(failing).save(any());

        PipelineReport report = new BillingPipeline(config, ExemptionList.empty(), history, renderer::exists,
            renderer, failing, CLOCK).run(rows());

        assertThat(report.baselineSaved()).isFalse();
        assertThat(report.hasFailures()).isTrue();
        assertThat(report.count(PacketStatus.GENERATED)).isEqualTo(3);
        assertThat(history.loadAll()).hasSize(3);
    }

    @Test
    void outcomesDoNotDependOnWorkerCount() {
        PipelineReport single = pipeline(config.toBuilder().workerThreads(1).build()).run(rows());
        history.resetAll();

        PipelineReport parallel = pipeline(config.toBuilder().workerThreads(8).build()).run(rows());

        assertThat(parallel.outcomes()).extracting(PacketOutcome::key, PacketOutcome::fingerprint)
            .containsExactlyElementsOf(single.outcomes().stream()
                .map(outcome -> org.assertj.core.groups.Tuple.tuple(outcome.key(), outcome.fingerprint()))
                .toList());
    }

    private BillingPipeline pipeline(PipelineConfig pipelineConfig) {
        return new BillingPipeline(pipelineConfig, ExemptionList.empty(), history, renderer::exists, renderer,
            baseline, CLOCK);
    }

    /**
     * Two weeks of one work request plus one other packet; the first week carries the
     * 1200/2160/360 price spread.
     */
    private static List<RawRow> rows() {
        return List.of(
            billableRow(0, "90093002", "2025-08-01", "$1,200.00").build(),
            billableRow(1, "90093002", "2025-08-03", "2160").build(),
            billableRow(2, "90093002", "2025-08-05", "360").build(),
            billableRow(3, "88880001", "2025-08-02", "75.50").build());
    }

    private static final class RecordingRenderer implements PacketRenderer {

        private final Map<String, String> rendered = new ConcurrentHashMap<>();
        private final Set<String> existing = ConcurrentHashMap.newKeySet();
        private final AtomicInteger sequence = new AtomicInteger();
        private volatile String failFor;

        @Override
        public RenderedArtifact render(Packet packet, Fingerprint fingerprint) {
            if (packet.key().id().equals(failFor)) {
                throw new PacketRenderingException("disk full");
            }
            String reference = packet.key().id() + "-" + fingerprint.value() + "-" + sequence.incrementAndGet();
            rendered.put(packet.key().id(), reference);
            existing.add(reference);
            return new RenderedArtifact(reference);
        }

        boolean exists(String reference) {
            return existing.contains(reference);
        }
    }
}
