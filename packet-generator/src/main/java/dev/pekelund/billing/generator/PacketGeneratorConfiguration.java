package dev.pekelund.billing.generator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import dev.pekelund.billing.audit.AuditBaselineStore;
import dev.pekelund.billing.audit.JsonFileAuditBaselineStore;
import dev.pekelund.billing.decision.ArtifactLocator;
import dev.pekelund.billing.generator.render.FileArtifactLocator;
import dev.pekelund.billing.generator.render.JsonManifestRenderer;
import dev.pekelund.billing.generator.source.JsonRowSource;
import dev.pekelund.billing.history.GcsHistoryStore;
import dev.pekelund.billing.history.HistoryStore;
import dev.pekelund.billing.history.JsonFileHistoryStore;
import dev.pekelund.billing.pipeline.BillingPipeline;
import dev.pekelund.billing.pipeline.PacketRenderer;
import dev.pekelund.billing.validation.ExemptionList;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Wires the billing pipeline for a single batch run from {@link PacketGeneratorSettings}.
 */
@Configuration
public class PacketGeneratorConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(PacketGeneratorConfiguration.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        return mapper;
    }

    @Bean
    public PacketGeneratorSettings packetGeneratorSettings() {
        PacketGeneratorSettings settings = PacketGeneratorSettings.fromEnvironment();
        LOGGER.info("Packet generator settings - input: {}, output: {}, history: {} ({}), pipeline: {}",
            settings.inputPath(), settings.outputDirectory(), settings.historyBackend(),
            settings.historyBackend() == HistoryBackend.GCS ? "gs://" + settings.historyBucket()
                : settings.historyPath(),
            settings.pipeline());
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Lazy
    public Storage storage() {
        return StorageOptions.getDefaultInstance().getService();
    }

    @Bean
    public HistoryStore historyStore(PacketGeneratorSettings settings, ObjectProvider<Storage> storage,
        ObjectMapper objectMapper) {

        if (settings.historyBackend() == HistoryBackend.GCS) {
            return new GcsHistoryStore(storage.getObject(), settings.historyBucket(), objectMapper);
        }
        return new JsonFileHistoryStore(settings.historyPath(), objectMapper);
    }

    @Bean
    public AuditBaselineStore auditBaselineStore(PacketGeneratorSettings settings, ObjectMapper objectMapper) {
        return new JsonFileAuditBaselineStore(settings.auditStatePath(), objectMapper);
    }

    @Bean
    public ExemptionList exemptionList(PacketGeneratorSettings settings, ObjectMapper objectMapper) {
        return ExemptionList.load(settings.exemptionListPath(), objectMapper);
    }

    @Bean
    public ArtifactLocator artifactLocator(PacketGeneratorSettings settings) {
        return new FileArtifactLocator(settings.outputDirectory());
    }

    @Bean
    public PacketRenderer packetRenderer(PacketGeneratorSettings settings, ObjectMapper objectMapper, Clock clock) {
        return new JsonManifestRenderer(settings.outputDirectory(), objectMapper, clock);
    }

    @Bean
    public JsonRowSource jsonRowSource(ObjectMapper objectMapper) {
        return new JsonRowSource(objectMapper);
    }

    @Bean
    public BillingPipeline billingPipeline(PacketGeneratorSettings settings, ExemptionList exemptionList,
        HistoryStore historyStore, ArtifactLocator artifactLocator, PacketRenderer packetRenderer,
        AuditBaselineStore auditBaselineStore, Clock clock) {

        return new BillingPipeline(settings.pipeline(), exemptionList, historyStore, artifactLocator,
            packetRenderer, auditBaselineStore, clock);
    }

    @Bean
    public PacketGenerationRunner packetGenerationRunner(PacketGeneratorSettings settings, JsonRowSource rowSource,
        BillingPipeline billingPipeline, HistoryStore historyStore) {

        return new PacketGenerationRunner(settings, rowSource, billingPipeline, historyStore);
    }
}
