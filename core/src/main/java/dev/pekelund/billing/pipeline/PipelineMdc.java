package dev.pekelund.billing.pipeline;

import dev.pekelund.billing.grouping.PacketKey;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Populates MDC entries so every log line of a billing run carries the run id, the stage and,
 * inside packet processing, the packet id.
 */
public final class PipelineMdc {

    static final String KEY_RUN_ID = "billing.runId";
    static final String KEY_PACKET = "billing.packet";
    static final String KEY_STAGE = "billing.stage";

    private PipelineMdc() {
        // Utility class
    }

    public static Context open(String runId) {
        Context context = new Context(MDC.getCopyOfContextMap());
        putIfHasText(KEY_RUN_ID, runId);
        return context;
    }

    /**
     * Copies a captured context onto a worker thread for the duration of one task.
     */
    static Context inherit(Map<String, String> captured) {
        Context context = new Context(MDC.getCopyOfContextMap());
        if (captured != null) {
            MDC.setContextMap(captured);
        }
        return context;
    }

    public static String currentRunId() {
        return MDC.get(KEY_RUN_ID);
    }

    public static void setStage(String stage) {
        putIfHasText(KEY_STAGE, stage);
    }

    static void attachPacket(PacketKey key) {
        putIfHasText(KEY_PACKET, key != null ? key.id() : null);
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    public static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(Map<String, String> previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
