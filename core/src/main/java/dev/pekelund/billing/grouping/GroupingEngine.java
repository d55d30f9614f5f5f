package dev.pekelund.billing.grouping;

import dev.pekelund.billing.rows.CanonicalRow;
import dev.pekelund.billing.validation.ExemptionList;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Partitions validated rows into primary and helper packets keyed by work request and week.
 * Each row's own logged date decides its week, so a work request spanning two weeks always yields
 * two packets.
 */
public class GroupingEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(GroupingEngine.class);

    private final DayOfWeek weekEndingWeekday;
    private final GroupingMode mode;
    private final ExemptionList exemptions;

    public GroupingEngine(DayOfWeek weekEndingWeekday, GroupingMode mode, ExemptionList exemptions) {
        this.weekEndingWeekday = Objects.requireNonNull(weekEndingWeekday, "weekEndingWeekday");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.exemptions = exemptions != null ? exemptions : ExemptionList.empty();
    }

    /**
     * Groups rows that already passed validation. Rows must be supplied in arrival order; that
     * order is kept inside every packet.
     */
    public GroupingResult group(List<CanonicalRow> rows) {
        Map<PacketKey, List<CanonicalRow>> groups = new LinkedHashMap<>();
        List<HelperFallbackWarning> warnings = new ArrayList<>();
        int exempted = 0;

        for (CanonicalRow row : rows) {
            if (exemptions.contains(row.workRequest())) {
                exempted++;
                continue;
            }
            LocalDate weekEnding = WeekEnding.of(row.loggedDate(), weekEndingWeekday);
            PacketKey primaryKey = PacketKey.primary(row.workRequest(), weekEnding);
            PacketKey target = primaryKey;

            if (mode == GroupingMode.BOTH && row.isHelperCandidate()) {
                if (row.hasHelperBillingIds()) {
                    target = PacketKey.helper(row.workRequest(), weekEnding, row.helperForeman());
                } else {
                    HelperFallbackWarning warning = new HelperFallbackWarning(row.arrivalIndex(), primaryKey,
                        row.helperForeman().trim(), !StringUtils.hasText(row.helperDepartment()),
                        !StringUtils.hasText(row.helperJob()));
                    LOGGER.warn(warning.message());
                    warnings.add(warning);
                }
            }

            groups.computeIfAbsent(target, key -> new ArrayList<>()).add(row);
        }

        List<Packet> packets = new ArrayList<>(groups.size());
        for (Map.Entry<PacketKey, List<CanonicalRow>> entry : groups.entrySet()) {
            packets.add(new Packet(entry.getKey(), entry.getValue()));
        }

        if (exempted > 0) {
            LOGGER.info("Skipped {} rows belonging to exempted work requests", exempted);
        }
        LOGGER.info("Grouped {} rows into {} packets ({} helper fallbacks)", rows.size() - exempted, packets.size(),
            warnings.size());
        return new GroupingResult(packets, warnings, exempted);
    }
}
