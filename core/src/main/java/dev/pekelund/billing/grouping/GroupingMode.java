package dev.pekelund.billing.grouping;

/**
 * Controls whether helper-crew work is split into its own packets.
 */
public enum GroupingMode {

    /**
     * Every row stays in its primary packet; no helper packets are produced.
     */
    PRIMARY,

    /**
     * Rows with complete helper details go only to their helper packet, everything else to the
     * primary packet, so no work is billed twice.
     */
    BOTH
}
