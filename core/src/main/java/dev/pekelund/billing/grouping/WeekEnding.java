package dev.pekelund.billing.grouping;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

final class WeekEnding {

    private WeekEnding() {
    }

    /**
     * Rolls a logged date forward to the week-ending weekday; a date already on that weekday ends
     * its own week.
     */
    static LocalDate of(LocalDate loggedDate, DayOfWeek weekEndingWeekday) {
        return loggedDate.with(TemporalAdjusters.nextOrSame(weekEndingWeekday));
    }
}
