package com.example.automation.service.trigger;

import com.example.automation.config.SchedulerProperties;
import com.example.automation.domain.entity.RecurringSchedulePattern;
import com.example.automation.domain.entity.ScheduledTask;
import com.example.automation.domain.enums.PatternType;
import com.example.automation.exception.ConfigurationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Computes fire instants for scheduled tasks.
 * <p>
 * All methods are free of side effects and read nothing but their arguments; callers
 * supply the task's patterns. Results are truncated to milliseconds so that they
 * compare equal after a round trip through the store, which the claim update relies on.
 */
@Component
@RequiredArgsConstructor
public class TriggerEvaluator {

    /**
     * Guard against cron expressions whose every match falls on an exception date
     */
    private static final int MAX_EXCEPTION_SKIPS = 1000;

    private final SchedulerProperties properties;

    /**
     * Earliest fire instant strictly after {@code after}, or null when the task can never fire again.
     *
     * @throws ConfigurationException if the trigger definition cannot be evaluated
     */
    public Instant computeNext(ScheduledTask task, List<RecurringSchedulePattern> patterns, Instant after) {
        if (task.isExhausted()) {
            return null;
        }

        return switch (task.getTriggerType()) {
            case CRON -> nextCalendarInstant(task, patterns, after);
            case INTERVAL -> truncate(after.plusSeconds(requireInterval(task)));
            case ONCE -> {
                var at = requireScheduledTime(task);
                yield at.isAfter(after) ? truncate(at) : null;
            }
            case EVENT -> null;
        };
    }

    /**
     * First next_execution for a newly created or reactivated task.
     */
    public Instant computeInitial(ScheduledTask task, List<RecurringSchedulePattern> patterns, Instant now) {
        if (task.isExhausted()) {
            return null;
        }

        return switch (task.getTriggerType()) {
            case INTERVAL -> {
                var interval = requireInterval(task);
                yield task.getScheduledTime() != null
                        ? truncate(task.getScheduledTime())
                        : truncate(now.plusSeconds(interval));
            }
            case CRON, ONCE, EVENT -> computeNext(task, patterns, now);
        };
    }

    /**
     * Successor of a claimed instant, used while leasing that instant.
     * <p>
     * Interval tasks stay aligned to their original schedule: the successor is
     * {@code fired + interval}. When the worker is late by more than one interval the
     * missed slots are coalesced into the one being fired and the successor is the
     * first aligned slot after {@code now}. Calendar triggers simply continue after
     * whichever of {@code fired} and {@code now} is later.
     *
     * @param fired the next_execution value being claimed
     */
    public Instant computeNextAfterFire(ScheduledTask task, List<RecurringSchedulePattern> patterns, Instant fired, Instant now) {
        if (task.getMaxExecutions() != null && task.getExecutionCount() + 1 >= task.getMaxExecutions()) {
            return null;
        }

        return switch (task.getTriggerType()) {
            case INTERVAL -> {
                var interval = requireInterval(task);
                var next = fired.plusSeconds(interval);
                if (!next.isAfter(now)) {
                    var behindSeconds = Duration.between(fired, now).getSeconds();
                    var slots = behindSeconds / interval + 1;
                    next = fired.plusSeconds(slots * interval);
                }
                yield truncate(next);
            }
            case CRON -> nextCalendarInstant(task, patterns, fired.isAfter(now) ? fired : now);
            case ONCE, EVENT -> null;
        };
    }

    /**
     * Check that a task definition can be evaluated, throwing a ConfigurationException describing the first problem.
     */
    public void validate(ScheduledTask task, List<RecurringSchedulePattern> patterns) {
        if (task.getTriggerType() == null) {
            throw new ConfigurationException("Trigger type is required");
        }
        zone(task.getTimezone());
        parseDates(task.getExceptionDates());

        switch (task.getTriggerType()) {
            case CRON -> {
                var hasCron = task.getCronExpression() != null && !task.getCronExpression().isBlank();
                var activePatterns = activePatterns(patterns);
                if (!hasCron && activePatterns.isEmpty()) {
                    throw new ConfigurationException("A cron task needs a cron expression or at least one recurring pattern");
                }
                if (hasCron) {
                    CronExpressions.normalize(task.getCronExpression());
                }
                activePatterns.forEach(this::validatePattern);
            }
            case INTERVAL -> requireInterval(task);
            case ONCE -> requireScheduledTime(task);
            case EVENT -> {
                if (task.getEventTrigger() == null || task.getEventTrigger().isBlank()) {
                    throw new ConfigurationException("An event task needs an event name");
                }
            }
        }
    }

    public void validatePattern(RecurringSchedulePattern pattern) {
        if (pattern.getPatternType() == null) {
            throw new ConfigurationException("Pattern type is required");
        }
        zone(pattern.getTimezone());
        parseDates(pattern.getExceptionDates());
        if (parseSlots(pattern).isEmpty()) {
            throw new ConfigurationException("A recurring pattern needs at least one time slot");
        }
        checkRange("days_of_week", pattern.getDaysOfWeek(), 1, 7);
        checkRange("days_of_month", pattern.getDaysOfMonth(), 1, 31);
        checkRange("months", pattern.getMonths(), 1, 12);

        switch (pattern.getPatternType()) {
            case WEEKLY -> requireMask("days_of_week", pattern.getDaysOfWeek(), PatternType.WEEKLY);
            case MONTHLY -> requireMask("days_of_month", pattern.getDaysOfMonth(), PatternType.MONTHLY);
            case YEARLY -> {
                requireMask("months", pattern.getMonths(), PatternType.YEARLY);
                requireMask("days_of_month", pattern.getDaysOfMonth(), PatternType.YEARLY);
            }
            case DAILY, CUSTOM -> {
            }
        }
    }

    // === Calendar triggers ===

    private Instant nextCalendarInstant(ScheduledTask task, List<RecurringSchedulePattern> patterns, Instant after) {
        var taskZone = zone(task.getTimezone());
        var taskExceptions = parseDates(task.getExceptionDates());

        Instant best = null;
        if (task.getCronExpression() != null && !task.getCronExpression().isBlank()) {
            best = nextCronInstant(task.getCronExpression(), taskZone, taskExceptions, after);
        }
        for (var pattern : activePatterns(patterns)) {
            best = earliest(best, nextPatternInstant(pattern, taskZone, taskExceptions, after));
        }
        return best != null ? truncate(best) : null;
    }

    /**
     * The cron expression is matched against local wall-clock times and each match is then
     * placed in the zone. A match inside a DST gap moves forward by the gap length instead of
     * being dropped; a match inside an overlap keeps the offset in effect at {@code after}.
     */
    private Instant nextCronInstant(String expression, ZoneId zone, Set<LocalDate> exceptions, Instant after) {
        var cron = CronExpressions.parse(expression);
        var offset = after.atZone(zone).getOffset();
        var local = cron.next(LocalDateTime.ofInstant(after, zone));
        var skips = 0;
        while (local != null) {
            var candidate = ZonedDateTime.ofLocal(local, zone, offset).toInstant();
            if (candidate.isAfter(after) && !exceptions.contains(local.toLocalDate())) {
                return candidate;
            }
            if (++skips > MAX_EXCEPTION_SKIPS) {
                return null;
            }
            local = cron.next(local);
        }
        return null;
    }

    private Instant nextPatternInstant(RecurringSchedulePattern pattern, ZoneId taskZone, Set<LocalDate> taskExceptions, Instant after) {
        var zone = zone(pattern.getTimezone());
        var patternExceptions = parseDates(pattern.getExceptionDates());
        var slots = parseSlots(pattern);
        if (slots.isEmpty()) {
            throw new ConfigurationException("Recurring pattern " + pattern.getId() + " has no time slots");
        }

        var startDate = after.atZone(zone).toLocalDate();
        for (var day = 0; day <= properties.getPatternHorizonDays(); day++) {
            var date = startDate.plusDays(day);
            if (!matches(pattern, date) || patternExceptions.contains(date)) {
                continue;
            }
            for (var slot : slots) {
                // ZonedDateTime.of moves a wall time inside a DST gap forward by the gap length
                var candidate = ZonedDateTime.of(date, slot, zone).toInstant();
                if (candidate.isAfter(after) && !taskExceptions.contains(candidate.atZone(taskZone).toLocalDate())) {
                    return candidate;
                }
            }
        }
        return null;
    }

    static boolean matches(RecurringSchedulePattern pattern, LocalDate date) {
        var dayOfWeek = date.getDayOfWeek().getValue();
        var dayOfMonth = date.getDayOfMonth();
        var month = date.getMonthValue();

        return switch (pattern.getPatternType()) {
            case DAILY -> true;
            case WEEKLY -> contains(pattern.getDaysOfWeek(), dayOfWeek);
            case MONTHLY -> contains(pattern.getDaysOfMonth(), dayOfMonth);
            case YEARLY -> contains(pattern.getMonths(), month) && contains(pattern.getDaysOfMonth(), dayOfMonth);
            case CUSTOM -> maskAllows(pattern.getDaysOfWeek(), dayOfWeek)
                    && maskAllows(pattern.getDaysOfMonth(), dayOfMonth)
                    && maskAllows(pattern.getMonths(), month);
        };
    }

    // === Helpers ===

    private static boolean contains(List<Integer> mask, int value) {
        return mask != null && mask.contains(value);
    }

    private static boolean maskAllows(List<Integer> mask, int value) {
        return mask == null || mask.isEmpty() || mask.contains(value);
    }

    private static List<RecurringSchedulePattern> activePatterns(List<RecurringSchedulePattern> patterns) {
        if (patterns == null) {
            return List.of();
        }
        return patterns.stream().filter(Objects::nonNull).filter(RecurringSchedulePattern::isActive).toList();
    }

    private static Instant earliest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isBefore(b) ? a : b;
    }

    private static long requireInterval(ScheduledTask task) {
        if (task.getIntervalSeconds() == null || task.getIntervalSeconds() <= 0) {
            throw new ConfigurationException("An interval task needs a positive interval_seconds");
        }
        return task.getIntervalSeconds();
    }

    private static Instant requireScheduledTime(ScheduledTask task) {
        if (task.getScheduledTime() == null) {
            throw new ConfigurationException("A one-time task needs a scheduled time");
        }
        return task.getScheduledTime();
    }

    private static ZoneId zone(String timezone) {
        try {
            return ZoneId.of(timezone != null ? timezone : "UTC");
        } catch (DateTimeException e) {
            throw new ConfigurationException("Unknown timezone: " + timezone, e);
        }
    }

    private static Set<LocalDate> parseDates(Collection<String> dates) {
        var result = new HashSet<LocalDate>();
        if (dates == null) {
            return result;
        }
        for (var date : dates) {
            try {
                result.add(LocalDate.parse(date.trim()));
            } catch (DateTimeParseException | NullPointerException e) {
                throw new ConfigurationException("Invalid exception date '" + date + "', expected yyyy-MM-dd", e);
            }
        }
        return result;
    }

    private static List<LocalTime> parseSlots(RecurringSchedulePattern pattern) {
        if (pattern.getTimeSlots() == null) {
            return List.of();
        }
        try {
            return pattern.getTimeSlots().stream()
                    .map(String::trim)
                    .map(LocalTime::parse)
                    .distinct()
                    .sorted()
                    .toList();
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Invalid time slot in pattern, expected HH:mm: " + e.getParsedString(), e);
        }
    }

    private static void checkRange(String field, List<Integer> values, int min, int max) {
        if (values == null) {
            return;
        }
        for (var value : values) {
            if (value == null || value < min || value > max) {
                throw new ConfigurationException(String.format("%s values must be between %d and %d, got %s", field, min, max, value));
            }
        }
    }

    private static void requireMask(String field, List<Integer> values, PatternType type) {
        if (values == null || values.isEmpty()) {
            throw new ConfigurationException(type + " patterns need " + field);
        }
    }

    private static Instant truncate(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MILLIS);
    }
}
