package io.forecast4j.utils;

import io.forecast4j.core.ValidationException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Date;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.TimeZone;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cron helpers for job schedules.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>5-field Unix cron: "minute hour day-of-month month day-of-week" (day-of-week 0-7, 0 and 7 are Sunday)</li>
 *   <li>6-field cron with a leading seconds field, in Quartz syntax (day-of-week 1-7, 1 is Sunday)</li>
 *   <li>7-field Quartz cron with a trailing year field, passed through unchanged</li>
 * </ul>
 * <p>
 * Every computation is done in the job's own time zone, so DST gaps and overlaps follow that zone.
 */
public final class CronSchedules {
    private static final Pattern NUMBER = Pattern.compile("\\d+");
    private static final Pattern SINGLE_DAY = Pattern.compile("(\\d+)(L|#\\d+)?");
    private static final Pattern DAY_RANGE = Pattern.compile("(\\*|(\\d+)(?:-(\\d+))?)(?:/(\\d+))?");
    // Quartz resolves to whole seconds, so a range this short holds at most this many fire times
    private static final long SCAN_STEP_SECONDS = 60;

    private CronSchedules() {
    }

    /**
     * First fire time strictly after {@code after}.
     *
     * @param cron     cron expression in any supported format
     * @param timezone IANA time zone id (e.g. "Europe/Paris"); null means UTC
     * @param after    exclusive lower bound
     * @return next fire time, or {@code null} if the expression never fires again
     * @throws ValidationException if the expression or time zone is malformed
     */
    public static Instant nextFireTime(String cron, String timezone, Instant after) {
        if (after == null) {
            throw new IllegalArgumentException("after must not be null");
        }
        CronExpression exp = parse(cron, timezone);
        Date next = exp.getNextValidTimeAfter(Date.from(after));
        return next == null ? null : next.toInstant();
    }

    /**
     * Fire times in {@code (after, now]}, oldest first, keeping at most the {@code limit} most recent ones.
     * <p>
     * The range is searched from {@code now} backwards by halving it, so a long gap costs about
     * {@code limit * log(gap)} evaluations rather than one per elapsed fire time.
     */
    public static List<Instant> firesBetween(String cron, String timezone, Instant after, Instant now, int limit) {
        if (after == null || now == null) {
            throw new IllegalArgumentException("after and now must not be null");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        CronExpression exp = parse(cron, timezone);
        if (!after.isBefore(now)) {
            return List.of();
        }

        Deque<Instant> window = new ArrayDeque<>(Math.min(limit, 64));
        collectLatest(exp, after, now, limit, window);
        return new ArrayList<>(window);
    }

    /**
     * Admission check for a job schedule.
     *
     * @throws ValidationException naming the offending field
     */
    public static void validate(String cron, String timezone) {
        CronExpression exp = parse(cron, timezone);
        if (exp.getNextValidTimeAfter(new Date()) == null) {
            throw new ValidationException("cron", "Cron expression never fires in the future: " + cron);
        }
    }

    /**
     * Returns true if the string can be parsed as a cron expression.
     */
    public static boolean isValid(String cron) {
        try {
            return CronExpression.isValidExpression(normalize(cron));
        } catch (ValidationException ignored) {
            return false;
        }
    }

    /**
     * Resolve an IANA time zone id; null or blank means UTC.
     *
     * @throws ValidationException if the id is unknown
     */
    public static ZoneId zone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.of("UTC");
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new ValidationException("timezone", "Invalid timezone: " + timezone, e);
        }
    }

    /**
     * Normalize cron expressions to Quartz syntax:
     * - 5-field Unix cron gets a "0" seconds field and its day-of-week numbers shifted to Quartz numbering.
     * - 6-field and 7-field expressions are taken as Quartz syntax.
     * - Exactly one of day-of-month and day-of-week becomes "?", as Quartz requires.
     */
    public static String normalize(String cron) {
        if (cron == null) {
            throw new ValidationException("cron", "cron must not be null");
        }
        String s = cron.trim();
        if (s.isEmpty()) {
            throw new ValidationException("cron", "cron must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], unixDayOfWeek(parts[4]), null);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5], null);
        }
        if (parts.length == 7) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5], parts[6]);
        }
        throw new ValidationException("cron", "Expected 5, 6 or 7 cron fields but got " + parts.length + ": " + cron);
    }

    // Prepends up to limit of the latest fire times in (after, until] to out, keeping ascending order.
    private static int collectLatest(CronExpression exp, Instant after, Instant until, int limit, Deque<Instant> out) {
        Date first = exp.getNextValidTimeAfter(Date.from(after));
        if (first == null || first.toInstant().isAfter(until)) {
            return 0;
        }

        Duration span = Duration.between(after, until);
        if (span.getSeconds() <= SCAN_STEP_SECONDS) {
            List<Instant> found = new ArrayList<>();
            Date cursor = first;
            while (cursor != null && !cursor.toInstant().isAfter(until)) {
                found.add(cursor.toInstant());
                cursor = exp.getNextValidTimeAfter(cursor);
            }
            int from = Math.max(0, found.size() - limit);
            for (int i = found.size() - 1; i >= from; i--) {
                out.addFirst(found.get(i));
            }
            return found.size() - from;
        }

        Instant mid = after.plus(span.dividedBy(2));
        int added = collectLatest(exp, mid, until, limit, out);
        if (added < limit) {
            added += collectLatest(exp, after, mid, limit - added, out);
        }
        return added;
    }

    private static CronExpression parse(String cron, String timezone) {
        ZoneId zone = zone(timezone);
        String quartz = normalize(cron);
        try {
            CronExpression exp = new CronExpression(quartz);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException ex) {
            throw new ValidationException("cron", "Invalid cron expression: " + cron + " (" + ex.getMessage() + ")", ex);
        }
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month,
                                       String dayOfWeek, String year) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        boolean quartzStyle = "?".equals(dom) || "?".equals(dow);
        if (!quartzStyle) {
            if ("*".equals(dow)) {
                dow = "?";
            } else if ("*".equals(dom)) {
                dom = "?";
            } else {
                throw new ValidationException("cron",
                        "Restricting both day-of-month and day-of-week is not supported: " + dayOfMonth + " " + dayOfWeek);
            }
        }

        String quartz = String.join(" ", sec, min, hour, dom, month, dow);
        return year == null ? quartz : quartz + " " + year;
    }

    // Unix cron counts Sunday as 0 or 7, Quartz as 1. Numeric ranges and steps are expanded to explicit days
    // so that a range ending at 7 keeps Saturday and Sunday.
    private static String unixDayOfWeek(String field) {
        if ("*".equals(field) || "?".equals(field)) {
            return field;
        }
        String[] tokens = field.split(",");
        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i];
            Matcher single = SINGLE_DAY.matcher(token);
            Matcher range = DAY_RANGE.matcher(token);
            if (single.matches()) {
                tokens[i] = quartzDay(Integer.parseInt(single.group(1))) + nullToEmpty(single.group(2));
            } else if (range.matches()) {
                tokens[i] = expandDays(token, range);
            } else {
                tokens[i] = shiftNumbers(token);
            }
        }
        return String.join(",", tokens);
    }

    private static String expandDays(String token, Matcher range) {
        int from;
        int to;
        if ("*".equals(range.group(1))) {
            from = 0;
            to = 6;
        } else {
            from = Integer.parseInt(range.group(2));
            to = range.group(3) != null ? Integer.parseInt(range.group(3)) : (range.group(4) != null ? 6 : from);
        }
        int step = range.group(4) != null ? Integer.parseInt(range.group(4)) : 1;
        if (from > 7 || to > 7) {
            throw new ValidationException("cron", "Day-of-week out of range: " + token);
        }
        if (from > to || step <= 0) {
            throw new ValidationException("cron", "Invalid day-of-week range: " + token);
        }

        Set<Integer> days = new TreeSet<>();
        for (int d = from; d <= to; d += step) {
            days.add(Integer.parseInt(quartzDay(d)));
        }
        StringBuilder sb = new StringBuilder();
        for (Integer d : days) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(d);
        }
        return sb.toString();
    }

    // named days with numeric parts, e.g. "MON-5"
    private static String shiftNumbers(String token) {
        Matcher m = NUMBER.matcher(token);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, quartzDay(Integer.parseInt(m.group())));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String quartzDay(int unix) {
        if (unix > 7) {
            throw new ValidationException("cron", "Day-of-week out of range: " + unix);
        }
        return Integer.toString(unix % 7 + 1);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
