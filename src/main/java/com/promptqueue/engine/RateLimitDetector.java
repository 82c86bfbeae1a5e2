package com.promptqueue.engine;

import com.promptqueue.core.RateLimitInfo;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether an agent run was throttled and when the quota is likely to be back.
 *
 * <p><b>Detection:</b> a case-insensitive search for any of a fixed list of throttling
 * phrases. Generic words such as "limit" alone never match, so ordinary output that
 * talks about limits is not mistaken for throttling.</p>
 *
 * <p>Output of a successful run is held to a stricter rule, see
 * {@link #classifyCompletedOutput(String, LocalDateTime)}.</p>
 *
 * <p><b>Reset estimation:</b></p>
 * <ol>
 *   <li>An explicit time in the throttling line wins when it lies in the future:
 *       a {@code |<epoch-seconds>} suffix, an ISO-8601 date-time, or
 *       "resets at 3pm" / "reset at 15:30".</li>
 *   <li>Otherwise the next anchor hour strictly after now: 05:00, 10:00, 15:00 or 20:00,
 *       rolling to 05:00 the next day after 20:00.</li>
 * </ol>
 *
 * <p>The estimate is advisory. The scheduler retries optimistically once it has passed.</p>
 */
public class RateLimitDetector {
    private static final Logger logger = Logger.getLogger(RateLimitDetector.class.getName());

    public static final List<String> DEFAULT_PATTERNS = List.of(
            "usage limit reached",
            "rate limit exceeded",
            "rate limit reached",
            "rate_limit_error",
            "too many requests",
            "quota exceeded",
            "limit will reset at");

    /** Hours of the day at which the quota is assumed to reset. */
    public static final int[] ANCHOR_HOURS = {5, 10, 15, 20};

    static final int MAX_NOTICE_LINES = 3;
    static final int MAX_NOTICE_PREFIX = 24;

    private static final Pattern EPOCH_SUFFIX = Pattern.compile("\\|(\\d{10})\\b");
    private static final Pattern ISO_DATE_TIME = Pattern.compile(
            "(\\d{4}-\\d{2}-\\d{2})[T ](\\d{2}:\\d{2}(?::\\d{2})?)(Z|[+-]\\d{2}:?\\d{2})?");
    private static final Pattern CLOCK_TIME = Pattern.compile(
            "resets? at (\\d{1,2})(?::(\\d{2}))?\\s*([ap]\\.?m\\.?)?", Pattern.CASE_INSENSITIVE);

    private final List<String> patterns;
    private final Clock clock;

    public RateLimitDetector() {
        this(DEFAULT_PATTERNS, Clock.systemDefaultZone());
    }

    public RateLimitDetector(Clock clock) {
        this(DEFAULT_PATTERNS, clock);
    }

    /**
     * @param patterns throttling phrases, matched case-insensitively
     * @param clock source of "now" and of the local time zone
     */
    public RateLimitDetector(List<String> patterns, Clock clock) {
        List<String> normalized = new ArrayList<>();
        for (String pattern : patterns) {
            String p = pattern.strip().toLowerCase(Locale.ROOT);
            if (!p.isEmpty() && !normalized.contains(p)) {
                normalized.add(p);
            }
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("At least one throttling phrase is required");
        }
        this.patterns = Collections.unmodifiableList(normalized);
        this.clock = clock;
    }

    /**
     * Return a detector that also recognises {@code extra} phrases.
     */
    public RateLimitDetector withExtraPatterns(List<String> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        List<String> combined = new ArrayList<>(patterns);
        combined.addAll(extra);
        return new RateLimitDetector(combined, clock);
    }

    public List<String> getPatterns() {
        return patterns;
    }

    /**
     * Classify agent output at the current time of this detector's clock.
     */
    public RateLimitInfo classify(String rawOutput) {
        return classify(rawOutput, LocalDateTime.now(clock));
    }

    /**
     * Classify agent output.
     *
     * @param rawOutput combined stdout and stderr of one run; may be null
     * @param now the time of detection
     * @return a detected info carrying the matched line and the estimated reset time,
     *         or {@link RateLimitInfo#notLimited()}
     */
    public RateLimitInfo classify(String rawOutput, LocalDateTime now) {
        if (rawOutput == null || rawOutput.isBlank()) {
            return RateLimitInfo.notLimited();
        }
        for (String line : rawOutput.split("\\R")) {
            Optional<RateLimitInfo> info = match(line, Integer.MAX_VALUE, now);
            if (info.isPresent()) {
                return info.get();
            }
        }
        return RateLimitInfo.notLimited();
    }

    /**
     * Classify the output of a run that exited successfully, at the current time of this
     * detector's clock.
     */
    public RateLimitInfo classifyCompletedOutput(String output) {
        return classifyCompletedOutput(output, LocalDateTime.now(clock));
    }

    /**
     * Classify the output of a run that exited successfully.
     *
     * <p>A successful answer may legitimately talk about throttling, so here the output only
     * counts when it <i>is</i> the throttling notice: at most {@value #MAX_NOTICE_LINES}
     * non-blank lines, with a phrase starting within the first
     * {@value #MAX_NOTICE_PREFIX} characters of the first or last of them.</p>
     *
     * @param output stdout of the run; may be null
     * @param now the time of detection
     * @return a detected info, or {@link RateLimitInfo#notLimited()}
     */
    public RateLimitInfo classifyCompletedOutput(String output, LocalDateTime now) {
        if (output == null || output.isBlank()) {
            return RateLimitInfo.notLimited();
        }
        List<String> lines = new ArrayList<>();
        for (String line : output.split("\\R")) {
            if (!line.isBlank()) {
                lines.add(line.strip());
            }
        }
        if (lines.size() > MAX_NOTICE_LINES) {
            return RateLimitInfo.notLimited();
        }
        Optional<RateLimitInfo> first = match(lines.get(0), MAX_NOTICE_PREFIX, now);
        if (first.isPresent()) {
            return first.get();
        }
        return match(lines.get(lines.size() - 1), MAX_NOTICE_PREFIX, now).orElse(RateLimitInfo.notLimited());
    }

    private Optional<RateLimitInfo> match(String line, int maxStart, LocalDateTime now) {
        String lower = line.toLowerCase(Locale.ROOT);
        for (String pattern : patterns) {
            int at = lower.indexOf(pattern);
            if (at >= 0 && at <= maxStart) {
                LocalDateTime resetAt = estimateResetTime(now, line);
                logger.info("Throttling detected (\"" + pattern + "\"), estimated reset at " + resetAt);
                return Optional.of(RateLimitInfo.limited(line, now, resetAt));
            }
        }
        return Optional.empty();
    }

    /**
     * Estimate when throttling ends.
     *
     * @param now the current time
     * @param message the throttling message; may be empty
     * @return an explicit future time from the message, or the next anchor hour
     */
    public LocalDateTime estimateResetTime(LocalDateTime now, String message) {
        return parseExplicitResetTime(now, message).orElseGet(() -> nextAnchor(now));
    }

    /**
     * Extract a reset time stated in the message, if any lies strictly after {@code now}.
     */
    public Optional<LocalDateTime> parseExplicitResetTime(LocalDateTime now, String message) {
        if (message == null || message.isEmpty()) {
            return Optional.empty();
        }

        Matcher epoch = EPOCH_SUFFIX.matcher(message);
        if (epoch.find()) {
            LocalDateTime parsed = LocalDateTime.ofInstant(
                    Instant.ofEpochSecond(Long.parseLong(epoch.group(1))), clock.getZone());
            if (parsed.isAfter(now)) {
                return Optional.of(parsed);
            }
        }

        Matcher iso = ISO_DATE_TIME.matcher(message);
        if (iso.find()) {
            Optional<LocalDateTime> parsed = parseIso(iso.group(1), iso.group(2), iso.group(3));
            if (parsed.isPresent() && parsed.get().isAfter(now)) {
                return parsed;
            }
        }

        Matcher time = CLOCK_TIME.matcher(message);
        if (time.find()) {
            Optional<LocalTime> parsed = parseClockTime(time.group(1), time.group(2), time.group(3));
            if (parsed.isPresent()) {
                LocalDateTime candidate = now.toLocalDate().atTime(parsed.get());
                if (!candidate.isAfter(now)) {
                    candidate = candidate.plusDays(1);
                }
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * The earliest anchor hour strictly after {@code now}.
     */
    public static LocalDateTime nextAnchor(LocalDateTime now) {
        LocalDate today = now.toLocalDate();
        for (int hour : ANCHOR_HOURS) {
            LocalDateTime candidate = today.atTime(hour, 0);
            if (candidate.isAfter(now)) {
                return candidate;
            }
        }
        return today.plusDays(1).atTime(ANCHOR_HOURS[0], 0);
    }

    private Optional<LocalDateTime> parseIso(String date, String time, String offset) {
        String text = date + "T" + (time.length() == 5 ? time + ":00" : time);
        try {
            if (offset == null) {
                return Optional.of(LocalDateTime.parse(text));
            }
            String normalizedOffset = offset;
            if (!"Z".equals(offset) && offset.indexOf(':') < 0) {
                normalizedOffset = offset.substring(0, 3) + ":" + offset.substring(3);
            }
            return Optional.of(OffsetDateTime.parse(text + normalizedOffset)
                    .atZoneSameInstant(clock.getZone())
                    .toLocalDateTime());
        } catch (DateTimeException e) {
            logger.fine("Ignoring unparseable reset time " + text + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<LocalTime> parseClockTime(String hourText, String minuteText, String meridiem) {
        int hour = Integer.parseInt(hourText);
        int minute = minuteText == null ? 0 : Integer.parseInt(minuteText);
        if (minute > 59) {
            return Optional.empty();
        }
        if (meridiem != null) {
            if (hour < 1 || hour > 12) {
                return Optional.empty();
            }
            boolean pm = Character.toLowerCase(meridiem.charAt(0)) == 'p';
            hour = hour % 12 + (pm ? 12 : 0);
        } else if (hour > 23) {
            return Optional.empty();
        }
        return Optional.of(LocalTime.of(hour, minute));
    }
}
