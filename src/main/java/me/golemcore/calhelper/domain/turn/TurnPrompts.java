package me.golemcore.calhelper.domain.turn;

import me.golemcore.calhelper.infrastructure.config.CalHelperProperties;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * System prompt and user-message decoration. User messages are prefixed with
 * the local date-time so the model can resolve relative dates such as
 * "tomorrow".
 */
public class TurnPrompts {

    static final String DEFAULT_SYSTEM_PROMPT = "You are a helpful calendar assistant. "
            + "Current local timezone is %s. "
            + "All time string format is ISO-8601, example: 2025-07-10T09:00:00-0700. "
            + "Respond everything in the current timezone. "
            + "Before creating, cancelling, or rescheduling an event, "
            + "prompt the user for confirmation with tool call arguments.";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final CalHelperProperties.PromptProperties settings;
    private final Clock clock;

    public TurnPrompts(CalHelperProperties.PromptProperties settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public ZoneId zone() {
        String configured = settings != null ? settings.getTimeZone() : null;
        if (configured == null || configured.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(configured);
    }

    public String systemPrompt() {
        String custom = settings != null ? settings.getSystemPrompt() : null;
        if (custom != null && !custom.isBlank()) {
            return custom;
        }
        return String.format(DEFAULT_SYSTEM_PROMPT, zone().getId());
    }

    public String decorateUserMessage(String text) {
        if (settings != null && !settings.isTimestampUserMessages()) {
            return text;
        }
        LocalDateTime now = LocalDateTime.ofInstant(clock.instant(), zone());
        return TIMESTAMP.format(now) + ": " + text;
    }
}
