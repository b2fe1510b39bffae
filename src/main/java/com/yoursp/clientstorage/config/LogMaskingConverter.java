package com.yoursp.clientstorage.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.regex.Pattern;

/**
 * Logback converter that masks client keys in log messages.
 * <ul>
 * <li>x-client-key header / client query values: first 8 chars + "..."</li>
 * <li>bare 64-char hex keys (also inside storage paths and URLs): first 8
 * chars + "..."</li>
 * </ul>
 * <p>
 * Registered in logback-spring.xml:
 * {@code <conversionRule conversionWord="mask" converterClass=
 * "com.yoursp.clientstorage.config.LogMaskingConverter" />}
 * </p>
 */
public class LogMaskingConverter extends CompositeConverter<ILoggingEvent> {

    // Matches x-client-key=<value>, "x-client-key":"<value>", client=<value>
    private static final Pattern CLIENT_KEY_PARAM_PATTERN = Pattern
            .compile("((?:x-client-key|[?&]client)[\"=:]+\\s*[\"']?)([A-Za-z0-9_\\-]{8})[A-Za-z0-9_\\-]+",
                    Pattern.CASE_INSENSITIVE);

    // Matches generated keys: 32 random bytes as lowercase hex
    private static final Pattern HEX_KEY_PATTERN = Pattern.compile("\\b([0-9a-f]{8})[0-9a-f]{56}\\b");

    @Override
    protected String transform(ILoggingEvent event, String formattedMessage) {
        if (formattedMessage == null || formattedMessage.isEmpty()) {
            return formattedMessage;
        }

        String masked = formattedMessage;
        masked = CLIENT_KEY_PARAM_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = HEX_KEY_PATTERN.matcher(masked).replaceAll("$1...");

        return masked;
    }
}
