package io.endsession.standalone.http;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import java.util.Locale;
import org.slf4j.LoggerFactory;

/**
 * Replaces the console appender of {@code logback.xml} according to {@code logging.format} and
 * {@code logging.level}.
 *
 * <p>
 * {@code json} writes one {@link JsonEncoder} object per event with the formatted message and
 * the MDC ({@code request_id}, {@code endpoint}). {@code text} writes a single line per event
 * with the request id in brackets.
 */
public final class LogbackConfigurator {

    static final String APPENDER_NAME = "STDOUT";

    static final String TEXT_PATTERN =
            "%d{HH:mm:ss.SSS} %-5level [%X{request_id:-startup}] %logger{36} - %msg%n";

    /** Output formats accepted in {@code logging.format}. */
    enum Format {
        JSON,
        TEXT;

        static Format parse(String value) {
            if (value == null || value.isBlank()) {
                return JSON;
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "logging.format must be 'json' or 'text', got '" + value + "'", e);
            }
        }
    }

    private LogbackConfigurator() {}

    /**
     * Reconfigures the logger context bound to SLF4J.
     *
     * @throws IllegalArgumentException on an unknown format or level
     */
    public static void configure(String format, String level) {
        configure((LoggerContext) LoggerFactory.getILoggerFactory(), format, level);
    }

    static void configure(LoggerContext context, String format, String level) {
        Format parsedFormat = Format.parse(format);
        Level parsedLevel = parseLevel(level);

        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.setLevel(parsedLevel);

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setEncoder(encoder(context, parsedFormat));
        appender.start();
        root.addAppender(appender);

        // Server internals stay at WARN unless the operator asks for more detail.
        Level serverLevel = parsedLevel.isGreaterOrEqual(Level.WARN) ? parsedLevel : Level.WARN;
        context.getLogger("org.eclipse.jetty").setLevel(serverLevel);
        context.getLogger("io.javalin").setLevel(parsedLevel.isGreaterOrEqual(Level.INFO) ? parsedLevel : Level.INFO);
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, Format format) {
        switch (format) {
            case TEXT:
                PatternLayoutEncoder pattern = new PatternLayoutEncoder();
                pattern.setContext(context);
                pattern.setPattern(TEXT_PATTERN);
                pattern.start();
                return pattern;
            case JSON:
            default:
                JsonEncoder json = new JsonEncoder();
                json.setContext(context);
                json.setWithFormattedMessage(true);
                json.setWithArguments(false);
                json.start();
                return json;
        }
    }

    private static Level parseLevel(String level) {
        if (level == null || level.isBlank()) {
            return Level.INFO;
        }
        Level parsed = Level.toLevel(level.trim(), null);
        if (parsed == null) {
            throw new IllegalArgumentException("logging.level is not a log level: '" + level + "'");
        }
        return parsed;
    }
}
