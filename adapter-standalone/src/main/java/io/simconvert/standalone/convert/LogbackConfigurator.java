package io.simconvert.standalone.convert;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import org.slf4j.LoggerFactory;

/**
 * Switches the converter's console output to the settings of the loaded run configuration.
 *
 * <p>
 * The bundled {@code logback.xml} only covers start-up, before the configuration file has been
 * read. {@link ConvertApp} then calls {@link #configure} so that the per-file lines
 * ({@code file.converted}, {@code file.failed}, ...) and the driver's conversion events come out
 * at {@code logging.level}, either one JSON object per line for log shippers
 * ({@code logging.format: json}) or as {@link #TEXT_PATTERN} for a person watching the run.
 */
public final class LogbackConfigurator {

    /** Pattern used unless JSON output is requested. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    /** Name of the console appender installed on the root logger. */
    static final String APPENDER_NAME = "simdoc-console";

    private LogbackConfigurator() {}

    /**
     * Replaces whatever appenders the root logger has with a single console appender.
     *
     * @param format {@code json} (any case) for JSON lines, anything else for plain text
     * @param level  root level name; an unknown or missing name means INFO
     */
    public static void configure(String format, String level) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            // another SLF4J binding owns the output
            return;
        }
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.setLevel(Level.toLevel(level, Level.INFO));

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setContext(context);
        console.setName(APPENDER_NAME);
        console.setEncoder(encoderFor(format, context));
        console.start();
        root.addAppender(console);
    }

    static boolean isJson(String format) {
        return "json".equalsIgnoreCase(format);
    }

    private static Encoder<ILoggingEvent> encoderFor(String format, LoggerContext context) {
        if (isJson(format)) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(TEXT_PATTERN);
        text.start();
        return text;
    }
}
