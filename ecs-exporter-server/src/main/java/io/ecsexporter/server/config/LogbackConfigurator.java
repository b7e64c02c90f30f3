package io.ecsexporter.server.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Programmatic Logback configuration from the HOCON {@code logging} block.
 *
 * <pre>
 * logging {
 *     level = "INFO"
 *     pattern = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n"
 *     loggers {
 *         "io.ecsexporter" = "DEBUG"
 *         "software.amazon.awssdk" = "WARN"
 *     }
 * }
 * </pre>
 */
public class LogbackConfigurator {

    static final String DEFAULT_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";
    static final String DEFAULT_LEVEL = "INFO";

    private LogbackConfigurator() {
    }

    public static void configure(Config config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();

        String pattern = config.hasPath("logging.pattern") ? config.getString("logging.pattern") : DEFAULT_PATTERN;
        String rootLevel = config.hasPath("logging.level") ? config.getString("logging.level") : DEFAULT_LEVEL;

        ConsoleAppender<ILoggingEvent> consoleAppender = new ConsoleAppender<>();
        consoleAppender.setContext(context);
        consoleAppender.setName("CONSOLE");

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(pattern);
        encoder.start();

        consoleAppender.setEncoder(encoder);
        consoleAppender.start();

        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.setLevel(Level.toLevel(rootLevel));
        rootLogger.addAppender(consoleAppender);

        if (config.hasPath("logging.loggers")) {
            ConfigObject loggers = config.getObject("logging.loggers");
            for (Map.Entry<String, ConfigValue> entry : loggers.entrySet()) {
                String level = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(entry.getKey()).setLevel(Level.toLevel(level));
            }
        }

        // SDK wire logging is noisy at INFO
        setLoggerLevel(context, "software.amazon.awssdk", "WARN");
        setLoggerLevel(context, "io.netty", "WARN");
    }

    private static void setLoggerLevel(LoggerContext context, String name, String level) {
        Logger logger = context.getLogger(name);
        if (logger.getLevel() == null) {
            logger.setLevel(Level.toLevel(level));
        }
    }
}
