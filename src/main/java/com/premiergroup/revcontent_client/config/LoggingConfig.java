package com.premiergroup.revcontent_client.config;

import lombok.extern.log4j.Log4j2;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.Appender;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.RollingFileAppender;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

@Configuration(proxyBeanMethods = false)
@Log4j2
public class LoggingConfig {

    static final String FILE_APPENDER = "RollingFile";

    /**
     * Published before the command line runners, so the log file is named first thing.
     */
    @EventListener(ApplicationStartedEvent.class)
    public void announceLogFile() {
        LoggerContext context = (LoggerContext) LogManager.getContext(false);
        Appender appender = context.getConfiguration().getAppender(FILE_APPENDER);
        if (appender instanceof RollingFileAppender rollingFile) {
            log.info("Log4j2 logging started. Log file: {}", rollingFile.getFileName());
        } else {
            log.warn("No '{}' appender configured, logging to console only", FILE_APPENDER);
        }
    }
}
