package me.botfleet.adapter.inbound.web.logstream;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Attaches {@link DashboardLogService} to the Logback root logger for the
 * lifetime of the context.
 */
@Component
@RequiredArgsConstructor
public class DashboardLogAppenderRegistrar {

    static final String APPENDER_NAME = "FLEET_DASHBOARD_LOGS";

    private final DashboardLogService dashboardLogService;
    private AppenderBase<ILoggingEvent> appender;

    @PostConstruct
    void register() {
        if (!dashboardLogService.isEnabled()) {
            return;
        }
        Logger root = rootLogger();
        if (root.getAppender(APPENDER_NAME) != null) {
            return;
        }

        appender = new AppenderBase<>() {
            @Override
            protected void append(ILoggingEvent eventObject) {
                dashboardLogService.append(eventObject);
            }
        };
        appender.setContext(root.getLoggerContext());
        appender.setName(APPENDER_NAME);
        appender.start();
        root.addAppender(appender);
    }

    @PreDestroy
    void unregister() {
        if (appender == null) {
            return;
        }
        rootLogger().detachAppender(APPENDER_NAME);
        appender.stop();
        appender = null;
    }

    private static Logger rootLogger() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        return context.getLogger(Logger.ROOT_LOGGER_NAME);
    }
}
