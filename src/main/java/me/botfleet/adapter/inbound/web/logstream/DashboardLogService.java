package me.botfleet.adapter.inbound.web.logstream;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import me.botfleet.adapter.inbound.web.dto.LogEntryDto;
import me.botfleet.infrastructure.config.FleetProperties;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * In-memory tail of the application log, tagged with the instance id from the
 * MDC so the dashboard can show a single bot's lines.
 */
@Service
public class DashboardLogService {

    public static final String INSTANCE_MDC_KEY = "instanceId";

    private static final String OWN_LOGGER_PREFIX = "me.botfleet.adapter.inbound.web.logstream";
    private static final int MIN_PAGE_SIZE = 1;
    private static final String TRUNCATED_SUFFIX = "... [truncated]";
    private static final Pattern BOT_TOKEN_PATTERN = Pattern.compile(
            "(?i)((?:Bot|Bearer)\\s+)[A-Za-z0-9._\\-+/=]{20,}");
    private static final Pattern JSON_SECRET_PATTERN = Pattern.compile(
            "(?i)(\"(?:token|secret|value)\"\\s*:\\s*\")([^\"]+)(\")");
    private static final Pattern KEY_VALUE_SECRET_PATTERN = Pattern.compile(
            "(?i)((?:token|secret)\\s*[:=]\\s*)([^\\s,;]+)");

    private final Object lock = new Object();
    private final Deque<LogEntryDto> ringBuffer;
    private final AtomicLong sequence = new AtomicLong(0);
    private final Sinks.Many<LogEntryDto> liveStream;
    private final boolean enabled;
    private final int maxEntries;
    private final int defaultPageSize;
    private final int maxPageSize;
    private final int maxMessageChars;
    private final int maxExceptionChars;

    public DashboardLogService(FleetProperties fleetProperties) {
        FleetProperties.LogsProperties logs = fleetProperties.getDashboard().getLogs();
        this.enabled = logs.isEnabled();
        this.maxEntries = positiveOr(logs.getMaxEntries(), 10000);
        this.defaultPageSize = positiveOr(logs.getDefaultPageSize(), 200);
        this.maxPageSize = positiveOr(logs.getMaxPageSize(), 1000);
        this.maxMessageChars = positiveOr(logs.getMaxMessageChars(), 8000);
        this.maxExceptionChars = positiveOr(logs.getMaxExceptionChars(), 16000);
        this.ringBuffer = new ArrayDeque<>(this.maxEntries);
        this.liveStream = Sinks.many().replay().limit(this.maxEntries);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Page of entries older than {@code beforeSeq}, newest last. A non-blank
     * {@code instanceId} keeps only lines logged on behalf of that instance.
     */
    public LogsSlice getLogsPage(Long beforeSeq, Integer limit, String instanceId) {
        if (!enabled) {
            return new LogsSlice(List.of(), null, null, false);
        }

        int pageSize = pageSize(limit);
        List<LogEntryDto> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(ringBuffer);
        }
        if (snapshot.isEmpty()) {
            return new LogsSlice(List.of(), null, null, false);
        }

        Long oldestSeq = snapshot.get(0).getSeq();
        Long newestSeq = snapshot.get(snapshot.size() - 1).getSeq();

        Deque<LogEntryDto> page = new ArrayDeque<>();
        boolean hasMore = false;
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            LogEntryDto entry = snapshot.get(i);
            if (beforeSeq != null && entry.getSeq() >= beforeSeq) {
                continue;
            }
            if (!matches(entry, instanceId)) {
                continue;
            }
            if (page.size() == pageSize) {
                hasMore = true;
                break;
            }
            page.addFirst(entry);
        }
        return new LogsSlice(List.copyOf(page), oldestSeq, newestSeq, hasMore);
    }

    public Flux<LogEntryDto> streamAfter(long afterSeq, String instanceId) {
        if (!enabled) {
            return Flux.empty();
        }
        return liveStream.asFlux()
                .filter(entry -> entry.getSeq() > afterSeq)
                .filter(entry -> matches(entry, instanceId));
    }

    public void append(ILoggingEvent event) {
        if (!enabled || event == null) {
            return;
        }
        String loggerName = event.getLoggerName();
        if (loggerName != null && loggerName.startsWith(OWN_LOGGER_PREFIX)) {
            return;
        }

        Map<String, String> mdc = event.getMDCPropertyMap();
        LogEntryDto entry = LogEntryDto.builder()
                .seq(sequence.incrementAndGet())
                .timestamp(Instant.ofEpochMilli(event.getTimeStamp()).toString())
                .level(event.getLevel() != null ? event.getLevel().toString() : "INFO")
                .logger(loggerName)
                .thread(event.getThreadName())
                .instanceId(mdc != null ? mdc.get(INSTANCE_MDC_KEY) : null)
                .message(truncate(sanitize(event.getFormattedMessage()), maxMessageChars))
                .exception(extractException(event.getThrowableProxy()))
                .build();

        synchronized (lock) {
            if (ringBuffer.size() >= maxEntries) {
                ringBuffer.removeFirst();
            }
            ringBuffer.addLast(entry);
        }
        liveStream.tryEmitNext(entry);
    }

    private static boolean matches(LogEntryDto entry, String instanceId) {
        return instanceId == null || instanceId.isBlank() || instanceId.equals(entry.getInstanceId());
    }

    private int pageSize(Integer requested) {
        int candidate = requested != null ? requested : defaultPageSize;
        if (candidate < MIN_PAGE_SIZE) {
            return MIN_PAGE_SIZE;
        }
        return Math.min(candidate, maxPageSize);
    }

    private static int positiveOr(int value, int fallback) {
        return value > 0 ? value : fallback;
    }

    private String extractException(IThrowableProxy throwableProxy) {
        if (throwableProxy == null) {
            return null;
        }
        return truncate(sanitize(ThrowableProxyUtil.asString(throwableProxy)), maxExceptionChars);
    }

    static String sanitize(String input) {
        if (input == null || input.isBlank()) {
            return input;
        }
        String sanitized = BOT_TOKEN_PATTERN.matcher(input).replaceAll("$1***");
        sanitized = JSON_SECRET_PATTERN.matcher(sanitized).replaceAll("$1***$3");
        return KEY_VALUE_SECRET_PATTERN.matcher(sanitized).replaceAll("$1***");
    }

    private static String truncate(String input, int maxLength) {
        if (input == null || input.length() <= maxLength) {
            return input;
        }
        int endIndex = Math.max(0, maxLength - TRUNCATED_SUFFIX.length());
        return input.substring(0, endIndex) + TRUNCATED_SUFFIX;
    }

    public record LogsSlice(List<LogEntryDto> items, Long oldestSeq, Long newestSeq, boolean hasMore) {
    }
}
