package xyz.vvrf.reactor.workflow.expression;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 表达式与提示词模板中 {@code base} 根下的环境值。
 */
public final class BaseValues {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private BaseValues() {}

    public static Map<String, Object> defaults(Clock clock) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        Map<String, Object> base = new LinkedHashMap<>();
        base.put("now", now.toOffsetDateTime().toString());
        base.put("timestamp", now.toLocalDateTime().toString());
        base.put("date", now.format(DATE));
        base.put("time", now.format(TIME));
        base.put("timezone", now.getZone().getId());
        base.put("unix_timestamp", now.toEpochSecond());
        base.put("day_of_week", now.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
        base.put("month", now.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
        base.put("year", now.getYear());
        return base;
    }

    /**
     * 运行级别的 base：默认环境值，加上 run_id 和调用方补充的值（调用方优先）。
     */
    public static Map<String, Object> forRun(Clock clock, String runId, Map<String, Object> additions) {
        Map<String, Object> base = defaults(clock);
        base.put("run_id", runId);
        if (additions != null) {
            base.putAll(additions);
        }
        return base;
    }
}
