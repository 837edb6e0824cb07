package ai.docsite.latex.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.TreeMap;

/**
 * One JSON object per line. The chapter being converted is promoted to a top-level field; other MDC entries are
 * nested under {@code mdc}, and a logged exception adds {@code error} and {@code errorType}.
 */
public class JsonLogLayout extends LayoutBase<ILoggingEvent> {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    private static final String CHAPTER_KEY = "chapter";

    @Override
    public String doLayout(ILoggingEvent event) {
        StringBuilder builder = new StringBuilder(256);
        builder.append('{');
        field(builder, "timestamp", TIMESTAMP.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        builder.append(',');
        field(builder, "level", String.valueOf(event.getLevel()));
        builder.append(',');
        field(builder, "logger", event.getLoggerName());
        builder.append(',');
        field(builder, "thread", event.getThreadName());

        Map<String, String> mdc = new TreeMap<>(mdcOf(event));
        String chapter = mdc.remove(CHAPTER_KEY);
        if (chapter != null) {
            builder.append(',');
            field(builder, CHAPTER_KEY, chapter);
        }
        builder.append(',');
        field(builder, "message", event.getFormattedMessage());

        IThrowableProxy error = event.getThrowableProxy();
        if (error != null) {
            builder.append(',');
            field(builder, "errorType", error.getClassName());
            builder.append(',');
            field(builder, "error", error.getMessage());
        }
        if (!mdc.isEmpty()) {
            builder.append(",\"mdc\":{");
            boolean first = true;
            for (Map.Entry<String, String> entry : mdc.entrySet()) {
                if (!first) {
                    builder.append(',');
                }
                field(builder, entry.getKey(), entry.getValue());
                first = false;
            }
            builder.append('}');
        }
        builder.append('}');
        builder.append(System.lineSeparator());
        return builder.toString();
    }

    private static void field(StringBuilder builder, String name, String value) {
        quote(builder, name);
        builder.append(':');
        quote(builder, value);
    }

    // events built outside a logger context have no MDC adapter
    private static Map<String, String> mdcOf(ILoggingEvent event) {
        try {
            Map<String, String> map = event.getMDCPropertyMap();
            return map == null ? Map.of() : map;
        } catch (RuntimeException ex) {
            return Map.of();
        }
    }

    private static void quote(StringBuilder builder, String value) {
        if (value == null) {
            builder.append("null");
            return;
        }
        builder.append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> builder.append("\\\\");
                case '"' -> builder.append("\\\"");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                default -> {
                    if (ch < 0x20) {
                        builder.append(String.format("\\u%04x", (int) ch));
                    } else {
                        builder.append(ch);
                    }
                }
            }
        }
        builder.append('"');
    }
}
