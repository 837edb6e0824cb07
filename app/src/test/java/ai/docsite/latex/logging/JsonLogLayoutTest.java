package ai.docsite.latex.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JsonLogLayoutTest {

    private LoggerContext context;
    private JsonLogLayout layout;

    @BeforeEach
    void setUp() {
        context = new LoggerContext();
        context.start();
        layout = new JsonLogLayout();
        layout.setContext(context);
        layout.start();
    }

    private LoggingEvent event(String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }

    @Test
    void formatsEventAsJson() {
        String json = layout.doLayout(event("hello world"));

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).contains("\"message\":\"hello world\"");
        assertThat(json).contains("\"logger\":\"test.logger\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).doesNotContain("\"chapter\"", "\"mdc\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void promotesChapterAndNestsOtherMdcEntries() {
        LoggingEvent event = event("converted");
        event.setMDCPropertyMap(Map.of("chapter", "intro", "run", "42"));

        String json = layout.doLayout(event);

        assertThat(json).contains("\"chapter\":\"intro\"");
        assertThat(json).contains("\"mdc\":{\"run\":\"42\"}");
    }

    @Test
    void includesErrorDetailsAndEscapesText() {
        LoggingEvent event = event("line \"one\"\nline two");
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("broken")));

        String json = layout.doLayout(event);

        assertThat(json).contains("\"message\":\"line \\\"one\\\"\\nline two\"");
        assertThat(json).contains("\"errorType\":\"java.lang.IllegalStateException\"");
        assertThat(json).contains("\"error\":\"broken\"");
    }
}
