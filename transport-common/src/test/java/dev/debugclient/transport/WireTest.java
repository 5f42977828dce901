package dev.debugclient.transport;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class WireTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final Logger wire = (Logger) LoggerFactory.getLogger("WIRE");
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
        appender.start();
        wire.addAppender(appender);
    }

    @AfterEach
    void detach() {
        wire.detachAppender(appender);
    }

    @Test
    void trafficIsLoggedAtInfo() {
        ObjectNode request = mapper.createObjectNode().put("seq", 4).put("type", "request").put("command", "threads");
        ObjectNode event = mapper.createObjectNode().put("seq", 9).put("type", "event").put("event", "stopped");

        Wire.tx("lldb", request);
        Wire.rx("lldb", event);

        assertThat(appender.list).extracting(ILoggingEvent::getLevel).containsExactly(Level.INFO, Level.INFO);
        assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage)
            .satisfiesExactly(
                tx -> assertThat(tx).startsWith("TX adapter=lldb type=request seq=4 name=threads"),
                rx -> assertThat(rx).startsWith("RX adapter=lldb type=event seq=9 name=stopped"));
    }

    @Test
    void longMessagesAreTruncated() {
        assertThat(Wire.truncate("abcdef", 3)).isEqualTo("abc…");
        assertThat(Wire.truncate("abc", 3)).isEqualTo("abc");
    }
}
