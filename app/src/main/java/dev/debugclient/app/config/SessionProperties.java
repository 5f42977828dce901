package dev.debugclient.app.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.debugclient.client.protocol.InitializeRequestArguments;
import dev.debugclient.client.protocol.PathFormat;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "session")
public class SessionProperties {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private String clientName = "debug-client";

    private boolean linesStartAt1 = true;

    private boolean columnsStartAt1 = true;

    /**
     * Interval between polls while waiting for a response or an event.
     */
    private Duration pollInterval = Duration.ofMillis(10);

    /**
     * Poll timeout of each round of the event loop.
     */
    private Duration queueTimeout = Duration.ofMillis(100);

    /**
     * Program to debug, passed to the adapter as the {@code program} launch argument.
     */
    private String program;

    /**
     * Adapter specific launch arguments, as a JSON object.
     */
    private String launchArguments = "{}";

    public InitializeRequestArguments initializeArguments(String adapterId) {
        return InitializeRequestArguments.builder(adapterId)
            .clientID(clientName)
            .clientName(clientName)
            .linesStartAt1(linesStartAt1)
            .columnsStartAt1(columnsStartAt1)
            .pathFormat(PathFormat.PATH)
            .build();
    }

    /**
     * Builds the vendor fields of the launch request: the configured launch arguments plus {@code program}.
     *
     * @throws IllegalStateException when {@code session.launch-arguments} is not a JSON object
     */
    public ObjectNode launchExtras() {
        JsonNode parsed;
        try {
            parsed = MAPPER.readTree(StringUtils.hasText(launchArguments) ? launchArguments : "{}");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("session.launch-arguments is not valid JSON", e);
        }
        if (!(parsed instanceof ObjectNode extras)) {
            throw new IllegalStateException("session.launch-arguments must be a JSON object, found " + parsed.getNodeType());
        }
        if (StringUtils.hasText(program)) {
            extras.put("program", program);
        }
        return extras;
    }

    public String getClientName() {
        return clientName;
    }

    public void setClientName(String clientName) {
        this.clientName = clientName;
    }

    public boolean isLinesStartAt1() {
        return linesStartAt1;
    }

    public void setLinesStartAt1(boolean linesStartAt1) {
        this.linesStartAt1 = linesStartAt1;
    }

    public boolean isColumnsStartAt1() {
        return columnsStartAt1;
    }

    public void setColumnsStartAt1(boolean columnsStartAt1) {
        this.columnsStartAt1 = columnsStartAt1;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getQueueTimeout() {
        return queueTimeout;
    }

    public void setQueueTimeout(Duration queueTimeout) {
        this.queueTimeout = queueTimeout;
    }

    public String getProgram() {
        return program;
    }

    public void setProgram(String program) {
        this.program = program;
    }

    public String getLaunchArguments() {
        return launchArguments;
    }

    public void setLaunchArguments(String launchArguments) {
        this.launchArguments = launchArguments;
    }
}
