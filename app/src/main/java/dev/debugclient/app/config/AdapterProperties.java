package dev.debugclient.app.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "adapter")
public class AdapterProperties {

    /**
     * Command line of the debug adapter. The first element must be an absolute path.
     */
    private List<String> command = new ArrayList<>();

    /**
     * Adapter type sent as {@code adapterID} in the initialize request.
     */
    private String id = "adapter";

    public List<String> getCommand() {
        return command;
    }

    public void setCommand(List<String> command) {
        this.command = command;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }
}
