package dev.debugclient.app;

import dev.debugclient.app.config.AdapterProperties;
import dev.debugclient.app.config.SessionProperties;
import dev.debugclient.client.data.SessionData;
import dev.debugclient.client.session.Session;
import dev.debugclient.transport.ChildProcessAdapter;
import dev.debugclient.transport.StdioTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties({AdapterProperties.class, SessionProperties.class})
public class DebugClientApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(DebugClientApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(DebugClientApplication.class, args);
    }

    @Bean(destroyMethod = "close")
    ChildProcessAdapter adapterProcess(AdapterProperties adapterProperties) {
        ChildProcessAdapter adapter = new ChildProcessAdapter(adapterProperties.getId(), adapterProperties.getCommand());
        LOGGER.info("Debug adapter {}: {}", adapter.id(), adapter.command());
        return adapter;
    }

    @Bean
    Session session(ChildProcessAdapter adapterProcess, SessionProperties sessionProperties) {
        return new Session(adapterProcess, StdioTransport::forAdapter, sessionProperties.getPollInterval());
    }

    @Bean
    SessionData sessionData() {
        return new SessionData();
    }
}
