package dev.debugclient.app;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.debugclient.app.config.AdapterProperties;
import dev.debugclient.app.config.SessionProperties;
import dev.debugclient.client.DapError;
import dev.debugclient.client.DapException;
import dev.debugclient.client.capability.AdapterCapability;
import dev.debugclient.client.data.SessionData;
import dev.debugclient.client.protocol.ConfigurationDoneArguments;
import dev.debugclient.client.protocol.DebugModule;
import dev.debugclient.client.protocol.DebugThread;
import dev.debugclient.client.protocol.LaunchRequestArguments;
import dev.debugclient.client.protocol.OutputEventBody;
import dev.debugclient.client.session.EndSessionMode;
import dev.debugclient.client.session.Session;
import dev.debugclient.client.session.SessionState;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Runs one debug session to completion: launch the configured program, follow its events until it stops or
 * terminates, then disconnect and print what was learned about it.
 */
@Component
public class DebugSessionRunner implements CommandLineRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(DebugSessionRunner.class);

    private final Session session;
    private final SessionData sessionData;
    private final AdapterProperties adapterProperties;
    private final SessionProperties sessionProperties;

    private final List<Integer> threadRequests = new ArrayList<>();
    private boolean finished;

    public DebugSessionRunner(Session session, SessionData sessionData, AdapterProperties adapterProperties,
                              SessionProperties sessionProperties) {
        this.session = session;
        this.sessionData = sessionData;
        this.adapterProperties = adapterProperties;
        this.sessionProperties = sessionProperties;
    }

    @Override
    public void run(String... args) throws Exception {
        session.spawnAdapter();
        try {
            initialize();
            launch();
            eventLoop();
            disconnect();
        } catch (DapException e) {
            if (e.error() != DapError.END_OF_STREAM) {
                throw e;
            }
            LOGGER.info("Adapter exited before the session was closed");
        }
        printSummary();
    }

    private void initialize() throws IOException, DapException {
        int seq = session.sendInitRequest(sessionProperties.initializeArguments(adapterProperties.getId()), null);
        session.waitForResponse(seq);
        session.handleInitResponse(seq);
    }

    /**
     * The launch response usually only arrives after configurationDone, which in turn waits for the
     * {@code initialized} event.
     */
    private void launch() throws IOException, DapException {
        int launchSeq = session.sendLaunchRequest(LaunchRequestArguments.defaults(), sessionProperties.launchExtras());
        session.waitForEvent("initialized");
        session.handleInitializedEvent();

        if (session.adapterCapabilities().supports(AdapterCapability.SUPPORTS_CONFIGURATION_DONE_REQUEST)) {
            int seq = session.sendConfigurationDoneRequest(new ConfigurationDoneArguments(), null);
            session.waitForResponse(seq);
            session.handleConfigurationDoneResponse(seq);
        }

        session.waitForResponse(launchSeq);
        session.handleLaunchResponse(launchSeq);
        LOGGER.info("Launched {}", sessionProperties.getProgram());
    }

    private void eventLoop() throws IOException, DapException {
        long timeout = sessionProperties.getQueueTimeout().toMillis();
        while (!finished) {
            session.queueMessages(timeout);
            handleThreadResponses();
            while (!finished && !session.pendingEvents().isEmpty()) {
                dispatch(session.pendingEvents().get(0).message());
            }
        }
    }

    void dispatch(ObjectNode event) throws IOException, DapException {
        String name = event.path("event").asText();
        switch (name) {
            case "module" -> sessionData.handleEventModules(session);
            case "stopped" -> {
                sessionData.handleEventStopped(session);
                LOGGER.info("Stopped: {}", event.path("body").path("reason").asText());
                threadRequests.add(session.sendThreadsRequest(null));
            }
            case "continued" -> sessionData.handleEventContinued(session);
            case "terminated" -> {
                sessionData.handleEventTerminated(session);
                finished = true;
            }
            case "exited" -> {
                sessionData.handleEventExited(session);
                LOGGER.info("Debuggee exited with {}", sessionData.exitCode().getAsInt());
            }
            case "output" -> {
                sessionData.handleEventOutput(session);
                List<OutputEventBody> output = sessionData.output();
                System.out.print(output.get(output.size() - 1).output());
            }
            default -> {
                LOGGER.debug("Ignoring {} event", name);
                session.handleNamedEvent(name);
            }
        }
    }

    boolean isFinished() {
        return finished;
    }

    /**
     * Once the threads of a stop are known there is nothing left this runner can do with the debuggee.
     */
    private void handleThreadResponses() throws DapException {
        Iterator<Integer> pending = threadRequests.iterator();
        while (pending.hasNext()) {
            int seq = pending.next();
            if (session.hasResponse(seq)) {
                pending.remove();
                sessionData.handleResponseThreads(session, seq);
                finished = true;
            }
        }
    }

    private void disconnect() throws IOException, DapException {
        if (session.state() == SessionState.NOT_STARTED) {
            return;
        }
        int seq = session.endSession(EndSessionMode.DISCONNECT);
        session.waitForResponse(seq);
        session.handleDisconnectResponse(seq);
    }

    private void printSummary() {
        System.out.println("MODULES (" + sessionData.modules().size() + ")");
        for (DebugModule module : sessionData.modules()) {
            System.out.println("  " + module.id() + " " + module.name() + (module.path() != null ? " " + module.path() : ""));
        }
        System.out.println("THREADS (" + sessionData.threads().size() + ")");
        for (DebugThread thread : sessionData.threads()) {
            System.out.println("  " + thread.id() + " " + thread.name());
        }
        System.out.println("STATUS " + sessionData.status()
            + (sessionData.exitCode().isPresent() ? " exitCode=" + sessionData.exitCode().getAsInt() : ""));
        System.out.println("messages=" + session.messagesReceived() + " failed=" + session.failedMessages().size());
    }
}
