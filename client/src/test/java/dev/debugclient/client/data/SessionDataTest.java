package dev.debugclient.client.data;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.debugclient.client.DapError;
import dev.debugclient.client.DapException;
import dev.debugclient.client.protocol.DebugModule;
import dev.debugclient.client.protocol.DebugThread;
import dev.debugclient.client.protocol.InitializeRequestArguments;
import dev.debugclient.client.protocol.LaunchRequestArguments;
import dev.debugclient.client.protocol.ModuleId;
import dev.debugclient.client.protocol.ModulesArguments;
import dev.debugclient.client.protocol.OutputEventBody;
import dev.debugclient.client.protocol.StoppedEventBody;
import dev.debugclient.client.session.ScriptedAdapter;
import dev.debugclient.client.session.Session;
import dev.debugclient.client.session.SessionState;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionDataTest {

    private ScriptedAdapter adapter;
    private Session session;
    private SessionData data;

    @BeforeEach
    void setUp() throws Exception {
        adapter = new ScriptedAdapter();
        session = new Session(adapter, process -> adapter, Duration.ofMillis(1));
        session.spawnAdapter();
        data = new SessionData();
    }

    private ObjectNode moduleEvent(String reason, Object id, String name) {
        ObjectNode body = adapter.object().put("reason", reason);
        ObjectNode module = body.putObject("module");
        if (id instanceof Integer number) {
            module.put("id", number);
        } else {
            module.put("id", (String) id);
        }
        module.put("name", name);
        return body;
    }

    private void enableModulesRequest() throws Exception {
        adapter.respond(1, "initialize", adapter.object().put("supportsModulesRequest", true));
        session.sendInitRequest(InitializeRequestArguments.builder("mock").build(), null);
        session.queueMessages(0);
        session.handleInitResponse(1);
    }

    private void queueAll() throws Exception {
        while (session.queueMessages(0)) {
            // drain the scripted messages
        }
    }

    private static DapError errorOf(Throwable thrown) {
        return ((DapException) thrown).error();
    }

    @Test
    void addModuleKeepsTheFirstVersion() throws Exception {
        DebugModule first = DebugModule.named(ModuleId.of(1), "libc.so");
        DebugModule second = DebugModule.named(ModuleId.of(1), "libc-renamed.so");

        assertThat(data.addModule(first)).isTrue();
        assertThat(data.addModule(second)).isFalse();

        assertThat(data.modules()).singleElement()
            .satisfies(module -> assertThat(module.name()).isEqualTo("libc.so"));
    }

    @Test
    void setThreadsReplacesTheSnapshot() {
        data.setThreads(List.of(new DebugThread(1, "main")));
        data.setThreads(List.of(new DebugThread(2, "worker")));

        assertThat(data.threads()).containsExactly(new DebugThread(2, "worker"));
    }

    @Test
    void stringsAreInterned() throws Exception {
        data.setThreads(List.of(new DebugThread(1, new String("worker")), new DebugThread(2, new String("worker"))));
        data.addModule(DebugModule.named(ModuleId.of("worker"), "worker"));

        List<DebugThread> threads = data.threads();
        assertThat(threads.get(0).name()).isSameAs(threads.get(1).name());
        assertThat(data.modules().get(0).name()).isSameAs(threads.get(0).name());
        assertThat(data.strings().size()).isEqualTo(1);
    }

    @Test
    void moduleEventsAddAndRemove() throws Exception {
        adapter.event("module", moduleEvent("new", 1, "a.so"))
            .event("module", moduleEvent("new", "b", "b.so"))
            .event("module", moduleEvent("changed", 1, "a-changed.so"))
            .event("module", moduleEvent("removed", "b", "b.so"));
        for (int i = 0; i < 4; i++) {
            session.queueMessages(0);
        }

        for (int i = 0; i < 4; i++) {
            data.handleEventModules(session);
        }

        assertThat(data.modules()).singleElement()
            .satisfies(module -> {
                assertThat(module.id()).isEqualTo(ModuleId.of(1));
                assertThat(module.name()).isEqualTo("a.so");
            });
        assertThat(session.handledEvents()).hasSize(4);
    }

    @Test
    void malformedModuleEventIsRejected() throws Exception {
        adapter.event("module", adapter.object().put("reason", "new"));
        session.queueMessages(0);

        assertThatThrownBy(() -> data.handleEventModules(session))
            .isInstanceOf(DapException.class)
            .extracting(thrown -> ((DapException) thrown).error())
            .isEqualTo(DapError.INVALID_MESSAGE);
        assertThat(session.failedMessages()).hasSize(1);
        assertThat(data.modules()).isEmpty();
    }

    @Test
    void threadsResponseReplacesThreads() throws Exception {
        int seq = session.sendThreadsRequest(null);
        ObjectNode body = adapter.object();
        body.putArray("threads")
            .add(adapter.object().put("id", 1).put("name", "main"))
            .add(adapter.object().put("id", 7).put("name", "io"));
        adapter.respond(seq, "threads", body);
        session.waitForResponse(seq);

        data.handleResponseThreads(session, seq);

        assertThat(data.threads()).containsExactly(new DebugThread(1, "main"), new DebugThread(7, "io"));
        assertThat(session.handledResponses()).hasSize(1);
    }

    @Test
    void modulesResponseAddsModules() throws Exception {
        enableModulesRequest();

        int seq = session.sendModulesRequest(new ModulesArguments(0, 10), null);
        ObjectNode body = adapter.object().put("totalModules", 2);
        body.putArray("modules")
            .add(adapter.object().put("id", 1).put("name", "a.so"))
            .add(adapter.object().put("id", 1).put("name", "duplicate.so"));
        adapter.respond(seq, "modules", body);
        session.waitForResponse(seq);

        data.handleResponseModules(session, seq);

        assertThat(data.modules()).extracting(DebugModule::name).containsExactly("a.so");
        assertThat(adapter.lastWritten().path("arguments").path("moduleCount").intValue()).isEqualTo(10);
    }

    @Test
    void moduleWithoutIdIsRejectedAsAWhole() throws Exception {
        enableModulesRequest();
        data.addModule(DebugModule.named(ModuleId.of(1), "a.so"));

        int seq = session.sendModulesRequest(new ModulesArguments(null, null), null);
        ObjectNode body = adapter.object();
        body.putArray("modules")
            .add(adapter.object().put("name", "noid.so"))
            .add(adapter.object().put("id", 2).put("name", "b.so"));
        adapter.respond(seq, "modules", body);
        session.waitForResponse(seq);

        assertThatThrownBy(() -> data.handleResponseModules(session, seq))
            .isInstanceOf(DapException.class)
            .extracting(SessionDataTest::errorOf)
            .isEqualTo(DapError.INVALID_MESSAGE);
        assertThat(data.modules()).extracting(DebugModule::name).containsExactly("a.so");
        assertThat(session.pendingResponses()).isEmpty();
        assertThat(session.failedMessages()).hasSize(1);

        adapter.event("module", moduleEvent("new", 3, "c.so"));
        session.queueMessages(0);
        data.handleEventModules(session);
        assertThat(data.modules()).extracting(DebugModule::name).containsExactly("a.so", "c.so");
    }

    @Test
    void addModuleRequiresAnId() {
        assertThatThrownBy(() -> data.addModule(DebugModule.named(null, "noid.so")))
            .extracting(SessionDataTest::errorOf)
            .isEqualTo(DapError.INVALID_MESSAGE);
        assertThat(data.modules()).isEmpty();
    }

    @Test
    void stoppedEventMarksThreadStopped() throws Exception {
        data.setThreads(List.of(new DebugThread(1, "main"), new DebugThread(2, "worker")));
        adapter.event("stopped", adapter.object().put("reason", "breakpoint").put("threadId", 1).put("text", "hit"));
        queueAll();

        data.handleEventStopped(session);

        assertThat(data.threadState(1)).isEqualTo(ThreadState.STOPPED);
        assertThat(data.threadState(2)).isEqualTo(ThreadState.UNKNOWN);
        assertThat(data.stopOf(1)).hasValueSatisfying(stop -> {
            assertThat(stop.reason()).isEqualTo("breakpoint");
            assertThat(stop.text()).isEqualTo("hit");
        });
        assertThat(data.status()).isEqualTo(DebuggeeStatus.STOPPED);
    }

    @Test
    void allThreadsStoppedReachesEveryKnownThread() throws Exception {
        data.setThreads(List.of(new DebugThread(1, "main"), new DebugThread(2, "worker")));
        adapter.event("stopped", adapter.object().put("reason", "pause").put("threadId", 2).put("allThreadsStopped", true));
        queueAll();

        data.handleEventStopped(session);

        assertThat(data.threadState(1)).isEqualTo(ThreadState.STOPPED);
        assertThat(data.stopOf(1)).isEmpty();
        assertThat(data.stopOf(2)).hasValueSatisfying(stop -> assertThat(stop.reason()).isEqualTo("pause"));
    }

    @Test
    void continuedEventResumesThreads() throws Exception {
        data.setThreads(List.of(new DebugThread(1, "main"), new DebugThread(2, "worker")));
        adapter.event("stopped", adapter.object().put("reason", "step").put("threadId", 1).put("allThreadsStopped", true))
            .event("continued", adapter.object().put("threadId", 1).put("allThreadsContinued", false))
            .event("continued", adapter.object().put("threadId", 2));
        queueAll();

        data.handleEventStopped(session);
        data.handleEventContinued(session);

        assertThat(data.threadState(1)).isEqualTo(ThreadState.CONTINUED);
        assertThat(data.stopOf(1)).isEmpty();
        assertThat(data.threadState(2)).isEqualTo(ThreadState.STOPPED);

        data.handleEventContinued(session);

        assertThat(data.threadState(2)).isEqualTo(ThreadState.CONTINUED);
        assertThat(data.status()).isEqualTo(DebuggeeStatus.RUNNING);
    }

    @Test
    void threadsResponseDropsStateOfVanishedThreads() {
        data.setThreads(List.of(new DebugThread(1, "main"), new DebugThread(2, "worker")));
        data.setStopped(new StoppedEventBody("pause", null, 2, null, null, true, null));

        data.setThreads(List.of(new DebugThread(1, "main")));

        assertThat(data.threadState(1)).isEqualTo(ThreadState.STOPPED);
        assertThat(data.threadState(2)).isEqualTo(ThreadState.UNKNOWN);
        assertThat(data.stopOf(2)).isEmpty();
    }

    @Test
    void stoppedEventNeedsAReason() throws Exception {
        adapter.event("stopped", adapter.object().put("threadId", 1));
        queueAll();

        assertThatThrownBy(() -> data.handleEventStopped(session))
            .extracting(SessionDataTest::errorOf)
            .isEqualTo(DapError.INVALID_MESSAGE);
        assertThat(data.threadState(1)).isEqualTo(ThreadState.UNKNOWN);
        assertThat(session.failedMessages()).hasSize(1);
    }

    @Test
    void outputEventsAreLoggedAndInterned() throws Exception {
        adapter.event("output", adapter.object().put("category", "stdout").put("output", "hello\n"))
            .event("output", adapter.object().put("output", "stdout"));
        queueAll();

        data.handleEventOutput(session);
        data.handleEventOutput(session);

        List<OutputEventBody> output = data.output();
        assertThat(output).extracting(OutputEventBody::output).containsExactly("hello\n", "stdout");
        assertThat(output.get(1).categoryOrDefault()).isEqualTo(OutputEventBody.CONSOLE);
        assertThat(output.get(0).category()).isSameAs(output.get(1).output());
    }

    @Test
    void outputEventNeedsOutput() throws Exception {
        adapter.event("output", adapter.object().put("category", "stderr"));
        queueAll();

        assertThatThrownBy(() -> data.handleEventOutput(session))
            .extracting(SessionDataTest::errorOf)
            .isEqualTo(DapError.INVALID_MESSAGE);
        assertThat(data.output()).isEmpty();
    }

    @Test
    void exitedStatusSurvivesTermination() throws Exception {
        adapter.event("exited", adapter.object().put("exitCode", 3)).event("terminated", null);
        queueAll();

        data.handleEventExited(session);
        data.handleEventTerminated(session);

        assertThat(data.status()).isEqualTo(DebuggeeStatus.EXITED);
        assertThat(data.exitCode()).hasValue(3);
        assertThat(session.handledEvents()).hasSize(2);
    }

    @Test
    void terminationWithoutExitStopsTheDebuggee() throws Exception {
        int seq = session.sendLaunchRequest(LaunchRequestArguments.defaults(), null);
        adapter.respond(seq, "launch", null);
        adapter.event("stopped", adapter.object().put("reason", "entry").put("threadId", 1));
        adapter.event("terminated", null);
        queueAll();
        session.handleLaunchResponse(seq);

        data.handleEventStopped(session);
        data.handleEventTerminated(session);

        assertThat(data.status()).isEqualTo(DebuggeeStatus.NOT_RUNNING);
        assertThat(data.exitCode()).isEmpty();
        assertThat(session.state()).isEqualTo(SessionState.TERMINATED);
    }
}
