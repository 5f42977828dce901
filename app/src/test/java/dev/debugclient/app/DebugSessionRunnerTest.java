package dev.debugclient.app;

import static org.assertj.core.api.Assertions.assertThat;

import dev.debugclient.app.config.AdapterProperties;
import dev.debugclient.app.config.SessionProperties;
import dev.debugclient.client.data.DebuggeeStatus;
import dev.debugclient.client.data.SessionData;
import dev.debugclient.client.protocol.OutputEventBody;
import dev.debugclient.client.session.Session;
import dev.debugclient.transport.AdapterProcess;
import dev.debugclient.transport.ContentLengthCodec;
import dev.debugclient.transport.StdioTransport;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class DebugSessionRunnerTest {

    private final ByteArrayOutputStream adapterOutput = new ByteArrayOutputStream();

    private void emit(String json) throws IOException {
        ContentLengthCodec.writeFrame(adapterOutput, json);
    }

    private Session sessionOverEmittedFrames() throws Exception {
        InputStream stdout = new ByteArrayInputStream(adapterOutput.toByteArray());
        AdapterProcess adapter = new AdapterProcess() {
            @Override
            public String id() {
                return "recorded";
            }

            @Override
            public void spawn() {
            }

            @Override
            public boolean isAlive() {
                return true;
            }

            @Override
            public int waitFor() {
                return 0;
            }

            @Override
            public void writeAll(byte[] message) {
            }

            @Override
            public InputStream stdout() {
                return stdout;
            }
        };
        Session session = new Session(adapter, StdioTransport::forAdapter, Duration.ofMillis(1));
        session.spawnAdapter();
        return session;
    }

    @Test
    void eventsFeedTheSessionData() throws Exception {
        emit("{\"type\":\"event\",\"event\":\"loadedSource\",\"body\":{\"reason\":\"new\"}}");
        emit("{\"seq\":2,\"type\":\"event\",\"event\":\"output\",\"body\":{\"category\":\"stdout\",\"output\":\"\"}}");
        emit("{\"seq\":3,\"type\":\"event\",\"event\":\"exited\",\"body\":{\"exitCode\":7}}");
        emit("{\"seq\":4,\"type\":\"event\",\"event\":\"terminated\"}");
        Session session = sessionOverEmittedFrames();
        SessionData data = new SessionData();
        DebugSessionRunner runner = new DebugSessionRunner(session, data, new AdapterProperties(), new SessionProperties());
        while (session.queueMessages(0)) {
            // queue everything the adapter emitted
        }

        while (!session.pendingEvents().isEmpty()) {
            runner.dispatch(session.pendingEvents().get(0).message());
        }

        assertThat(session.handledEvents()).hasSize(4);
        assertThat(session.failedMessages()).isEmpty();
        assertThat(data.output()).extracting(OutputEventBody::category).containsExactly("stdout");
        assertThat(data.status()).isEqualTo(DebuggeeStatus.EXITED);
        assertThat(data.exitCode()).hasValue(7);
        assertThat(runner.isFinished()).isTrue();
    }
}
