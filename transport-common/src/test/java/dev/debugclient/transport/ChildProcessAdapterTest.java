package dev.debugclient.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChildProcessAdapterTest {

    @Test
    void rejectsEmptyCommand() {
        assertThatThrownBy(() -> new ChildProcessAdapter("test", List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsRelativeExecutable() {
        assertThatThrownBy(() -> new ChildProcessAdapter("test", List.of("cat")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("absolute");
    }

    @Test
    void requiresSpawnBeforeUse() {
        ChildProcessAdapter adapter = new ChildProcessAdapter("test", List.of("/bin/cat"));

        assertThat(adapter.isAlive()).isFalse();
        assertThatThrownBy(adapter::stdout).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void echoesFramesThroughCat() throws IOException {
        assumeTrue(Files.isExecutable(Path.of("/bin/cat")));
        try (ChildProcessAdapter adapter = new ChildProcessAdapter("cat", List.of("/bin/cat"))) {
            adapter.spawn();
            StdioTransport transport = StdioTransport.forAdapter(adapter);

            adapter.writeAll(ContentLengthCodec.encode("{\"seq\":1,\"type\":\"event\",\"event\":\"output\"}"));

            assertThat(transport.messageExists(5000)).isTrue();
            assertThat(transport.readMessage().path("event").asText()).isEqualTo("output");
            assertThatThrownBy(adapter::spawn).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void closeDestroysAdapterWhoseInputIsBroken() throws Exception {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")));
        ChildProcessAdapter adapter = new ChildProcessAdapter("sh", List.of("/bin/sh", "-c", "exec 0<&-; exec sleep 30"));
        adapter.spawn();
        Thread.sleep(300);
        catchThrowable(() -> adapter.writeAll(new byte[] {'x'}));

        catchThrowable(adapter::close);

        long deadline = System.nanoTime() + 5_000_000_000L;
        while (adapter.isAlive() && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertThat(adapter.isAlive()).isFalse();
    }
}
