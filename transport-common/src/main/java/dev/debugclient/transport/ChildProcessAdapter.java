package dev.debugclient.transport;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the adapter as a child process with piped standard input and output. The adapter's standard error is
 * inherited so its diagnostics end up next to ours.
 */
public class ChildProcessAdapter implements AdapterProcess, Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChildProcessAdapter.class);

    private final String id;
    private final List<String> command;

    private Process process;
    private OutputStream stdin;

    public ChildProcessAdapter(String id, List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Adapter command is empty");
        }
        if (!Path.of(command.get(0)).isAbsolute()) {
            throw new IllegalArgumentException("Adapter command is not an absolute path: " + command.get(0));
        }
        this.id = id;
        this.command = List.copyOf(command);
    }

    @Override
    public String id() {
        return id;
    }

    public List<String> command() {
        return command;
    }

    @Override
    public void spawn() throws IOException {
        if (process != null && process.isAlive()) {
            throw new IllegalStateException("Adapter " + id + " is already running");
        }
        process = new ProcessBuilder(command)
            .redirectError(ProcessBuilder.Redirect.INHERIT)
            .start();
        stdin = process.getOutputStream();
        LOGGER.info("Spawned adapter {} pid={} command={}", id, process.pid(), command);
    }

    @Override
    public boolean isAlive() {
        return process != null && process.isAlive();
    }

    @Override
    public int waitFor() throws InterruptedException {
        requireSpawned();
        int exitCode = process.waitFor();
        LOGGER.info("Adapter {} exited with {}", id, exitCode);
        return exitCode;
    }

    @Override
    public void writeAll(byte[] message) throws IOException {
        requireSpawned();
        synchronized (this) {
            stdin.write(message);
            stdin.flush();
        }
    }

    @Override
    public InputStream stdout() {
        requireSpawned();
        return process.getInputStream();
    }

    private void requireSpawned() {
        if (process == null) {
            throw new IllegalStateException("Adapter " + id + " has not been spawned");
        }
    }

    @Override
    public void close() throws IOException {
        if (process == null) {
            return;
        }
        try {
            stdin.close();
            if (!process.waitFor(500, TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Adapter {} did not exit after its input closed, destroying it", id);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            // no-op once the process has exited
            process.destroy();
        }
    }
}
