package dev.debugclient.transport;

import java.io.IOException;
import java.io.InputStream;

/**
 * Supervises the debug adapter subprocess.
 */
public interface AdapterProcess {

    String id();

    void spawn() throws IOException;

    boolean isAlive();

    /**
     * Blocks until the adapter exits.
     *
     * @return the adapter's exit code
     */
    int waitFor() throws InterruptedException;

    void writeAll(byte[] message) throws IOException;

    InputStream stdout();
}
