package dev.debugclient.client.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.debugclient.client.DapError;
import dev.debugclient.client.DapException;
import dev.debugclient.client.protocol.Command;
import dev.debugclient.client.protocol.ContinuedEventBody;
import dev.debugclient.client.protocol.DebugModule;
import dev.debugclient.client.protocol.DebugThread;
import dev.debugclient.client.protocol.ExitedEventBody;
import dev.debugclient.client.protocol.ModuleEventBody;
import dev.debugclient.client.protocol.ModuleEventReason;
import dev.debugclient.client.protocol.ModuleId;
import dev.debugclient.client.protocol.OutputEventBody;
import dev.debugclient.client.protocol.StoppedEventBody;
import dev.debugclient.client.session.Messages;
import dev.debugclient.client.session.Session;
import dev.debugclient.client.value.Marshaller;
import dev.debugclient.client.value.ValueCloner;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Snapshot of what the adapter reported about the debuggee, built from the session's events and responses:
 * modules, threads and their stop state, the output log and the debuggee's status. Every string held here is
 * interned in {@link #strings()}.
 */
public class SessionData {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionData.class);

    private final StringStore strings = new StringStore();
    private final ValueCloner interning = strings::getAndPut;
    private final List<DebugModule> modules = new ArrayList<>();
    private final List<DebugThread> threads = new ArrayList<>();
    private final Map<Integer, ThreadState> threadStates = new LinkedHashMap<>();
    private final Map<Integer, StoppedEventBody> stops = new LinkedHashMap<>();
    private final List<OutputEventBody> output = new ArrayList<>();

    private DebuggeeStatus status = DebuggeeStatus.NOT_RUNNING;
    private Integer exitCode;

    /**
     * Consumes the next pending {@code module} event.
     */
    public void handleEventModules(Session session) throws DapException {
        session.handleNamedEvent("module", message -> {
            ModuleEventBody body = Marshaller.decode(Messages.body(message), ModuleEventBody.class);
            if (body.reason() == null || body.module() == null) {
                throw new DapException(DapError.INVALID_MESSAGE, "Module event needs a reason and a module");
            }
            if (body.reason() == ModuleEventReason.REMOVED) {
                removeModule(body.module().id());
            } else {
                addModule(body.module());
            }
        });
    }

    public void handleResponseThreads(Session session, int seq) throws DapException {
        session.handleResponse(seq, Command.THREADS, message -> {
            JsonNode array = Messages.body(message).get("threads");
            setThreads(Marshaller.decodeList(array, DebugThread.class));
        });
    }

    /**
     * Consumes the response to the {@code modules} request {@code seq}. The whole response is checked before any
     * module is added, so a rejected response leaves the known modules untouched.
     */
    public void handleResponseModules(Session session, int seq) throws DapException {
        session.handleResponse(seq, Command.MODULES, message -> {
            ObjectNode body = Messages.body(message);
            List<DebugModule> incoming = Marshaller.decodeList(body.get("modules"), DebugModule.class);
            for (DebugModule module : incoming) {
                requireId(module);
            }
            for (DebugModule module : incoming) {
                addModule(module);
            }
        });
    }

    public void handleEventStopped(Session session) throws DapException {
        session.handleNamedEvent("stopped", message -> {
            StoppedEventBody body = Marshaller.decode(Messages.body(message), StoppedEventBody.class);
            if (body.reason() == null) {
                throw new DapException(DapError.INVALID_MESSAGE, "Stopped event has no reason");
            }
            setStopped(body);
        });
    }

    public void handleEventContinued(Session session) throws DapException {
        session.handleNamedEvent("continued", message -> {
            ContinuedEventBody body = Marshaller.decode(Messages.body(message), ContinuedEventBody.class);
            if (body.threadId() == null) {
                throw new DapException(DapError.INVALID_MESSAGE, "Continued event has no threadId");
            }
            setContinued(body);
        });
    }

    public void handleEventExited(Session session) throws DapException {
        session.handleNamedEvent("exited", message -> {
            ExitedEventBody body = Marshaller.decode(Messages.body(message), ExitedEventBody.class);
            if (body.exitCode() == null) {
                throw new DapException(DapError.INVALID_MESSAGE, "Exited event has no exitCode");
            }
            status = DebuggeeStatus.EXITED;
            exitCode = body.exitCode();
        });
    }

    /**
     * Consumes the {@code terminated} event through {@link Session#handleTerminatedEvent()}, which keeps the
     * restart data. An exited debuggee keeps its exit status.
     */
    public void handleEventTerminated(Session session) throws DapException {
        session.handleTerminatedEvent();
        if (status != DebuggeeStatus.EXITED) {
            status = DebuggeeStatus.NOT_RUNNING;
        }
    }

    public void handleEventOutput(Session session) throws DapException {
        session.handleNamedEvent("output", message -> {
            OutputEventBody body = Marshaller.decode(Messages.body(message), OutputEventBody.class);
            if (body.output() == null) {
                throw new DapException(DapError.INVALID_MESSAGE, "Output event has no output");
            }
            addOutput(body);
        });
    }

    /**
     * Stores {@code module} unless a module with the same id is already known. Known modules are not refreshed.
     *
     * @return whether the module was added
     * @throws DapException when the module has no id
     */
    public boolean addModule(DebugModule module) throws DapException {
        requireId(module);
        for (DebugModule known : modules) {
            if (known.id().equals(module.id())) {
                return false;
            }
        }
        modules.add(Marshaller.deepClone(interning, module));
        LOGGER.debug("Module {} {}", module.id(), module.name());
        return true;
    }

    private static void requireId(DebugModule module) throws DapException {
        if (module == null || module.id() == null) {
            throw new DapException(DapError.INVALID_MESSAGE, "Module has no id");
        }
    }

    public boolean removeModule(ModuleId id) {
        Iterator<DebugModule> iterator = modules.iterator();
        while (iterator.hasNext()) {
            if (iterator.next().id().equals(id)) {
                iterator.remove();
                return true;
            }
        }
        return false;
    }

    /**
     * Replaces the thread snapshot. Threads that are gone lose their stop state, the others keep it.
     */
    public void setThreads(List<DebugThread> incoming) {
        threads.clear();
        Set<Integer> ids = new HashSet<>();
        for (DebugThread thread : incoming) {
            threads.add(Marshaller.deepClone(interning, thread));
            ids.add(thread.id());
        }
        threadStates.keySet().retainAll(ids);
        stops.keySet().retainAll(ids);
    }

    /**
     * Records a stop. The stopped thread keeps the event's details. When all threads stopped, every other known
     * thread that was not already stopped is marked stopped without details.
     */
    public void setStopped(StoppedEventBody stopped) {
        StoppedEventBody interned = Marshaller.deepClone(interning, stopped);
        if (interned.threadId() != null) {
            threadStates.put(interned.threadId(), ThreadState.STOPPED);
            stops.put(interned.threadId(), interned);
        }
        if (interned.stopsAllThreads()) {
            for (Integer id : knownThreadIds()) {
                threadStates.put(id, ThreadState.STOPPED);
            }
        }
        status = DebuggeeStatus.STOPPED;
    }

    public void setContinued(ContinuedEventBody continued) {
        Set<Integer> resumed = continued.continuesAllThreads() ? knownThreadIds() : new LinkedHashSet<>();
        resumed.add(continued.threadId());
        for (Integer id : resumed) {
            threadStates.put(id, ThreadState.CONTINUED);
            stops.remove(id);
        }
        status = DebuggeeStatus.RUNNING;
    }

    public void addOutput(OutputEventBody body) {
        output.add(Marshaller.deepClone(interning, body));
    }

    private Set<Integer> knownThreadIds() {
        Set<Integer> ids = new LinkedHashSet<>();
        for (DebugThread thread : threads) {
            ids.add(thread.id());
        }
        ids.addAll(threadStates.keySet());
        return ids;
    }

    public ThreadState threadState(int threadId) {
        return threadStates.getOrDefault(threadId, ThreadState.UNKNOWN);
    }

    /**
     * @return the details of the stop that last named {@code threadId}, empty when the thread is running or was
     *     only stopped as part of an all-threads stop
     */
    public Optional<StoppedEventBody> stopOf(int threadId) {
        return Optional.ofNullable(stops.get(threadId));
    }

    public List<OutputEventBody> output() {
        return Collections.unmodifiableList(output);
    }

    public DebuggeeStatus status() {
        return status;
    }

    /**
     * @return the exit code once the debuggee exited
     */
    public OptionalInt exitCode() {
        return exitCode == null ? OptionalInt.empty() : OptionalInt.of(exitCode);
    }

    public List<DebugModule> modules() {
        return Collections.unmodifiableList(modules);
    }

    public List<DebugThread> threads() {
        return Collections.unmodifiableList(threads);
    }

    public StringStore strings() {
        return strings;
    }
}
