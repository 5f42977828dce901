package dev.debugclient.client.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.debugclient.client.DapError;
import dev.debugclient.client.DapException;
import dev.debugclient.client.capability.AdapterCapabilities;
import dev.debugclient.client.capability.AdapterCapability;
import dev.debugclient.client.capability.CapabilitySets;
import dev.debugclient.client.capability.ClientCapability;
import dev.debugclient.client.protocol.Command;
import dev.debugclient.client.protocol.ConfigurationDoneArguments;
import dev.debugclient.client.protocol.DisconnectArguments;
import dev.debugclient.client.protocol.InitializeRequestArguments;
import dev.debugclient.client.protocol.LaunchRequestArguments;
import dev.debugclient.client.protocol.ModulesArguments;
import dev.debugclient.client.protocol.Request;
import dev.debugclient.client.protocol.TerminateArguments;
import dev.debugclient.client.value.Marshaller;
import dev.debugclient.client.value.ProtocolValue;
import dev.debugclient.client.value.ValueCloner;
import dev.debugclient.transport.AdapterProcess;
import dev.debugclient.transport.EndOfStreamException;
import dev.debugclient.transport.StdioTransport;
import dev.debugclient.transport.Transport;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A debug session with one adapter process.
 *
 * <p>Requests are sent with the {@code sendXRequest} methods, which return the request's seq. Incoming messages
 * are read by {@link #queueMessages(long)} into pending queues and consumed with the {@code handleX} methods,
 * which move them to the handled queues. Handled and failed messages are kept for the lifetime of the session.
 *
 * <p>Not thread safe: a session is driven from a single control thread.
 */
public class Session {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(10);

    private static final Logger LOGGER = LoggerFactory.getLogger(Session.class);

    private static final String ARGUMENTS = "arguments";

    private final AdapterProcess adapter;
    private final Function<AdapterProcess, Transport> transportFactory;
    private final Duration pollInterval;

    private Transport transport;
    private boolean died;
    private int nextSeq = 1;
    private SessionState state = SessionState.NOT_STARTED;
    private boolean adapterInitialized;

    private Set<ClientCapability> clientCapabilities = EnumSet.noneOf(ClientCapability.class);
    private AdapterCapabilities adapterCapabilities = AdapterCapabilities.none();

    private final List<RawMessage> pendingResponses = new ArrayList<>();
    private final List<RawMessage> pendingEvents = new ArrayList<>();
    private final List<RawMessage> handledResponses = new ArrayList<>();
    private final List<RawMessage> handledEvents = new ArrayList<>();
    private final List<RawMessage> failedMessages = new ArrayList<>();
    private final Map<Integer, Command> outstandingRequests = new LinkedHashMap<>();

    private long messagesReceived;
    private long responsesReceived;
    private long eventsReceived;

    private JsonNode terminatedRestartData;

    public Session(AdapterProcess adapter) {
        this(adapter, StdioTransport::forAdapter, DEFAULT_POLL_INTERVAL);
    }

    /**
     * @param transportFactory creates the transport once the adapter has been spawned
     */
    public Session(AdapterProcess adapter, Function<AdapterProcess, Transport> transportFactory, Duration pollInterval) {
        this.adapter = adapter;
        this.transportFactory = transportFactory;
        this.pollInterval = pollInterval;
    }

    public void spawnAdapter() throws IOException, DapException {
        if (died) {
            throw new DapException(DapError.ADAPTER_DIED, "Adapter " + adapter.id() + " died, start a new session");
        }
        if (transport != null) {
            throw new DapException(DapError.ADAPTER_ALREADY_SPAWNED, "Adapter " + adapter.id() + " is already running");
        }
        adapter.spawn();
        transport = transportFactory.apply(adapter);
    }

    /**
     * Blocks until the adapter process exits.
     *
     * @return the adapter's exit code
     */
    public int waitForAdapter() throws DapException, InterruptedException {
        if (transport == null) {
            throw new DapException(DapError.ADAPTER_NOT_SPAWNED, "Adapter " + adapter.id() + " was never spawned");
        }
        return adapter.waitFor();
    }

    public int sendInitRequest(InitializeRequestArguments arguments, ObjectNode extra) throws IOException, DapException {
        int seq = send(Command.INITIALIZE, arguments, extra);
        clientCapabilities = CapabilitySets.fromFields(Marshaller.toObject(arguments), ClientCapability.class);
        return seq;
    }

    public void handleInitResponse(int seq) throws DapException {
        handleResponse(seq, Command.INITIALIZE, message -> {
            ObjectNode body = Messages.optionalBody(message);
            adapterCapabilities = AdapterCapabilities.fromBody(body);
            LOGGER.debug("Adapter {} capabilities {}", adapter.id(), adapterCapabilities.supported());
        });
    }

    /**
     * Sends {@code launch}. Adapter specific launch settings go in {@code extra}.
     *
     * @throws IllegalStateException when the session was already launched
     */
    public int sendLaunchRequest(LaunchRequestArguments arguments, ObjectNode extra) throws IOException, DapException {
        requireState(SessionState.NOT_STARTED, "launch");
        return send(Command.LAUNCH, arguments, extra);
    }

    public void handleLaunchResponse(int seq) throws DapException {
        requireState(SessionState.NOT_STARTED, "handle the launch response");
        handleResponse(seq, Command.LAUNCH, message -> state = SessionState.LAUNCHED);
    }

    public int sendConfigurationDoneRequest(ConfigurationDoneArguments arguments, ObjectNode extra)
        throws IOException, DapException {
        return send(Command.CONFIGURATION_DONE, arguments, extra);
    }

    public void handleConfigurationDoneResponse(int seq) throws DapException {
        handleResponse(seq, Command.CONFIGURATION_DONE);
    }

    public int sendTerminateRequest(TerminateArguments arguments, ObjectNode extra) throws IOException, DapException {
        return send(Command.TERMINATE, arguments, extra);
    }

    public void handleTerminateResponse(int seq) throws DapException {
        handleResponse(seq, Command.TERMINATE);
    }

    public int sendDisconnectRequest(DisconnectArguments arguments, ObjectNode extra) throws IOException, DapException {
        return send(Command.DISCONNECT, arguments, extra);
    }

    public void handleDisconnectResponse(int seq) throws DapException {
        handleResponse(seq, Command.DISCONNECT, message -> state = SessionState.NOT_STARTED);
    }

    /**
     * {@code threads} takes no arguments, so {@code extra} must be empty.
     */
    public int sendThreadsRequest(ObjectNode extra) throws IOException, DapException {
        return send(Command.THREADS, null, extra);
    }

    public int sendModulesRequest(ModulesArguments arguments, ObjectNode extra) throws IOException, DapException {
        return send(Command.MODULES, arguments, extra);
    }

    /**
     * Ends the session the way {@code mode} asks for.
     *
     * @return the seq of the terminate or disconnect request
     */
    public int endSession(EndSessionMode mode) throws IOException, DapException {
        return switch (state) {
            case NOT_STARTED -> throw new DapException(DapError.SESSION_NOT_STARTED, "Nothing to end");
            case ATTACHED -> throw new UnsupportedOperationException("Ending an attached session is not supported");
            case LAUNCHED, TERMINATED -> switch (mode) {
                case TERMINATE -> sendTerminateRequest(new TerminateArguments(false), null);
                case DISCONNECT -> sendDisconnectRequest(new DisconnectArguments(false, null, null), null);
            };
        };
    }

    private int send(Command command, ProtocolValue arguments, ObjectNode extra) throws IOException, DapException {
        requireTransport();
        checkCapability(command);

        int seq = nextSeq++;
        ObjectNode message = Marshaller.toObject(new Request(seq, command, arguments));
        Marshaller.injectAllIntoAncestor(message, ARGUMENTS, extra);

        adapter.writeAll(transport.createMessage(message));
        outstandingRequests.put(seq, command);
        LOGGER.debug("Sent {} seq={}", command.wireName(), seq);
        return seq;
    }

    private void checkCapability(Command command) throws DapException {
        Optional<AdapterCapability> required = command.requiredCapability();
        if (required.isPresent() && !adapterCapabilities.supports(required.get())) {
            throw new DapException(command.refusal(),
                "Adapter " + adapter.id() + " does not declare " + required.get().wireName());
        }
    }

    private void requireState(SessionState expected, String action) {
        if (state != expected) {
            throw new IllegalStateException("Cannot " + action + " in state " + state + ", expected " + expected);
        }
    }

    private void requireTransport() throws DapException {
        if (died) {
            throw new DapException(DapError.ADAPTER_DIED, "Adapter " + adapter.id() + " died");
        }
        if (transport == null) {
            throw new DapException(DapError.ADAPTER_NOT_SPAWNED, "Adapter " + adapter.id() + " was never spawned");
        }
    }

    /**
     * Polls the transport once and queues at most one message.
     *
     * @return {@code true} when a message was queued
     */
    public boolean queueMessages(long timeoutMillis) throws IOException, DapException {
        requireTransport();
        if (!transport.messageExists(timeoutMillis)) {
            return false;
        }

        JsonNode parsed;
        try {
            parsed = transport.readMessage();
        } catch (EndOfStreamException e) {
            died = true;
            LOGGER.error("Adapter {} closed its output, the session is over", adapter.id());
            throw new DapException(DapError.END_OF_STREAM, "Adapter " + adapter.id() + " closed its output", e);
        } catch (JsonProcessingException e) {
            throw new DapException(DapError.INVALID_MESSAGE, "Adapter " + adapter.id() + " sent malformed JSON", e);
        }

        if (!(parsed instanceof ObjectNode message)) {
            throw new DapException(DapError.INVALID_MESSAGE, "Message is " + parsed.getNodeType() + ", not an object");
        }
        JsonNode type = message.get("type");
        if (type == null || !type.isTextual()) {
            throw new DapException(DapError.INVALID_MESSAGE, "Message has no string type");
        }

        RawMessage raw = new RawMessage(message, Instant.now());
        switch (type.textValue()) {
            case "response" -> {
                if (!message.has("request_seq")) {
                    throw new DapException(DapError.INVALID_MESSAGE, "Response has no request_seq");
                }
                responsesReceived++;
                pendingResponses.add(raw);
            }
            case "event" -> {
                eventsReceived++;
                pendingEvents.add(raw);
            }
            default -> throw new DapException(DapError.UNKNOWN_MESSAGE, "Unknown message type " + type.textValue());
        }
        messagesReceived++;
        LOGGER.debug("Queued {}", Messages.describe(message));
        return true;
    }

    /**
     * Queues messages until the response to {@code seq} arrives. There is no deadline: callers that need one
     * should drive {@link #queueMessages(long)} themselves.
     */
    public void waitForResponse(int seq) throws IOException, DapException {
        while (indexOfResponse(seq) < 0) {
            queueMessages(pollInterval.toMillis());
        }
    }

    /**
     * Queues messages until an event named {@code name} is pending. Unbounded, like {@link #waitForResponse(int)}.
     */
    public void waitForEvent(String name) throws IOException, DapException {
        while (indexOfEvent(name) < 0) {
            queueMessages(pollInterval.toMillis());
        }
    }

    public boolean hasResponse(int seq) throws DapException {
        return indexOfResponse(seq) >= 0;
    }

    public ObjectNode handleResponse(int seq, Command command) throws DapException {
        return handleResponse(seq, command, MessageHandler.NONE);
    }

    /**
     * Validates the pending response to {@code seq}, applies {@code handler} to it and marks it handled. A
     * response that fails validation or handling is moved to the failed messages before the error is thrown.
     * Only responses to requests this session sent and has not handled yet are accepted.
     *
     * @return the handled response
     */
    public ObjectNode handleResponse(int seq, Command command, MessageHandler handler) throws DapException {
        if (!outstandingRequests.containsKey(seq)) {
            int orphan = indexOfResponse(seq);
            if (orphan >= 0) {
                failedMessages.add(pendingResponses.remove(orphan));
                LOGGER.warn("Response seq={} answers no outstanding request", seq);
            }
            throw new DapException(DapError.REQUEST_NOT_OUTSTANDING,
                "No outstanding request with seq=" + seq + " for " + command.wireName());
        }
        int index = indexOfResponse(seq);
        if (index < 0) {
            throw new DapException(DapError.RESPONSE_DOES_NOT_EXIST, "No response to " + command.wireName() + " seq=" + seq);
        }
        RawMessage raw = pendingResponses.get(index);
        try {
            validateResponse(raw.message(), seq, command);
            handler.handle(raw.message());
        } catch (DapException e) {
            pendingResponses.remove(index);
            outstandingRequests.remove(seq);
            failedMessages.add(raw);
            LOGGER.warn("Response to {} seq={} failed: {}", command.wireName(), seq, e.getMessage());
            throw e;
        }
        pendingResponses.remove(index);
        outstandingRequests.remove(seq);
        handledResponses.add(raw);
        return raw.message();
    }

    private static void validateResponse(ObjectNode response, int seq, Command command) throws DapException {
        JsonNode success = response.get("success");
        if (success == null || !success.isBoolean()) {
            throw new DapException(DapError.INVALID_MESSAGE, "Response has no boolean success");
        }
        if (!success.booleanValue()) {
            throw new DapException(DapError.REQUEST_FAILED,
                command.wireName() + " failed: " + response.path("message").asText("no message"));
        }
        int requestSeq = Messages.seqField(response, "request_seq").orElse(-1);
        if (requestSeq != seq) {
            throw new DapException(DapError.REQUEST_RESPONSE_MISMATCHED_SEQ,
                "Expected request_seq " + seq + ", found " + requestSeq);
        }
        String actual = response.path("command").asText(null);
        if (!command.wireName().equals(actual)) {
            throw new DapException(DapError.WRONG_COMMAND_FOR_RESPONSE,
                "Expected a response to " + command.wireName() + ", found " + actual);
        }
    }

    private int indexOfResponse(int seq) throws DapException {
        for (int i = 0; i < pendingResponses.size(); i++) {
            OptionalInt requestSeq = Messages.seqField(pendingResponses.get(i).message(), "request_seq");
            if (requestSeq.isPresent() && requestSeq.getAsInt() == seq) {
                return i;
            }
        }
        return -1;
    }

    private int indexOfEvent(String name) {
        for (int i = 0; i < pendingEvents.size(); i++) {
            JsonNode event = pendingEvents.get(i).message().get("event");
            if (event != null && event.isTextual() && event.textValue().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    private int indexOfEvent(int seq) throws DapException {
        for (int i = 0; i < pendingEvents.size(); i++) {
            OptionalInt eventSeq = Messages.seqField(pendingEvents.get(i).message(), "seq");
            if (eventSeq.isPresent() && eventSeq.getAsInt() == seq) {
                return i;
            }
        }
        return -1;
    }

    public Optional<ObjectNode> findEvent(String name) {
        int index = indexOfEvent(name);
        return index < 0 ? Optional.empty() : Optional.of(pendingEvents.get(index).message());
    }

    public Optional<ObjectNode> findEvent(int seq) throws DapException {
        int index = indexOfEvent(seq);
        return index < 0 ? Optional.empty() : Optional.of(pendingEvents.get(index).message());
    }

    public ObjectNode handleNamedEvent(String name) throws DapException {
        return handleNamedEvent(name, MessageHandler.NONE);
    }

    /**
     * Applies {@code handler} to the first pending event named {@code name} and marks it handled.
     */
    public ObjectNode handleNamedEvent(String name, MessageHandler handler) throws DapException {
        int index = indexOfEvent(name);
        if (index < 0) {
            throw new DapException(DapError.EVENT_DOES_NOT_EXIST, "No pending " + name + " event");
        }
        return handleEventAt(index, handler);
    }

    public ObjectNode handleEvent(int seq) throws DapException {
        return handleEvent(seq, MessageHandler.NONE);
    }

    public ObjectNode handleEvent(int seq, MessageHandler handler) throws DapException {
        int index = indexOfEvent(seq);
        if (index < 0) {
            throw new DapException(DapError.EVENT_DOES_NOT_EXIST, "No pending event with seq=" + seq);
        }
        return handleEventAt(index, handler);
    }

    private ObjectNode handleEventAt(int index, MessageHandler handler) throws DapException {
        RawMessage raw = pendingEvents.get(index);
        try {
            handler.handle(raw.message());
        } catch (DapException e) {
            pendingEvents.remove(index);
            failedMessages.add(raw);
            LOGGER.warn("Handling {} failed: {}", Messages.describe(raw.message()), e.getMessage());
            throw e;
        }
        pendingEvents.remove(index);
        handledEvents.add(raw);
        return raw.message();
    }

    public void handleInitializedEvent() throws DapException {
        handleNamedEvent("initialized", message -> adapterInitialized = true);
    }

    /**
     * Consumes the {@code terminated} event. Restart data the adapter attached is copied so it can be handed back
     * with {@link LaunchRequestArguments#restarting(JsonNode)}.
     */
    public void handleTerminatedEvent() throws DapException {
        handleNamedEvent("terminated", message -> {
            ObjectNode body = Messages.optionalBody(message);
            JsonNode restart = body == null ? null : body.get("restart");
            terminatedRestartData = restart == null || restart.isNull()
                ? null
                : Marshaller.deepClone(ValueCloner.copying(), restart);
            if (state == SessionState.LAUNCHED) {
                state = SessionState.TERMINATED;
            }
        });
    }

    public SessionState state() {
        return state;
    }

    public boolean isAdapterInitialized() {
        return adapterInitialized;
    }

    public boolean isAdapterDead() {
        return died;
    }

    /**
     * The seq the next request will be sent with.
     */
    public int peekSeq() {
        return nextSeq;
    }

    public Set<ClientCapability> clientCapabilities() {
        return Collections.unmodifiableSet(clientCapabilities);
    }

    public AdapterCapabilities adapterCapabilities() {
        return adapterCapabilities;
    }

    public List<RawMessage> pendingResponses() {
        return Collections.unmodifiableList(pendingResponses);
    }

    public List<RawMessage> pendingEvents() {
        return Collections.unmodifiableList(pendingEvents);
    }

    public List<RawMessage> handledResponses() {
        return Collections.unmodifiableList(handledResponses);
    }

    public List<RawMessage> handledEvents() {
        return Collections.unmodifiableList(handledEvents);
    }

    public List<RawMessage> failedMessages() {
        return Collections.unmodifiableList(failedMessages);
    }

    /**
     * Requests written to the adapter whose response has not been handled yet, by seq.
     */
    public Map<Integer, Command> outstandingRequests() {
        return Collections.unmodifiableMap(outstandingRequests);
    }

    public long messagesReceived() {
        return messagesReceived;
    }

    public long responsesReceived() {
        return responsesReceived;
    }

    public long eventsReceived() {
        return eventsReceived;
    }

    /**
     * @return the restart data of the last {@code terminated} event, or {@code null}
     */
    public JsonNode terminatedRestartData() {
        return terminatedRestartData;
    }

    public Duration pollInterval() {
        return pollInterval;
    }
}
