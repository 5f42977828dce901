package dev.debugclient.client.protocol;

import dev.debugclient.client.DapError;
import dev.debugclient.client.capability.AdapterCapability;
import dev.debugclient.client.value.WireEnum;
import java.util.Optional;

/**
 * Requests the client knows how to send, with the adapter capability each one requires.
 */
public enum Command implements WireEnum {
    INITIALIZE("initialize", null, null),
    LAUNCH("launch", null, null),
    CONFIGURATION_DONE("configurationDone", AdapterCapability.SUPPORTS_CONFIGURATION_DONE_REQUEST,
        DapError.ADAPTER_DOES_NOT_SUPPORT_CONFIGURATION_DONE),
    TERMINATE("terminate", AdapterCapability.SUPPORTS_TERMINATE_REQUEST, DapError.ADAPTER_DOES_NOT_SUPPORT_TERMINATE),
    DISCONNECT("disconnect", null, null),
    THREADS("threads", null, null),
    MODULES("modules", AdapterCapability.SUPPORTS_MODULES_REQUEST, DapError.ADAPTER_DOES_NOT_SUPPORT_REQUEST);

    private final String wireName;
    private final AdapterCapability requiredCapability;
    private final DapError refusal;

    Command(String wireName, AdapterCapability requiredCapability, DapError refusal) {
        this.wireName = wireName;
        this.requiredCapability = requiredCapability;
        this.refusal = refusal;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    public Optional<AdapterCapability> requiredCapability() {
        return Optional.ofNullable(requiredCapability);
    }

    /**
     * Error reported when the adapter lacks {@link #requiredCapability()}.
     */
    public DapError refusal() {
        return refusal;
    }
}
