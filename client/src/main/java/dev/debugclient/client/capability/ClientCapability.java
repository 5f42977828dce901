package dev.debugclient.client.capability;

import dev.debugclient.client.value.WireEnum;

/**
 * Features the client announces in its initialize request arguments.
 */
public enum ClientCapability implements WireEnum {
    SUPPORTS_VARIABLE_TYPE("supportsVariableType"),
    SUPPORTS_VARIABLE_PAGING("supportsVariablePaging"),
    SUPPORTS_RUN_IN_TERMINAL_REQUEST("supportsRunInTerminalRequest"),
    SUPPORTS_MEMORY_REFERENCES("supportsMemoryReferences"),
    SUPPORTS_PROGRESS_REPORTING("supportsProgressReporting"),
    SUPPORTS_INVALIDATED_EVENT("supportsInvalidatedEvent"),
    SUPPORTS_MEMORY_EVENT("supportsMemoryEvent"),
    SUPPORTS_ARGS_CAN_BE_INTERPRETED_BY_SHELL("supportsArgsCanBeInterpretedByShell"),
    SUPPORTS_START_DEBUGGING_REQUEST("supportsStartDebuggingRequest"),
    SUPPORTS_ANSI_STYLING("supportsANSIStyling");

    private final String wireName;

    ClientCapability(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
