package dev.debugclient.client.capability;

import dev.debugclient.client.value.WireEnum;

/**
 * Features the adapter declares in the body of its initialize response.
 */
public enum AdapterCapability implements WireEnum {
    SUPPORTS_CONFIGURATION_DONE_REQUEST("supportsConfigurationDoneRequest"),
    SUPPORTS_FUNCTION_BREAKPOINTS("supportsFunctionBreakpoints"),
    SUPPORTS_CONDITIONAL_BREAKPOINTS("supportsConditionalBreakpoints"),
    SUPPORTS_HIT_CONDITIONAL_BREAKPOINTS("supportsHitConditionalBreakpoints"),
    SUPPORTS_EVALUATE_FOR_HOVERS("supportsEvaluateForHovers"),
    SUPPORTS_STEP_BACK("supportsStepBack"),
    SUPPORTS_SET_VARIABLE("supportsSetVariable"),
    SUPPORTS_RESTART_FRAME("supportsRestartFrame"),
    SUPPORTS_GOTO_TARGETS_REQUEST("supportsGotoTargetsRequest"),
    SUPPORTS_STEP_IN_TARGETS_REQUEST("supportsStepInTargetsRequest"),
    SUPPORTS_COMPLETIONS_REQUEST("supportsCompletionsRequest"),
    SUPPORTS_MODULES_REQUEST("supportsModulesRequest"),
    SUPPORTS_RESTART_REQUEST("supportsRestartRequest"),
    SUPPORTS_EXCEPTION_OPTIONS("supportsExceptionOptions"),
    SUPPORTS_VALUE_FORMATTING_OPTIONS("supportsValueFormattingOptions"),
    SUPPORTS_EXCEPTION_INFO_REQUEST("supportsExceptionInfoRequest"),
    SUPPORT_TERMINATE_DEBUGGEE("supportTerminateDebuggee"),
    SUPPORT_SUSPEND_DEBUGGEE("supportSuspendDebuggee"),
    SUPPORTS_DELAYED_STACK_TRACE_LOADING("supportsDelayedStackTraceLoading"),
    SUPPORTS_LOADED_SOURCES_REQUEST("supportsLoadedSourcesRequest"),
    SUPPORTS_LOG_POINTS("supportsLogPoints"),
    SUPPORTS_TERMINATE_THREADS_REQUEST("supportsTerminateThreadsRequest"),
    SUPPORTS_SET_EXPRESSION("supportsSetExpression"),
    SUPPORTS_TERMINATE_REQUEST("supportsTerminateRequest"),
    SUPPORTS_DATA_BREAKPOINTS("supportsDataBreakpoints"),
    SUPPORTS_READ_MEMORY_REQUEST("supportsReadMemoryRequest"),
    SUPPORTS_WRITE_MEMORY_REQUEST("supportsWriteMemoryRequest"),
    SUPPORTS_DISASSEMBLE_REQUEST("supportsDisassembleRequest"),
    SUPPORTS_CANCEL_REQUEST("supportsCancelRequest"),
    SUPPORTS_BREAKPOINT_LOCATIONS_REQUEST("supportsBreakpointLocationsRequest"),
    SUPPORTS_CLIPBOARD_CONTEXT("supportsClipboardContext"),
    SUPPORTS_STEPPING_GRANULARITY("supportsSteppingGranularity"),
    SUPPORTS_INSTRUCTION_BREAKPOINTS("supportsInstructionBreakpoints"),
    SUPPORTS_EXCEPTION_FILTER_OPTIONS("supportsExceptionFilterOptions"),
    SUPPORTS_SINGLE_THREAD_EXECUTION_REQUESTS("supportsSingleThreadExecutionRequests"),
    SUPPORTS_ANSI_STYLING("supportsANSIStyling");

    private final String wireName;

    AdapterCapability(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
