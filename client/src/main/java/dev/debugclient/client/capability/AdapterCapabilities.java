package dev.debugclient.client.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.debugclient.client.DapException;
import dev.debugclient.client.protocol.BreakpointMode;
import dev.debugclient.client.protocol.ChecksumAlgorithm;
import dev.debugclient.client.protocol.ColumnDescriptor;
import dev.debugclient.client.protocol.ExceptionBreakpointsFilter;
import dev.debugclient.client.value.Marshaller;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * What the adapter declared in its initialize response: the boolean feature flags plus the auxiliary arrays.
 */
public final class AdapterCapabilities {

    private static final AdapterCapabilities NONE = new AdapterCapabilities(EnumSet.noneOf(AdapterCapability.class),
        List.of(), List.of(), List.of(), List.of(), List.of());

    private final Set<AdapterCapability> supported;
    private final List<String> completionTriggerCharacters;
    private final List<ExceptionBreakpointsFilter> exceptionBreakpointFilters;
    private final List<ColumnDescriptor> additionalModuleColumns;
    private final List<ChecksumAlgorithm> supportedChecksumAlgorithms;
    private final List<BreakpointMode> breakpointModes;

    private AdapterCapabilities(EnumSet<AdapterCapability> supported,
                                List<String> completionTriggerCharacters,
                                List<ExceptionBreakpointsFilter> exceptionBreakpointFilters,
                                List<ColumnDescriptor> additionalModuleColumns,
                                List<ChecksumAlgorithm> supportedChecksumAlgorithms,
                                List<BreakpointMode> breakpointModes) {
        this.supported = Collections.unmodifiableSet(supported);
        this.completionTriggerCharacters = List.copyOf(completionTriggerCharacters);
        this.exceptionBreakpointFilters = List.copyOf(exceptionBreakpointFilters);
        this.additionalModuleColumns = List.copyOf(additionalModuleColumns);
        this.supportedChecksumAlgorithms = List.copyOf(supportedChecksumAlgorithms);
        this.breakpointModes = List.copyOf(breakpointModes);
    }

    public static AdapterCapabilities none() {
        return NONE;
    }

    /**
     * Reads the capabilities from an initialize response body. A missing body means the adapter supports
     * nothing optional.
     */
    public static AdapterCapabilities fromBody(ObjectNode body) throws DapException {
        if (body == null) {
            return NONE;
        }
        return new AdapterCapabilities(
            CapabilitySets.fromFields(body, AdapterCapability.class),
            listField(body, "completionTriggerCharacters", String.class),
            listField(body, "exceptionBreakpointFilters", ExceptionBreakpointsFilter.class),
            listField(body, "additionalModuleColumns", ColumnDescriptor.class),
            listField(body, "supportedChecksumAlgorithms", ChecksumAlgorithm.class),
            listField(body, "breakpointModes", BreakpointMode.class));
    }

    private static <T> List<T> listField(ObjectNode body, String name, Class<T> type) throws DapException {
        JsonNode field = body.get(name);
        if (field == null || field.isNull()) {
            return List.of();
        }
        return Marshaller.decodeList(field, type);
    }

    public boolean supports(AdapterCapability capability) {
        return supported.contains(capability);
    }

    public Set<AdapterCapability> supported() {
        return supported;
    }

    public List<String> completionTriggerCharacters() {
        return completionTriggerCharacters;
    }

    public List<ExceptionBreakpointsFilter> exceptionBreakpointFilters() {
        return exceptionBreakpointFilters;
    }

    public List<ColumnDescriptor> additionalModuleColumns() {
        return additionalModuleColumns;
    }

    public List<ChecksumAlgorithm> supportedChecksumAlgorithms() {
        return supportedChecksumAlgorithms;
    }

    public List<BreakpointMode> breakpointModes() {
        return breakpointModes;
    }

    @Override
    public String toString() {
        return "AdapterCapabilities" + supported;
    }
}
