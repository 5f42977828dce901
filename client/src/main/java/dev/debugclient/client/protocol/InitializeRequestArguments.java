package dev.debugclient.client.protocol;

import dev.debugclient.client.value.FieldVisitor;
import dev.debugclient.client.value.Marshaller;
import dev.debugclient.client.value.ProtocolValue;
import dev.debugclient.client.value.ValueCloner;
import java.util.Objects;

/**
 * Arguments of the {@code initialize} request. The boolean {@code supports*} fields are the client's
 * capabilities.
 */
public record InitializeRequestArguments(
    String clientID,
    String clientName,
    String adapterID,
    String locale,
    Boolean linesStartAt1,
    Boolean columnsStartAt1,
    PathFormat pathFormat,
    Boolean supportsVariableType,
    Boolean supportsVariablePaging,
    Boolean supportsRunInTerminalRequest,
    Boolean supportsMemoryReferences,
    Boolean supportsProgressReporting,
    Boolean supportsInvalidatedEvent,
    Boolean supportsMemoryEvent,
    Boolean supportsArgsCanBeInterpretedByShell,
    Boolean supportsStartDebuggingRequest,
    Boolean supportsANSIStyling
) implements ProtocolValue {

    public InitializeRequestArguments {
        Objects.requireNonNull(adapterID, "adapterID");
    }

    public static Builder builder(String adapterID) {
        return new Builder(adapterID);
    }

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.field("clientID", clientID);
        visitor.field("clientName", clientName);
        visitor.field("adapterID", adapterID);
        visitor.field("locale", locale);
        visitor.field("linesStartAt1", linesStartAt1);
        visitor.field("columnsStartAt1", columnsStartAt1);
        visitor.field("pathFormat", pathFormat);
        visitor.field("supportsVariableType", supportsVariableType);
        visitor.field("supportsVariablePaging", supportsVariablePaging);
        visitor.field("supportsRunInTerminalRequest", supportsRunInTerminalRequest);
        visitor.field("supportsMemoryReferences", supportsMemoryReferences);
        visitor.field("supportsProgressReporting", supportsProgressReporting);
        visitor.field("supportsInvalidatedEvent", supportsInvalidatedEvent);
        visitor.field("supportsMemoryEvent", supportsMemoryEvent);
        visitor.field("supportsArgsCanBeInterpretedByShell", supportsArgsCanBeInterpretedByShell);
        visitor.field("supportsStartDebuggingRequest", supportsStartDebuggingRequest);
        visitor.field("supportsANSIStyling", supportsANSIStyling);
    }

    @Override
    public InitializeRequestArguments deepClone(ValueCloner cloner) {
        return new InitializeRequestArguments(
            Marshaller.deepClone(cloner, clientID),
            Marshaller.deepClone(cloner, clientName),
            Marshaller.deepClone(cloner, adapterID),
            Marshaller.deepClone(cloner, locale),
            linesStartAt1,
            columnsStartAt1,
            Marshaller.deepClone(cloner, pathFormat),
            supportsVariableType,
            supportsVariablePaging,
            supportsRunInTerminalRequest,
            supportsMemoryReferences,
            supportsProgressReporting,
            supportsInvalidatedEvent,
            supportsMemoryEvent,
            supportsArgsCanBeInterpretedByShell,
            supportsStartDebuggingRequest,
            supportsANSIStyling);
    }

    public static final class Builder {

        private final String adapterID;
        private String clientID;
        private String clientName;
        private String locale;
        private Boolean linesStartAt1;
        private Boolean columnsStartAt1;
        private PathFormat pathFormat;
        private Boolean supportsVariableType;
        private Boolean supportsVariablePaging;
        private Boolean supportsRunInTerminalRequest;
        private Boolean supportsMemoryReferences;
        private Boolean supportsProgressReporting;
        private Boolean supportsInvalidatedEvent;
        private Boolean supportsMemoryEvent;
        private Boolean supportsArgsCanBeInterpretedByShell;
        private Boolean supportsStartDebuggingRequest;
        private Boolean supportsANSIStyling;

        private Builder(String adapterID) {
            this.adapterID = adapterID;
        }

        public Builder clientID(String clientID) {
            this.clientID = clientID;
            return this;
        }

        public Builder clientName(String clientName) {
            this.clientName = clientName;
            return this;
        }

        public Builder locale(String locale) {
            this.locale = locale;
            return this;
        }

        public Builder linesStartAt1(Boolean linesStartAt1) {
            this.linesStartAt1 = linesStartAt1;
            return this;
        }

        public Builder columnsStartAt1(Boolean columnsStartAt1) {
            this.columnsStartAt1 = columnsStartAt1;
            return this;
        }

        public Builder pathFormat(PathFormat pathFormat) {
            this.pathFormat = pathFormat;
            return this;
        }

        public Builder supportsVariableType(Boolean value) {
            this.supportsVariableType = value;
            return this;
        }

        public Builder supportsVariablePaging(Boolean value) {
            this.supportsVariablePaging = value;
            return this;
        }

        public Builder supportsRunInTerminalRequest(Boolean value) {
            this.supportsRunInTerminalRequest = value;
            return this;
        }

        public Builder supportsMemoryReferences(Boolean value) {
            this.supportsMemoryReferences = value;
            return this;
        }

        public Builder supportsProgressReporting(Boolean value) {
            this.supportsProgressReporting = value;
            return this;
        }

        public Builder supportsInvalidatedEvent(Boolean value) {
            this.supportsInvalidatedEvent = value;
            return this;
        }

        public Builder supportsMemoryEvent(Boolean value) {
            this.supportsMemoryEvent = value;
            return this;
        }

        public Builder supportsArgsCanBeInterpretedByShell(Boolean value) {
            this.supportsArgsCanBeInterpretedByShell = value;
            return this;
        }

        public Builder supportsStartDebuggingRequest(Boolean value) {
            this.supportsStartDebuggingRequest = value;
            return this;
        }

        public Builder supportsANSIStyling(Boolean value) {
            this.supportsANSIStyling = value;
            return this;
        }

        public InitializeRequestArguments build() {
            return new InitializeRequestArguments(clientID, clientName, adapterID, locale, linesStartAt1,
                columnsStartAt1, pathFormat, supportsVariableType, supportsVariablePaging,
                supportsRunInTerminalRequest, supportsMemoryReferences, supportsProgressReporting,
                supportsInvalidatedEvent, supportsMemoryEvent, supportsArgsCanBeInterpretedByShell,
                supportsStartDebuggingRequest, supportsANSIStyling);
        }
    }
}
