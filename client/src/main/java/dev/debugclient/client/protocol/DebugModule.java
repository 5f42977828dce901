package dev.debugclient.client.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.debugclient.client.value.FieldVisitor;
import dev.debugclient.client.value.Marshaller;
import dev.debugclient.client.value.ProtocolValue;
import dev.debugclient.client.value.ValueCloner;

/**
 * A module (library, assembly, shared object) loaded by the debuggee.
 */
public record DebugModule(
    ModuleId id,
    String name,
    String path,
    @JsonProperty("isOptimized") Boolean isOptimized,
    @JsonProperty("isUserCode") Boolean isUserCode,
    String version,
    String symbolStatus,
    String symbolFilePath,
    String dateTimeStamp,
    String addressRange
) implements ProtocolValue {

    public static DebugModule named(ModuleId id, String name) {
        return new DebugModule(id, name, null, null, null, null, null, null, null, null);
    }

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.field("id", id);
        visitor.field("name", name);
        visitor.field("path", path);
        visitor.field("isOptimized", isOptimized);
        visitor.field("isUserCode", isUserCode);
        visitor.field("version", version);
        visitor.field("symbolStatus", symbolStatus);
        visitor.field("symbolFilePath", symbolFilePath);
        visitor.field("dateTimeStamp", dateTimeStamp);
        visitor.field("addressRange", addressRange);
    }

    @Override
    public DebugModule deepClone(ValueCloner cloner) {
        return new DebugModule(
            Marshaller.deepClone(cloner, id),
            Marshaller.deepClone(cloner, name),
            Marshaller.deepClone(cloner, path),
            isOptimized,
            isUserCode,
            Marshaller.deepClone(cloner, version),
            Marshaller.deepClone(cloner, symbolStatus),
            Marshaller.deepClone(cloner, symbolFilePath),
            Marshaller.deepClone(cloner, dateTimeStamp),
            Marshaller.deepClone(cloner, addressRange));
    }
}
