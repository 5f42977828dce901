package dev.debugclient.client.data;

import java.util.HashMap;
import java.util.Map;

/**
 * Append-only string interning. Each distinct value is stored once and the stored instance is returned for the
 * lifetime of the store.
 */
public class StringStore {

    private final Map<String, String> strings = new HashMap<>();

    public String getAndPut(String value) {
        String stored = strings.get(value);
        if (stored == null) {
            stored = new String(value);
            strings.put(stored, stored);
        }
        return stored;
    }

    public boolean contains(String value) {
        return strings.containsKey(value);
    }

    public int size() {
        return strings.size();
    }
}
