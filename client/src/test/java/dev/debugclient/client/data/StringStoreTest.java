package dev.debugclient.client.data;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class StringStoreTest {

    @Test
    void equalStringsShareOneStoredInstance() {
        StringStore store = new StringStore();
        String first = new String("main");
        String second = new String("main");

        String stored = store.getAndPut(first);

        assertThat(stored).isEqualTo("main").isNotSameAs(first);
        assertThat(store.getAndPut(second)).isSameAs(stored);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void distinctStringsAreStoredSeparately() {
        StringStore store = new StringStore();

        store.getAndPut("a");
        store.getAndPut("b");
        store.getAndPut("a");

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.contains("b")).isTrue();
        assertThat(store.contains("c")).isFalse();
    }
}
