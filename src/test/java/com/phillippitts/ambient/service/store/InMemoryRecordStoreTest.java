package com.phillippitts.ambient.service.store;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryRecordStoreTest {

    private record Note(String text) { }

    private record Tag(String name) { }

    @Test
    void returnsNewestFirstPerType() {
        InMemoryRecordStore store = new InMemoryRecordStore(10);
        store.save(new Note("a"));
        store.save(new Tag("x"));
        store.save(new Note("b"));

        assertThat(store.latest(Note.class, 10)).extracting(Note::text).containsExactly("b", "a");
        assertThat(store.latest(Tag.class, 10)).extracting(Tag::name).containsExactly("x");
    }

    @Test
    void evictsOldestBeyondCapacity() {
        InMemoryRecordStore store = new InMemoryRecordStore(2);
        store.save(new Note("1"));
        store.save(new Note("2"));
        store.save(new Note("3"));

        assertThat(store.latest(Note.class, 10)).extracting(Note::text).containsExactly("3", "2");
    }

    @Test
    void appliesFilterBeforeLimit() {
        InMemoryRecordStore store = new InMemoryRecordStore(10);
        for (String s : new String[] {"standup notes", "lunch", "standup follow-up", "standup retro"}) {
            store.save(new Note(s));
        }

        assertThat(store.query(Note.class, n -> n.text().startsWith("standup"), 2))
                .extracting(Note::text)
                .containsExactly("standup retro", "standup follow-up");
    }

    @Test
    void nonPositiveLimitOrUnknownTypeYieldsEmpty() {
        InMemoryRecordStore store = new InMemoryRecordStore(10);
        store.save(new Note("a"));

        assertThat(store.latest(Note.class, 0)).isEmpty();
        assertThat(store.latest(Tag.class, 5)).isEmpty();
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new InMemoryRecordStore(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
