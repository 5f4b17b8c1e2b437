package com.cloudalerts.engine.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import com.cloudalerts.engine.domain.store.StoredAlertRecord;
import org.junit.jupiter.api.Test;

class InMemoryAlertRecordStoreTest {

    private final InMemoryAlertRecordStore store = new InMemoryAlertRecordStore();

    @Test
    void shouldLoadRecordsInIdOrder() {
        // given
        store.put(3, new byte[] {3});
        store.put(1, new byte[] {1});
        store.put(2, new byte[] {2});

        // when
        var loaded = store.loadAll();

        // then
        assertThat(loaded).extracting(StoredAlertRecord::alertId).containsExactly(1, 2, 3);
    }

    @Test
    void shouldReplaceRecordWithSameId() {
        // given
        store.put(1, new byte[] {1});

        // when
        store.put(1, new byte[] {9, 9});

        // then
        assertThat(store.loadAll()).singleElement()
                .satisfies(record -> assertThat(record.data()).containsExactly(9, 9));
    }

    @Test
    void shouldNotShareBytesWithCaller() {
        // given
        var data = new byte[] {1};
        store.put(1, data);

        // when
        data[0] = 5;

        // then
        assertThat(store.loadAll().get(0).data()).containsExactly(1);
    }

    @Test
    void shouldDeleteSingleAndAllRecords() {
        // given
        store.put(1, new byte[] {1});
        store.put(2, new byte[] {2});

        // when
        store.delete(1);

        // then
        assertThat(store.loadAll()).extracting(StoredAlertRecord::alertId).containsExactly(2);

        // when
        store.deleteAll();

        // then
        assertThat(store.size()).isZero();
    }
}
