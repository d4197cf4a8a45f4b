package com.hookrelay.common.store;

import com.hookrelay.common.exception.StoreUnavailableException;
import com.hookrelay.common.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AtomicStoreHealthIndicator Tests")
class AtomicStoreHealthIndicatorTest {

    @Test
    @DisplayName("Should report UP and leave no probe key behind")
    void shouldReportUp() {
        LocalAtomicStore store = new LocalAtomicStore(MutableClock.at(0L));

        Health health = new AtomicStoreHealthIndicator(store).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("Should report DOWN when the store fails")
    void shouldReportDown() {
        AtomicStore broken = new AtomicStore() {
            @Override
            public String get(String key) {
                throw new StoreUnavailableException("down");
            }

            @Override
            public void set(String key, String value, long ttlSeconds) {
                throw new StoreUnavailableException("down");
            }

            @Override
            public boolean setIfNotExists(String key, String value, long ttlSeconds) {
                throw new StoreUnavailableException("down");
            }

            @Override
            public long executeScript(AtomicScript script, List<String> keys, String... args) {
                throw new StoreUnavailableException("down");
            }

            @Override
            public boolean delete(String key) {
                throw new StoreUnavailableException("down");
            }

            @Override
            public boolean exists(String key) {
                throw new StoreUnavailableException("down");
            }
        };

        assertThat(new AtomicStoreHealthIndicator(broken).health().getStatus()).isEqualTo(Status.DOWN);
    }
}
