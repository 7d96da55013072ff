package com.hedgewise.backend.service;

import com.hedgewise.backend.event.RiskEventListener;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RiskEventDispatcherTest {

    @Test
    void deliversToEveryListenerEvenWhenOneFails() {
        RiskEventDispatcher dispatcher = new RiskEventDispatcher();
        List<String> received = new ArrayList<>();
        dispatcher.register(new RiskEventListener() {
            @Override
            public void onRiskUpdateRequired(String userId, Instant lastCalculated) {
                throw new IllegalStateException("boom");
            }
        });
        dispatcher.register(new RiskEventListener() {
            @Override
            public void onRiskUpdateRequired(String userId, Instant lastCalculated) {
                received.add(userId);
            }
        });

        dispatcher.riskUpdateRequired("alice", Instant.EPOCH);

        assertThat(received).containsExactly("alice");
    }

    @Test
    void unregisteredListenerStopsReceiving() {
        RiskEventDispatcher dispatcher = new RiskEventDispatcher();
        List<String> received = new ArrayList<>();
        RiskEventListener listener = new RiskEventListener() {
            @Override
            public void onRiskUpdateRequired(String userId, Instant lastCalculated) {
                received.add(userId);
            }
        };
        dispatcher.register(listener);
        dispatcher.riskUpdateRequired("alice", Instant.EPOCH);

        dispatcher.unregister(listener);
        dispatcher.riskUpdateRequired("bob", Instant.EPOCH);

        assertThat(received).containsExactly("alice");
        assertThat(dispatcher.listenerCount()).isZero();
    }
}
