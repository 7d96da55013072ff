package com.hedgewise.backend.service;

import com.hedgewise.backend.event.RiskAlert;
import com.hedgewise.backend.event.RiskEventListener;
import com.hedgewise.backend.model.HedgingRecommendation;
import com.hedgewise.backend.model.RiskAssessment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans results out to registered {@link RiskEventListener}s. A failing listener is logged and
 * skipped so it cannot fail the calculation that produced the event.
 */
@Slf4j
@Service
public class RiskEventDispatcher {

    private final List<RiskEventListener> listeners = new CopyOnWriteArrayList<>();

    public RiskEventDispatcher() {
    }

    @Autowired
    public RiskEventDispatcher(ObjectProvider<RiskEventListener> beans) {
        beans.orderedStream().forEach(listeners::add);
    }

    public void register(RiskEventListener listener) {
        listeners.add(listener);
    }

    public void unregister(RiskEventListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void riskCalculated(RiskAssessment assessment) {
        publish("riskCalculated", listener -> listener.onRiskCalculated(assessment));
    }

    public void riskAlert(RiskAlert alert) {
        publish("riskAlert", listener -> listener.onRiskAlert(alert));
    }

    public void strategiesGenerated(HedgingRecommendation recommendation) {
        publish("strategiesGenerated", listener -> listener.onStrategiesGenerated(recommendation));
    }

    public void riskUpdateRequired(String userId, Instant lastCalculated) {
        publish("riskUpdateRequired", listener -> listener.onRiskUpdateRequired(userId, lastCalculated));
    }

    private void publish(String event, Consumer<RiskEventListener> action) {
        for (RiskEventListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed handling {}", listener.getClass().getSimpleName(), event, e);
            }
        }
    }
}
