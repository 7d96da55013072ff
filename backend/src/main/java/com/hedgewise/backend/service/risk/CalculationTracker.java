package com.hedgewise.backend.service.risk;

import com.hedgewise.backend.util.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the in-flight calculation per operation and user. Starting a new one cancels its predecessor.
 */
@Slf4j
@Component
public class CalculationTracker {

    private final Map<String, CancellationToken> inFlight = new ConcurrentHashMap<>();

    public CancellationToken start(String operation, String userId) {
        CancellationToken token = CancellationToken.create();
        CancellationToken previous = inFlight.put(key(operation, userId), token);
        if (previous != null) {
            log.info("Cancelling superseded {} for user {}", operation, userId);
            previous.cancel();
        }
        return token;
    }

    public void finish(String operation, String userId, CancellationToken token) {
        inFlight.remove(key(operation, userId), token);
    }

    public boolean isRunning(String operation, String userId) {
        return inFlight.containsKey(key(operation, userId));
    }

    private static String key(String operation, String userId) {
        return operation + ":" + userId;
    }
}
