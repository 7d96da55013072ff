package com.hedgewise.backend.model;

import java.util.List;

public record ImplementationPhase(String name, int durationDays, List<String> tasks, List<String> deliverables) {
}
