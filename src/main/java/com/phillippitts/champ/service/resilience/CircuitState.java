package com.phillippitts.champ.service.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
