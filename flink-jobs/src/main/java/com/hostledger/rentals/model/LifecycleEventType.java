package com.hostledger.rentals.model;

public enum LifecycleEventType {
    START,
    END,
    PAUSE,
    RESUME,
    MACHINE_ERROR,
    MACHINE_RECOVERY
}
