package com.caltrade.backend.model;

public enum TriggerSource {
    PUSH,
    POLL,
    MANUAL
}
