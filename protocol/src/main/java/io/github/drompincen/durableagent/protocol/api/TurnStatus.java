package io.github.drompincen.durableagent.protocol.api;

public enum TurnStatus {
    COMPLETED,
    AWAITING_INPUT,
    FAILED
}
