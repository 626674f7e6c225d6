package io.cardlink.realtime.client.generation;

public enum StreamPhase {
    IDLE,
    STREAMING,
    COMMITTED,
    ROLLED_BACK
}
