package com.p14n.eventbus.receiver;

public enum ReceiverState {
    UNSPAWNED,
    RUNNING,
    TERMINATED
}
