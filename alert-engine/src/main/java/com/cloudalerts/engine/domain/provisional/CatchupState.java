package com.cloudalerts.engine.domain.provisional;

public enum CatchupState {
    IDLE,
    CATCHING_UP
}
