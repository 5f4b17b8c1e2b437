package com.cloudalerts.engine.domain.noted;

public enum NodeType {
    FILE,
    FOLDER
}
