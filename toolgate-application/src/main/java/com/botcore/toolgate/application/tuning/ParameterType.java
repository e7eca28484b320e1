package com.botcore.toolgate.application.tuning;

public enum ParameterType {
    NUMBER,
    ENUM,
    BOOLEAN
}
