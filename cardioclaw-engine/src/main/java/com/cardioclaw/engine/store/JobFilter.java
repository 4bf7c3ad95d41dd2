package com.cardioclaw.engine.store;

public enum JobFilter {
    ALL,
    MANAGED,
    UNMANAGED,
    FAILING,
    ACTIVE
}
