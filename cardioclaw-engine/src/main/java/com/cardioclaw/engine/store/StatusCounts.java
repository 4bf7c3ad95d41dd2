package com.cardioclaw.engine.store;

public record StatusCounts(int total, int managed, int unmanaged, int active, int failing, int disabled) {
}
