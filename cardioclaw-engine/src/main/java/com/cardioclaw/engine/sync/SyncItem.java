package com.cardioclaw.engine.sync;

import com.cardioclaw.common.errors.ErrorKind;

import java.util.List;

/**
 * What happened to one declared heartbeat.
 *
 * @param args      the {@code cron add} arguments, when a command was built
 * @param error     failure message for {@link Action#FAILED}
 * @param errorKind failure category for {@link Action#FAILED}
 */
public record SyncItem(String name, Action action, List<String> args, String error, ErrorKind errorKind) {

    public enum Action {
        CREATED,
        REPLACED,
        SKIPPED,
        WOULD_CREATE,
        WOULD_REPLACE,
        FAILED
    }

    public SyncItem {
        args = args == null ? List.of() : List.copyOf(args);
    }

    static SyncItem of(String name, Action action, List<String> args) {
        return new SyncItem(name, action, args, null, null);
    }

    static SyncItem failed(String name, String error, ErrorKind kind) {
        return new SyncItem(name, Action.FAILED, null, error, kind);
    }

    public String displayName() {
        return name == null || name.isBlank() ? "unnamed" : name;
    }
}
