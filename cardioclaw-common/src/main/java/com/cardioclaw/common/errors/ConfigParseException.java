package com.cardioclaw.common.errors;

import java.nio.file.Path;

/**
 * The declarative file exists but is not valid YAML or lacks a heartbeats list.
 */
public class ConfigParseException extends CardioclawException {

    private final Path path;

    public ConfigParseException(Path path, String message) {
        super(ErrorKind.CONFIG_PARSE, message);
        this.path = path;
    }

    public ConfigParseException(Path path, String message, Throwable cause) {
        super(ErrorKind.CONFIG_PARSE, message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
