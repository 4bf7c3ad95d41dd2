package com.cardioclaw.common.errors;

import java.nio.file.Path;
import java.util.List;

/**
 * No declarative file exists at any of the checked locations.
 */
public class ConfigNotFoundException extends CardioclawException {

    private final List<Path> checked;

    public ConfigNotFoundException(List<Path> checked) {
        super(ErrorKind.CONFIG_NOT_FOUND, buildMessage(checked));
        this.checked = List.copyOf(checked);
    }

    public List<Path> getChecked() {
        return checked;
    }

    private static String buildMessage(List<Path> checked) {
        StringBuilder sb = new StringBuilder("No cardioclaw.yaml found. Checked:");
        for (Path path : checked) {
            sb.append("\n  - ").append(path);
        }
        return sb.toString();
    }
}
