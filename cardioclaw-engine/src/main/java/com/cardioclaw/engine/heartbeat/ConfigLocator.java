package com.cardioclaw.engine.heartbeat;

import com.cardioclaw.common.config.CardioclawPaths;
import com.cardioclaw.common.errors.ConfigNotFoundException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the declarative file: the explicit path, then
 * {@code ./cardioclaw.yaml}, then the file in the state directory.
 */
public class ConfigLocator {

    private final Path workingDir;
    private final Path homeConfig;

    public ConfigLocator(CardioclawPaths paths) {
        this(Path.of("").toAbsolutePath(), paths.homeConfig());
    }

    public ConfigLocator(Path workingDir, Path homeConfig) {
        this.workingDir = workingDir;
        this.homeConfig = homeConfig;
    }

    public Path getHomeConfig() {
        return homeConfig;
    }

    public List<Path> candidates(String explicit) {
        List<Path> checked = new ArrayList<>();
        if (explicit != null && !explicit.isBlank()) {
            checked.add(workingDir.resolve(explicit.trim()).normalize());
        }
        Path local = workingDir.resolve(CardioclawPaths.CONFIG_FILENAME).normalize();
        if (!checked.contains(local)) {
            checked.add(local);
        }
        if (!checked.contains(homeConfig)) {
            checked.add(homeConfig);
        }
        return checked;
    }

    public Optional<Path> locate(String explicit) {
        for (Path candidate : candidates(explicit)) {
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * @throws ConfigNotFoundException listing every location checked
     */
    public Path require(String explicit) {
        return locate(explicit).orElseThrow(() -> new ConfigNotFoundException(candidates(explicit)));
    }

    /**
     * Target for operations that may create the file: an existing candidate,
     * else the explicit path when one is given, else the state-directory file.
     */
    public Path resolveForWrite(String explicit) {
        Optional<Path> existing = locate(explicit);
        if (existing.isPresent())
            return existing.get();
        if (explicit != null && !explicit.isBlank() && !CardioclawPaths.CONFIG_FILENAME.equals(explicit.trim()))
            return workingDir.resolve(explicit.trim()).normalize();
        return homeConfig;
    }
}
