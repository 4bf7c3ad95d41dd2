package com.cardioclaw.app.dashboard;

import com.cardioclaw.engine.CardioclawEngine;
import com.cardioclaw.engine.discovery.DiscoveryResult;
import com.cardioclaw.engine.store.CacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * The engine as seen by the dashboard: cache reads and discovery against the
 * configured declarative file.
 */
@Slf4j
@Service
public class DashboardService {

    private final CardioclawEngine engine;
    private final DashboardProperties properties;

    public DashboardService(CardioclawEngine engine, DashboardProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    public CacheStore cache() {
        return engine.cache();
    }

    public DiscoveryResult refresh() {
        DiscoveryResult result = engine.discovery().discover(configPath());
        log.info("Refreshed: {} job(s), {} new run(s)", result.found(), result.runsRecorded());
        return result;
    }

    Path configPath() {
        return engine.configLocator().locate(properties.getConfig()).orElse(null);
    }
}
