package com.cardioclaw.app.dashboard;

import com.cardioclaw.common.errors.CardioclawException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Fills the cache once when the server starts. A scheduler that cannot be
 * reached leaves the server up with whatever was cached.
 */
@Slf4j
@Component
public class StartupRefresh implements ApplicationRunner {

    private final DashboardService service;
    private final DashboardProperties properties;

    public StartupRefresh(DashboardService service, DashboardProperties properties) {
        this.service = service;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRefreshOnStartup())
            return;
        try {
            service.refresh();
        } catch (CardioclawException e) {
            log.warn("Initial refresh failed: {}", e.getMessage());
        }
    }
}
