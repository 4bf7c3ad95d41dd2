package com.cardioclaw.app.cli;

import com.cardioclaw.common.errors.CardioclawException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Best-effort discovery before reading the cache. A scheduler that cannot be
 * reached leaves the cached state to be shown as it is.
 */
@Slf4j
final class CacheRefresh {

    private CacheRefresh() {
    }

    static void refresh(CardioclawCommand parent) {
        try {
            parent.printWarnings(parent.engine().discovery().discover(parent.locateConfig().orElse(null)).warnings());
        } catch (CardioclawException e) {
            log.debug("Refresh failed", e);
            parent.printWarnings(List.of("Refresh failed (" + e.getMessage() + "); showing cached state"));
        }
    }
}
