package com.cardioclaw.app.dashboard;

import com.cardioclaw.common.config.OpenClawSettings;
import com.cardioclaw.engine.CardioclawEngine;
import com.cardioclaw.engine.EngineSettings;
import com.cardioclaw.engine.command.TimezoneResolver;
import com.cardioclaw.engine.scheduler.SchedulerClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Engine and HTTP plumbing for the dashboard.
 */
@Slf4j
@Configuration
public class DashboardBeanConfig {

    /**
     * Uses a {@link SchedulerClient} bean when the context provides one,
     * otherwise the {@code openclaw} CLI.
     */
    @Bean
    public CardioclawEngine cardioclawEngine(DashboardProperties properties,
                                             ObjectProvider<SchedulerClient> schedulerClient) {
        String database = properties.getDatabase();
        EngineSettings settings = EngineSettings.fromEnvironment()
                .withDatabase(database == null || database.isBlank() ? null : Path.of(database));
        SchedulerClient scheduler = schedulerClient.getIfAvailable();
        if (scheduler == null) {
            return CardioclawEngine.create(settings);
        }
        log.info("Using scheduler client {}", scheduler.getClass().getSimpleName());
        return new CardioclawEngine(settings, scheduler,
                new TimezoneResolver(new OpenClawSettings(settings.paths().openclawConfig())), Clock.systemUTC());
    }

    @Bean
    public RefreshRateLimiter refreshRateLimiter(DashboardProperties properties) {
        return new RefreshRateLimiter(properties.getRefreshInterval(), Clock.systemUTC());
    }

    @Bean
    public OccurrenceCalculator occurrenceCalculator() {
        return new OccurrenceCalculator();
    }

    @Bean
    public FilterRegistrationBean<SecurityHeadersFilter> securityHeadersFilter() {
        FilterRegistrationBean<SecurityHeadersFilter> registration =
                new FilterRegistrationBean<>(new SecurityHeadersFilter());
        registration.setOrder(1);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<TokenAuthFilter> tokenAuthFilter(DashboardProperties properties) {
        FilterRegistrationBean<TokenAuthFilter> registration =
                new FilterRegistrationBean<>(new TokenAuthFilter(properties.getToken()));
        registration.setOrder(2);
        return registration;
    }
}
