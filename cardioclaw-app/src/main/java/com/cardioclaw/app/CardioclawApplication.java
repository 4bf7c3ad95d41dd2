package com.cardioclaw.app;

import com.cardioclaw.app.dashboard.DashboardProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Spring Boot application hosting the dashboard JSON API. Started by
 * {@code cardioclaw dashboard}; running it directly serves with the defaults
 * from {@code application.yml}.
 */
@SpringBootApplication
@EnableConfigurationProperties(DashboardProperties.class)
public class CardioclawApplication {

    public static void main(String[] args) {
        SpringApplication.run(CardioclawApplication.class, args);
    }
}
