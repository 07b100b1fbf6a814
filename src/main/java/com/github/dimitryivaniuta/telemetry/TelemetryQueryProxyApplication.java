package com.github.dimitryivaniuta.telemetry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TelemetryQueryProxyApplication {

    public static void main(String[] args) {
        SpringApplication.run(TelemetryQueryProxyApplication.class, args);
    }
}
