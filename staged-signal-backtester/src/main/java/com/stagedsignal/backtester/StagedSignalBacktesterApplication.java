package com.stagedsignal.backtester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the staged signal backtester.
 * Runs without a web server; backtests are started through the service layer.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class StagedSignalBacktesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(StagedSignalBacktesterApplication.class, args);
    }

}
