package de.htwsaar.minioffline.engine;

import de.htwsaar.minioffline.common.logging.LoggingConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@Import(LoggingConfig.class)
@EnableScheduling
@EnableConfigurationProperties(EngineProperties.class)
public class EngineApp {
    public static void main(String[] args) {
        SpringApplication.run(EngineApp.class, args);
    }
}
