package com.delta.adfeed;

import com.delta.adfeed.config.BootstrapSettings;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AdFeedApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(AdFeedApplication.class);
        application.setDefaultProperties(BootstrapSettings.fromConfigDocument(BootstrapSettings.resolveConfigPath()));
        application.run(args);
    }
}
