package com.assetintel.attribution;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class AssetAttributorApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(AssetAttributorApplication.class, args);

        // oneshot profile: the startup run has finished, report its status and stop
        if (context.getEnvironment().getProperty("attributor.scheduling.exit-after-startup-run", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
