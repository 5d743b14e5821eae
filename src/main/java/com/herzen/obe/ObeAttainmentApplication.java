package com.herzen.obe;

import com.herzen.obe.governance.GovernanceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(GovernanceProperties.class)
public class ObeAttainmentApplication {
    public static void main(String[] args) {
        SpringApplication.run(ObeAttainmentApplication.class, args);
    }
}
