package org.driptable;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DripTableApplication {
    public static void main(String[] args) {
        SpringApplication.run(DripTableApplication.class, args);
    }
}
