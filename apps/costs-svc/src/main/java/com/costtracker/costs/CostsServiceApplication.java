package com.costtracker.costs;

import com.costtracker.costs.config.CostsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CostsProperties.class)
public class CostsServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostsServiceApplication.class, args);
    }
}
