package com.example.udahub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.example.udahub.config.LlmProperties;
import com.example.udahub.config.RoutingProperties;

@SpringBootApplication
@EnableConfigurationProperties({LlmProperties.class, RoutingProperties.class})
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
