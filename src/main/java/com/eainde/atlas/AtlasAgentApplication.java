package com.eainde.atlas;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class AtlasAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(AtlasAgentApplication.class, args);
    }
}
