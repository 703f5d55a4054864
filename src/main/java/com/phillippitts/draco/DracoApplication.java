package com.phillippitts.draco;

import com.phillippitts.draco.config.properties.ComponentLifecycleProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties(ComponentLifecycleProperties.class)
@EnableScheduling
public class DracoApplication {

    public static void main(String[] args) {
        SpringApplication.run(DracoApplication.class, args);
    }

}
