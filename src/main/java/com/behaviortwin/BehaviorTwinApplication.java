package com.behaviortwin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BehaviorTwinApplication {

    public static void main(String[] args) {
        SpringApplication.run(BehaviorTwinApplication.class, args);
    }
}
