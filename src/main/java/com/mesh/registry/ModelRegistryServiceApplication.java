package com.mesh.registry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ModelRegistryServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelRegistryServiceApplication.class, args);
    }
}
