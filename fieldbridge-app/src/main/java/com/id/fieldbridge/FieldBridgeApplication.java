package com.id.fieldbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FieldBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(FieldBridgeApplication.class, args);
    }

}
