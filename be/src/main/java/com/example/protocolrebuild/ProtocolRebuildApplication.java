package com.example.protocolrebuild;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProtocolRebuildApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProtocolRebuildApplication.class, args);
    }
}
