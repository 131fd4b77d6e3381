package io.stubhive.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StubHiveApplication {
    public static void main(String[] args) {
        SpringApplication.run(StubHiveApplication.class, args);
    }
}
