package io.jamsession.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JamSessionExampleApplication {

    public static void main(String[] args) {
        SpringApplication.run(JamSessionExampleApplication.class, args);
    }
}
