package io.github.nicechester.logos;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LogosApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(LogosApplication.class, args);
    }
}
