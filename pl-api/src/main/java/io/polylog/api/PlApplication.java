package io.polylog.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "io.polylog")
public class PlApplication {
    public static void main(String[] args) {
        SpringApplication.run(PlApplication.class, args);
    }
}
