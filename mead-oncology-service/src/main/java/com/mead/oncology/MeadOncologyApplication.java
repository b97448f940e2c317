package com.mead.oncology;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MeadOncologyApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeadOncologyApplication.class, args);
    }
}
