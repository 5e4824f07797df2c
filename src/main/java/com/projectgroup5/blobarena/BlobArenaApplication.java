package com.projectgroup5.blobarena;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BlobArenaApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlobArenaApplication.class, args);
    }
}
