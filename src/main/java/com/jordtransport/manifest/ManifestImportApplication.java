package com.jordtransport.manifest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ManifestImportApplication {

    public static void main(String[] args) {
        SpringApplication.run(ManifestImportApplication.class, args);
    }
}
