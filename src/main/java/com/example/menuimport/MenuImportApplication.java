package com.example.menuimport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MenuImportApplication {

    public static void main(String[] args) {
        SpringApplication.run(MenuImportApplication.class, args);
    }
}
