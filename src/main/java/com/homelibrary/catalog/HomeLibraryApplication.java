package com.homelibrary.catalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HomeLibraryApplication {

    public static void main(String[] args) {
        SpringApplication.run(HomeLibraryApplication.class, args);
    }
}
