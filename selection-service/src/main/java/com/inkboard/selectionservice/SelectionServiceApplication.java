package com.inkboard.selectionservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SelectionServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SelectionServiceApplication.class, args);
    }
}
