package com.tonindexer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TonIndexerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TonIndexerApplication.class, args);
    }
}
