package com.mafiaindexer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MafiaIndexerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MafiaIndexerApplication.class, args);
    }
}
