package com.prowl.kgindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KgIndexApplication {

    public static void main(String[] args) {
        SpringApplication.run(KgIndexApplication.class, args);
    }
}
