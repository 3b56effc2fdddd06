package com.querytuner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QueryTunerApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryTunerApplication.class, args);
    }
}
