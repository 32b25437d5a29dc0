package com.eainde.dealflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DealFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(DealFlowApplication.class, args);
    }
}
