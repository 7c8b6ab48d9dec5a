package com.pyme.costing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CostingApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostingApplication.class, args);
    }
}
