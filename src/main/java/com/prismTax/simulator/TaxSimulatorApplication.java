package com.prismTax.simulator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaxSimulatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaxSimulatorApplication.class, args);
    }
}
