package com.fxhedge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FxHedgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(FxHedgeApplication.class, args);
    }
}
