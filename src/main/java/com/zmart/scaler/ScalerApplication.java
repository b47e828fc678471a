package com.zmart.scaler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScalerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScalerApplication.class, args);
    }
}
