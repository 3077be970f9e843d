package com.bit.hydro;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.bit.hydro")
public class HydroApplication {
    public static void main(String[] args) {
        SpringApplication.run(HydroApplication.class, args);
    }
    //二进制统一大端
}
