package com.polycopy.copytrade;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CopyTradeApplication {

    public static void main(String[] args) {
        SpringApplication.run(CopyTradeApplication.class, args);
    }
}
