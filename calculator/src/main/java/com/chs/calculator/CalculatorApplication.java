package com.chs.calculator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CalculatorApplication {

    public static void main(String[] args) {
        DotenvConfig.load(DotenvConfig.resolveDirectory(System.getProperty("user.dir")));

        SpringApplication.run(CalculatorApplication.class, args);
    }
}
