package com.phillippitts.arithmetic;

import com.phillippitts.arithmetic.config.properties.CalculatorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CalculatorProperties.class)
public class ArithmeticApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArithmeticApplication.class, args);
    }

}
