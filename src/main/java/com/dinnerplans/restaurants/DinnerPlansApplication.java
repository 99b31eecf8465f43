package com.dinnerplans.restaurants;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DinnerPlansApplication {

    public static void main(String[] args) {
        SpringApplication.run(DinnerPlansApplication.class, args);
    }
}
