package com.hooktide;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HooktideApplication {

    public static void main(String[] args) {
        SpringApplication.run(HooktideApplication.class, args);
    }
}
