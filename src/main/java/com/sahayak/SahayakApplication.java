package com.sahayak;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class SahayakApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(SahayakApplication.class)
                .properties("spring.main.banner-mode=off")
                .run(args);
    }
}
