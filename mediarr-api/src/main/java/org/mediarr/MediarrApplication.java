package org.mediarr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@EnableAsync
@SpringBootApplication
public class MediarrApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediarrApplication.class, args);
    }
}
