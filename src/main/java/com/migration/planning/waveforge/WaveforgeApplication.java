package com.migration.planning.waveforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WaveforgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(WaveforgeApplication.class, args);
    }
}
