package org.minesolver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling  // purge des parties terminées
public class MineSolverApplication {
    public static void main(String[] args) {
        SpringApplication.run(MineSolverApplication.class, args);
    }
}
