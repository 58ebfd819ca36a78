package com.vidnyan.attackpath;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Attack Path Engine
 *
 * Finds, scores and renders every attack path through a rule interaction graph.
 */
@SpringBootApplication
public class AttackPathApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(AttackPathApplication.class, args)));
    }
}
