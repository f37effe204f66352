/**
 * Fountain Pool Service Application
 * Recurring, self-renewing money pools for owners and their sustainers
 *
 * Features:
 * - Per-owner chains of funding periods, renewed lazily
 * - Contributions split between the owner's tappable share and surplus
 * - Proportional surplus redistribution across historical periods
 */
package com.fountain.pool;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.fountain")
public class FountainPoolApplication {

    public static void main(String[] args) {
        SpringApplication.run(FountainPoolApplication.class, args);
    }
}
