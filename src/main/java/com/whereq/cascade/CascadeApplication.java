package com.whereq.cascade;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Cascade.
 * Runs one pipeline stage over a batch of samples with resource-aware parallelism
 * and tiered, degrading retries, then exits with a status automation can act on.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class CascadeApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CascadeApplication.class, args)));
    }
}
