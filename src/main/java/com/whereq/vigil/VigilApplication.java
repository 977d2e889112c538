package com.whereq.vigil;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Vigil.
 * A cron-driven supervisor that runs data collection jobs under file locks and timeouts,
 * and scans their hosts with bounded concurrency.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class VigilApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(VigilApplication.class, args)));
    }
}
