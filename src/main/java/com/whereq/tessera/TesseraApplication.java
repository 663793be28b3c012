package com.whereq.tessera;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for WhereQ Tessera.
 * This service runs SQL jobs asynchronously against embedded and distributed
 * columnar engines and compiles versioned schemas into per-engine DDL.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
@EnableScheduling
public class TesseraApplication {

    public static void main(String[] args) {
        SpringApplication.run(TesseraApplication.class, args);
    }
}
