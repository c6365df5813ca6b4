package com.forensics.muling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the money-muling detection engine. Exposes {@code MuleDetectionEngine} with:
 * <ul>
 *   <li>Bounded cycle search for circular fund routing rings</li>
 *   <li>Sliding-window fan-in / fan-out (smurfing) detection</li>
 *   <li>Six-factor shell account profiling</li>
 *   <li>Weighted per-account risk scoring</li>
 * </ul>
 */
@SpringBootApplication
public class MulingDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(MulingDetectionApplication.class, args);
    }
}
