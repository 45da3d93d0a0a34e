package com.pgskipper.replication;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.r2dbc.R2dbcAutoConfiguration;

/**
 * Connections are opened per request against arbitrary databases of the
 * cluster, so the single application-wide R2DBC connection factory Spring Boot
 * would configure is excluded.
 */
@SpringBootApplication(exclude = R2dbcAutoConfiguration.class)
public class ReplicationControllerApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReplicationControllerApplication.class, args);
    }
}
