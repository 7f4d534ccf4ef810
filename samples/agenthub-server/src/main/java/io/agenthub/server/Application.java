package io.agenthub.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Hub HTTP server. The starter wires the hub from {@code agenthub.*} properties; this
 * application only adds the REST endpoints.
 *
 * <p>Run with: mvn install -DskipTests && mvn -f samples/agenthub-server/pom.xml spring-boot:run
 *
 * <p>Endpoints:
 * GET  /.well-known/agenthub-matrix           - discovery document
 * POST /api/v1/agent/send                     - deliver a message to an agent's room
 * POST /api/v1/approval/callback              - record an approval decision
 * GET  /api/v1/approval/{requestId}           - approval status
 * GET  /health, /ready                        - liveness and readiness
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
