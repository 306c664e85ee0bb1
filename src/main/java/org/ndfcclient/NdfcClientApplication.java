package org.ndfcclient;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main Spring Boot application class for the NDFC client.
 *
 * The application runs one command against a Nexus Dashboard Fabric Controller and exits.
 * The command is the first non-option argument; config-driven commands read their
 * requests from the YAML file given with {@code --config=<file>}.
 *
 * Key features:
 * - Logs in to the controller and keeps the session token for subsequent requests
 * - Retries requests until they succeed or a timeout expires
 * - Manages fabrics, VRFs, networks, switch policies, image policies and switch discovery
 * - Check mode ({@code --ndfc.rest.check-mode=true}) simulates every write request
 *
 * @version 1.0.0
 */
@SpringBootApplication
@EnableConfigurationProperties
public class NdfcClientApplication {

    /**
     * Main application entry point.
     *
     * The exit status is produced by {@link org.ndfcclient.cli.NdfcCommandRunner}: 0 on success,
     * 1 if the command failed and 2 on usage errors.
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(NdfcClientApplication.class, args)));
    }
}
