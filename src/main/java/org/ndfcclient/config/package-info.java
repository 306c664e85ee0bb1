/**
 * Configuration for the controller client.
 *
 * <p>Provides controller connection settings ({@link org.ndfcclient.config.NdfcConfig}),
 * the ND_* environment fallback ({@link org.ndfcclient.config.NdfcConfigProcessor}),
 * and WebClient setup with optional insecure TLS ({@link org.ndfcclient.config.WebClientConfig}).
 */
package org.ndfcclient.config;
