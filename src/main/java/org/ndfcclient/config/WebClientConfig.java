package org.ndfcclient.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;

/**
 * WebClient setup for talking to the controller.
 *
 * Controllers are commonly deployed with self-signed certificates, so certificate
 * validation is skipped unless "ndfc.insecure" is false. The connect timeout follows
 * "ndfc.request-timeout".
 */
@Configuration
public class WebClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(WebClientConfig.class);

    /**
     * Creates the WebClient.Builder used by the {@link org.ndfcclient.rest.Sender}.
     *
     * @param ndfcConfig The controller configuration containing TLS settings
     * @return A WebClient.Builder with JSON headers and the configured TLS handling
     * @throws RuntimeException if the insecure SSL context cannot be built
     */
    @Bean
    public WebClient.Builder webClientBuilder(NdfcConfig ndfcConfig) {
        logger.debug("Configuring WebClient.Builder (insecure={})", ndfcConfig.isInsecure());

        WebClient.Builder builder = WebClient.builder()
            .defaultHeader("Accept", "application/json")
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(16 * 1024 * 1024));

        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, ndfcConfig.getRequestTimeout() * 1000);

        if (ndfcConfig.isInsecure()) {
            try {
                logger.debug("TLS certificate validation is DISABLED for controller connections (insecure=true)");
                SslContext sslContext = SslContextBuilder.forClient()
                    .trustManager(InsecureTrustManagerFactory.INSTANCE)
                    .build();
                httpClient = httpClient.secure(spec -> spec.sslContext(sslContext));
            } catch (SSLException e) {
                logger.error("Failed to configure insecure SSL context: {}", e.getMessage(), e);
                throw new RuntimeException("Failed to configure insecure SSL context", e);
            }
        }

        return builder.clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
