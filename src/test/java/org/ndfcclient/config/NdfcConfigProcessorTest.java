package org.ndfcclient.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;

class NdfcConfigProcessorTest {

    private NdfcConfig config;
    private MockEnvironment environment;
    private NdfcConfigProcessor processor;

    @BeforeEach
    void setUp() {
        config = new NdfcConfig();
        environment = new MockEnvironment();
        processor = new NdfcConfigProcessor();
        ReflectionTestUtils.setField(processor, "ndfcConfig", config);
        ReflectionTestUtils.setField(processor, "environment", environment);
    }

    @Test
    void processEnvironment_fillsMissingValuesFromNdVariables() {
        environment.setProperty("ND_IP4", "192.0.2.10");
        environment.setProperty("ND_USERNAME", "operator");
        environment.setProperty("ND_PASSWORD", "secret");
        environment.setProperty("NXOS_USERNAME", "switchadmin");

        processor.processEnvironment();

        assertThat(config.getIp4()).isEqualTo("192.0.2.10");
        assertThat(config.getUsername()).isEqualTo("operator");
        assertThat(config.getPassword()).isEqualTo("secret");
        assertThat(config.getNxosUsername()).isEqualTo("switchadmin");
        assertThat(config.getDomain()).isEqualTo("local");
    }

    @Test
    void processEnvironment_keepsBoundValues() {
        config.setIp4("198.51.100.1");
        config.setUsername("bound");
        environment.setProperty("ND_IP4", "192.0.2.10");
        environment.setProperty("ND_USERNAME", "operator");

        processor.processEnvironment();

        assertThat(config.getIp4()).isEqualTo("198.51.100.1");
        assertThat(config.getUsername()).isEqualTo("bound");
    }

    @Test
    void processEnvironment_replacesUnresolvedPlaceholders() {
        config.setPassword("${ND_PASSWORD}");
        environment.setProperty("ND_PASSWORD", "secret");

        processor.processEnvironment();

        assertThat(config.getPassword()).isEqualTo("secret");
    }

    @Test
    void processEnvironment_defaultsUsernameAndDomain() {
        processor.processEnvironment();

        assertThat(config.getUsername()).isEqualTo("admin");
        assertThat(config.getDomain()).isEqualTo("local");
        assertThat(config.controllerHost()).isNull();
    }
}
