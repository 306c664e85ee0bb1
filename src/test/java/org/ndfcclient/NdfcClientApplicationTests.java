package org.ndfcclient;

import org.junit.jupiter.api.Test;
import org.ndfcclient.cli.NdfcCommand;
import org.ndfcclient.cli.NdfcCommandRunner;
import org.ndfcclient.config.NdfcConfig;
import org.ndfcclient.rest.RestSend;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@TestPropertySource(properties = {
    "ndfc.ip4=192.0.2.10",
    "ndfc.username=test-user",
    "ndfc.password=test-password",
    "ndfc.rest.timeout=60",
    "ndfc.rest.check-mode=true"
})
class NdfcClientApplicationTests {

    @Autowired
    private NdfcConfig ndfcConfig;

    @Autowired
    private RestSend restSend;

    @Autowired
    private List<NdfcCommand> commands;

    @Autowired
    private NdfcCommandRunner runner;

    @Test
    void contextLoads() {
        assertThat(runner).isNotNull();
    }

    @Test
    void bindsControllerSettings() {
        assertThat(ndfcConfig.controllerHost()).isEqualTo("192.0.2.10");
        assertThat(ndfcConfig.getUsername()).isEqualTo("test-user");
        assertThat(ndfcConfig.getDomain()).isEqualTo("local");
        assertThat(restSend.getTimeout()).isEqualTo(60);
        assertThat(restSend.getSendInterval()).isEqualTo(5);
        assertThat(restSend.isCheckMode()).isTrue();
    }

    @Test
    void registersEveryCommand() {
        assertThat(commands).extracting(NdfcCommand::getName).contains(
                "login", "rest-get", "rest-post", "fabrics-info", "fabric-inventory", "fabric-create",
                "fabric-delete", "config-save", "config-deploy", "vrf-info", "vrf-create", "vrf-delete",
                "vrf-attach", "vrf-detach", "network-info", "network-create", "network-delete",
                "network-attach", "network-detach", "policy-info-switch", "policy-create", "policy-delete",
                "reachability", "discover", "device-info", "image-policy-info", "image-policy-create",
                "image-policy-delete", "fabric-info", "recalculate-and-deploy", "switch-resource-usage",
                "interface-access-create");
    }
}
