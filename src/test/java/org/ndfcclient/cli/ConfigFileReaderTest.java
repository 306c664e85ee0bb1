package org.ndfcclient.cli;

import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.ndfcclient.imagepolicy.ImagePolicyCreateRequest;
import org.ndfcclient.network.NetworkAttachRequest;
import org.ndfcclient.vrf.VrfAttachRequest;
import org.ndfcclient.vrf.VrfCreateRequest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigFileReaderTest {

    @TempDir
    Path tempDir;

    private ValidatorFactory validatorFactory;
    private ConfigFileReader reader;

    @BeforeEach
    void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        reader = new ConfigFileReader(validatorFactory.getValidator());
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    private Path write(String yaml) throws IOException {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    @Test
    void read_bindsItemsInDocumentOrder() throws IOException {
        Path file = write("config:\n"
                + "  - fabric_name: f1\n"
                + "    vrf_name: vrf3\n"
                + "    vrf_id: 50003\n"
                + "    vrf_vlan_id: 3003\n"
                + "  - fabric_name: f1\n"
                + "    vrf_name: vrf4\n"
                + "    vrf_id: 50004\n"
                + "    vrf_vlan_id: 3004\n"
                + "    mtu: 1500\n");

        List<VrfCreateRequest> items = reader.read(file, VrfCreateRequest.class);

        assertThat(items).extracting(VrfCreateRequest::getVrfName).containsExactly("vrf3", "vrf4");
        assertThat(items.get(0).getVrfTemplate()).isEqualTo("Default_VRF_Universal");
        assertThat(items.get(1).getMtu()).isEqualTo(1500);
    }

    @Test
    void read_bindsNestedStructures() throws IOException {
        Path file = write("config:\n"
                + "  - fabric_name: f1\n"
                + "    vrf_name: vrf1\n"
                + "    switch_name: leaf1\n"
                + "    vrf_lite:\n"
                + "      - IF_NAME: Ethernet1/1\n"
                + "        DOT1Q_ID: 2\n");

        VrfAttachRequest item = reader.read(file, VrfAttachRequest.class).get(0);

        assertThat(item.getVrfLite()).hasSize(1);
        assertThat(item.getVrfLite().get(0)).containsEntry("IF_NAME", "Ethernet1/1");
        assertThat(item.hasPeer()).isFalse();
    }

    @Test
    void read_bindsEmptyListKeysAsEmptyLists() throws IOException {
        Path file = write("config:\n"
                + "  - fabric_name: f1\n"
                + "    network_name: net1\n"
                + "    switch_name: leaf1\n"
                + "    switch_ports:\n"
                + "    detach_switch_ports:\n"
                + "    tor_ports:\n"
                + "    freeform_config:\n"
                + "    instance_values:\n");

        NetworkAttachRequest item = reader.read(file, NetworkAttachRequest.class).get(0);

        assertThat(item.getSwitchPorts()).isEmpty();
        assertThat(item.getDetachSwitchPorts()).isEmpty();
        assertThat(item.getTorPorts()).isEmpty();
        assertThat(item.getFreeformConfig()).isEmpty();
        assertThat(item.getInstanceValues()).isEmpty();
    }

    @Test
    void read_reportsEveryViolation() throws IOException {
        Path file = write("config:\n"
                + "  - fabric_name: f1\n"
                + "    vrf_id: 50003\n"
                + "    vrf_vlan_id: 1\n");

        assertThatThrownBy(() -> reader.read(file, VrfCreateRequest.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid config file " + file + ": ")
                .hasMessageContaining("config[0].vrf_name: ")
                .hasMessageContaining("config[0].vrf_vlan_id: ");
    }

    @Test
    void read_validatesNestedObjects() throws IOException {
        Path file = write("config:\n"
                + "  - name: KR6\n"
                + "    platform: N9K\n"
                + "    release: \"10.4.1\"\n"
                + "    packages:\n"
                + "      install: [pkg-a]\n");

        ImagePolicyCreateRequest item = reader.read(file, ImagePolicyCreateRequest.class).get(0);

        assertThat(item.getPackages().getInstall()).containsExactly("pkg-a");
        assertThat(item.getPackages().getUninstall()).isEmpty();
    }

    @Test
    void read_rejectsUnknownKeys() throws IOException {
        Path file = write("config:\n"
                + "  - fabric_name: f1\n"
                + "    vrf_name: vrf3\n"
                + "    vrf_id: 50003\n"
                + "    vrf_vlan_id: 3003\n"
                + "    vlan_id: 3003\n");

        assertThatThrownBy(() -> reader.read(file, VrfCreateRequest.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid config file")
                .hasMessageContaining("vlan_id");
    }

    @Test
    void read_requiresConfigList() throws IOException {
        Path file = write("items:\n  - fabric_name: f1\n");
        assertThatThrownBy(() -> reader.read(file, VrfCreateRequest.class))
                .isInstanceOf(IllegalArgumentException.class);

        Path empty = write("config:\n");
        assertThatThrownBy(() -> reader.read(empty, VrfCreateRequest.class))
                .hasMessage("Config file " + empty + " must contain a 'config' list");
    }

    @Test
    void read_rejectsNullItems() throws IOException {
        Path file = write("config:\n  -\n");

        assertThatThrownBy(() -> reader.read(file, VrfCreateRequest.class))
                .hasMessage("Invalid config file " + file + ": config[0]: must not be empty");
    }

    @Test
    void read_reportsMissingFile() {
        Path missing = tempDir.resolve("missing.yaml");

        assertThatThrownBy(() -> reader.read(missing, VrfCreateRequest.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Config file " + missing + " does not exist or is not readable");
    }
}
