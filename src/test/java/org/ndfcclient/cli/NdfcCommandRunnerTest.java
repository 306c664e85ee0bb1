package org.ndfcclient.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.ndfcclient.rest.NdfcException;
import org.ndfcclient.rest.Sender;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NdfcCommandRunnerTest {

    @Mock
    private NdfcCommand command;

    @Mock
    private Sender sender;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private NdfcCommandRunner runner;

    @BeforeEach
    void setUp() {
        lenient().when(command.getName()).thenReturn("vrf-create");
        lenient().when(command.getDescription()).thenReturn("Create VRFs");
        lenient().when(command.requiresLogin()).thenReturn(true);
        runner = new NdfcCommandRunner(List.of(command), sender,
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private static ApplicationArguments args(String... args) {
        return new DefaultApplicationArguments(args);
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void run_withoutCommandPrintsUsage() throws Exception {
        runner.run(args());

        assertThat(runner.getExitCode()).isEqualTo(NdfcCommandRunner.EXIT_USAGE);
        assertThat(err()).contains("Usage: ndfc-client").contains("vrf-create");
    }

    @Test
    void run_helpListsCommands() throws Exception {
        runner.run(args("help"));

        assertThat(runner.getExitCode()).isEqualTo(NdfcCommandRunner.EXIT_OK);
        assertThat(out()).contains("vrf-create").contains("Create VRFs");
        verify(sender, never()).login();
    }

    @Test
    void dispatch_unknownCommandIsUsageError() {
        int exitCode = runner.dispatch("vrf-make", args("vrf-make"));

        assertThat(exitCode).isEqualTo(NdfcCommandRunner.EXIT_USAGE);
        assertThat(err()).contains("Unknown command: vrf-make");
    }

    @Test
    void dispatch_logsInThenExecutes() {
        ApplicationArguments arguments = args("vrf-create", "--config=vrfs.yaml");

        int exitCode = runner.dispatch("vrf-create", arguments);

        assertThat(exitCode).isEqualTo(NdfcCommandRunner.EXIT_OK);
        verify(sender).login();
        verify(command).execute(any(ApplicationArguments.class), any(PrintStream.class));
    }

    @Test
    void dispatch_skipsLoginWhenCommandDoesNotNeedIt() {
        when(command.requiresLogin()).thenReturn(false);

        runner.dispatch("vrf-create", args("vrf-create"));

        verify(sender, never()).login();
    }

    @Test
    void dispatch_controllerFailureExitsWithOne() {
        doThrow(new NdfcException("VRF vrf1 already exists in fabric f1"))
                .when(command).execute(any(ApplicationArguments.class), any(PrintStream.class));

        int exitCode = runner.dispatch("vrf-create", args("vrf-create"));

        assertThat(exitCode).isEqualTo(NdfcCommandRunner.EXIT_FAILED);
        assertThat(err()).contains("Error: VRF vrf1 already exists in fabric f1");
    }

    @Test
    void dispatch_loginFailureExitsWithOne() {
        doThrow(new NdfcException("Login failed")).when(sender).login();

        int exitCode = runner.dispatch("vrf-create", args("vrf-create"));

        assertThat(exitCode).isEqualTo(NdfcCommandRunner.EXIT_FAILED);
        verify(command, never()).execute(any(ApplicationArguments.class), any(PrintStream.class));
    }

    @Test
    void dispatch_usageErrorExitsWithTwo() {
        doThrow(new UsageException("vrf-create requires --config=<file>"))
                .when(command).execute(any(ApplicationArguments.class), any(PrintStream.class));

        assertThat(runner.dispatch("vrf-create", args("vrf-create"))).isEqualTo(NdfcCommandRunner.EXIT_USAGE);
        assertThat(err()).contains("vrf-create requires --config=<file>");
    }

    @Test
    void dispatch_invalidInputExitsWithOne() {
        doThrow(new IllegalArgumentException("Invalid config file vrfs.yaml: config[0].vrf_name: must not be blank"))
                .when(command).execute(any(ApplicationArguments.class), any(PrintStream.class));

        assertThat(runner.dispatch("vrf-create", args("vrf-create"))).isEqualTo(NdfcCommandRunner.EXIT_FAILED);
    }

    @Test
    void dispatch_unexpectedExceptionExitsWithOne() {
        doThrow(new NullPointerException("freeformConfig"))
                .when(command).execute(any(ApplicationArguments.class), any(PrintStream.class));

        int exitCode = runner.dispatch("vrf-create", args("vrf-create"));

        assertThat(exitCode).isEqualTo(NdfcCommandRunner.EXIT_FAILED);
        assertThat(err()).startsWith("Error: ").contains("freeformConfig");
    }
}
