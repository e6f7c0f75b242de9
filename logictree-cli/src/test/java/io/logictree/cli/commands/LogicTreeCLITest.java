package io.logictree.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Properties;
import org.junit.jupiter.api.Test;

class LogicTreeCLITest extends BaseCommandTest {

    @Test
    void shouldLoadDefaultsFromClasspath() {
        Properties defaults = LogicTreeCLI.loadDefaults();

        assertThat(defaults.getProperty("seed")).isEqualTo("42");
        assertThat(defaults.getProperty("samples")).isEqualTo("0");
        assertThat(defaults.getProperty("name")).isEqualTo("lt");
        assertThat(defaults.getProperty("lenient")).isEqualTo("false");
    }

    @Test
    void shouldListSubcommandsInUsage() {
        int exitCode = run("--help");

        assertThat(exitCode).isZero();
        assertThat(outContent.toString())
                .contains("import")
                .contains("show")
                .contains("rlzs")
                .contains("leaves");
    }

    @Test
    void shouldRejectUnknownSubcommand() {
        int exitCode = run("export");

        assertThat(exitCode).isNotZero();
    }
}
