package com.whereq.launcher.service;

import com.whereq.launcher.config.LauncherProperties;
import com.whereq.launcher.exception.ErrorKind;
import com.whereq.launcher.model.ClusterEndpoint;
import com.whereq.launcher.model.ConfigFile;
import com.whereq.launcher.model.EnvironmentProfile;
import com.whereq.launcher.model.JobConfig;
import com.whereq.launcher.model.LaunchError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.whereq.launcher.LaunchErrors.errorOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class ConfigResolverTest {

    @TempDir
    Path baseDir;

    private LauncherProperties properties;
    private ConfigResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new LauncherProperties();
        properties.setBaseDir(baseDir.toString());
        resolver = new ConfigResolver(properties);
    }

    @Test
    void resolvesRelativePathAgainstBaseDir() throws IOException {
        write("config/application.properties", "cassandra.host.name = 10.0.0.5");

        ConfigFile configFile = resolver.resolve("config/application.properties");

        assertThat(configFile.getPath()).isEqualTo(baseDir.resolve("config/application.properties"));
        assertThat(configFile.effectiveProperties("prod")).containsExactly(entry("cassandra.host.name", "10.0.0.5"));
    }

    @Test
    void parsesSectionsCommentsAndBothSeparators() throws IOException {
        write("app.properties",
                "# comment",
                "! also a comment",
                "; ini comment",
                "",
                "shared=value",
                "[prod]",
                "batch_s3_url: s3a://nyc-tlc/trip data/yellow_tripdata_2018-01.csv",
                "shared = overridden",
                "[dev]",
                "batch_s3_url=s3a://dev-bucket/sample.csv");

        ConfigFile configFile = resolver.resolve("app.properties");

        assertThat(configFile.getSections()).containsOnlyKeys(ConfigFile.DEFAULT_SECTION, "prod", "dev");
        assertThat(configFile.effectiveProperties("prod")).containsOnly(
                entry("shared", "overridden"),
                entry("batch_s3_url", "s3a://nyc-tlc/trip data/yellow_tripdata_2018-01.csv"));
        assertThat(configFile.effectiveProperties("dev")).containsEntry("shared", "value");
    }

    @Test
    void valueMayContainSeparatorCharacters() throws IOException {
        write("app.properties", "spark.master=spark://10.0.0.1:7077");

        ConfigFile configFile = resolver.resolve("app.properties");

        assertThat(configFile.effectiveProperties("prod")).containsEntry("spark.master", "spark://10.0.0.1:7077");
    }

    @Test
    void missingFileFailsWithConfigNotFound() {
        LaunchError error = errorOf(() -> resolver.resolve("config/missing.properties"));

        assertThat(error.getKind()).isEqualTo(ErrorKind.CONFIG_NOT_FOUND);
        assertThat(error.getOffendingValue()).isEqualTo("config/missing.properties");
    }

    @Test
    void blankPathFailsWithConfigNotFound() {
        assertThat(errorOf(() -> resolver.resolve(" ")).getKind()).isEqualTo(ErrorKind.CONFIG_NOT_FOUND);
        assertThat(errorOf(() -> resolver.resolve(null)).getKind()).isEqualTo(ErrorKind.CONFIG_NOT_FOUND);
    }

    @Test
    void directoryIsNotAConfigFile() throws IOException {
        Files.createDirectories(baseDir.resolve("config"));

        assertThat(errorOf(() -> resolver.resolve("config")).getKind()).isEqualTo(ErrorKind.CONFIG_NOT_FOUND);
    }

    @Test
    void lineWithoutSeparatorFailsWithConfigUnreadable() throws IOException {
        write("app.properties", "good=1", "this line has no separator");

        LaunchError error = errorOf(() -> resolver.resolve("app.properties"));

        assertThat(error.getKind()).isEqualTo(ErrorKind.CONFIG_UNREADABLE);
        assertThat(error.getDetail()).contains("line 2");
    }

    @Test
    void emptyKeyFailsWithConfigUnreadable() throws IOException {
        write("app.properties", "=value");

        assertThat(errorOf(() -> resolver.resolve("app.properties")).getKind())
                .isEqualTo(ErrorKind.CONFIG_UNREADABLE);
    }

    @Test
    void malformedSectionHeaderFailsWithConfigUnreadable() throws IOException {
        write("app.properties", "[prod");

        assertThat(errorOf(() -> resolver.resolve("app.properties")).getKind())
                .isEqualTo(ErrorKind.CONFIG_UNREADABLE);
    }

    @Test
    void resolvingTwiceYieldsEqualResults() throws IOException {
        write("app.properties", "[prod]", "a=1", "b=2");

        assertThat(resolver.resolve("app.properties")).isEqualTo(resolver.resolve("app.properties"));
    }

    @Test
    void bindChecksRequiredKeysInEnvironmentSection() throws IOException {
        properties.setRequiredKeys(List.of("cassandra.host.name", "batch_s3_url"));
        write("app.properties",
                "cassandra.host.name=10.0.0.5",
                "[prod]",
                "batch_s3_url=s3a://bucket/trips.csv",
                "[dev]",
                "other=1");
        ConfigFile configFile = resolver.resolve("app.properties");

        JobConfig jobConfig = resolver.bind(configFile, profile("prod"));
        assertThat(jobConfig.getConfigFilePath()).isEqualTo(baseDir.resolve("app.properties"));
        assertThat(jobConfig.getEnvironment().getName()).isEqualTo("prod");
        assertThat(jobConfig.getProperties()).containsEntry("batch_s3_url", "s3a://bucket/trips.csv");

        LaunchError error = errorOf(() -> resolver.bind(configFile, profile("dev")));
        assertThat(error.getKind()).isEqualTo(ErrorKind.MISSING_CONFIG_KEY);
        assertThat(error.getOffendingValue()).isEqualTo("batch_s3_url");
    }

    @Test
    void environmentWithoutSectionBindsToDefaultEntries() throws IOException {
        properties.setRequiredKeys(List.of("cassandra.host.name"));
        write("app.properties", "cassandra.host.name=10.0.0.5", "[dev]", "cassandra.host.name=127.0.0.1");
        ConfigFile configFile = resolver.resolve("app.properties");

        assertThat(configFile.hasSection("dev")).isTrue();
        assertThat(configFile.hasSection("prod")).isFalse();
        assertThat(resolver.bind(configFile, profile("prod")).getProperties())
                .containsExactly(entry("cassandra.host.name", "10.0.0.5"));
    }

    private EnvironmentProfile profile(String name) {
        return EnvironmentProfile.builder()
                .name(name)
                .clusterEndpoint(ClusterEndpoint.parse("spark-master:7077"))
                .build();
    }

    private void write(String relativePath, String... lines) throws IOException {
        Path file = baseDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.write(file, List.of(lines));
    }
}
