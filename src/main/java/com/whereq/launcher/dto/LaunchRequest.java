package com.whereq.launcher.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.List;

/**
 * Data Transfer Object for a job launch.
 * Only the config file and environment are required; everything else falls back to the
 * job configured under {@code launcher.job} and the resource defaults.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to launch a batch job on the cluster")
public class LaunchRequest {

    @NotBlank
    @Schema(description = "Properties file handed to the job", example = "config/application.properties")
    private String configFile;

    @NotBlank
    @Schema(description = "Target environment, case-sensitive", example = "prod")
    private String environment;

    @Schema(description = "Driver program, overrides launcher.job.entry-point", example = "src/main/batch_process_trip.py")
    private String entryPoint;

    /**
     * Files shipped verbatim to every worker.
     * Null means the configured list; an empty list ships none.
     */
    @Schema(description = "Data files shipped to every worker", example = "[\"data/taxi_zone_lookup.csv\"]")
    private List<String> dataFiles;

    @Schema(description = "Code modules shipped to every worker", example = "[\"src/main/util.py\"]")
    private List<String> codeFiles;

    @Schema(description = "Remote package coordinates", example = "[\"com.datastax.spark:spark-cassandra-connector_2.11:2.3.2\"]")
    private List<String> packages;

    @Schema(description = "Driver memory", example = "4G")
    private String driverMemory;

    @Schema(description = "Memory per executor", example = "4G")
    private String executorMemory;

    private Integer driverCores;

    private Integer executorCores;

    private Integer numExecutors;

    @Schema(description = "Cluster master, overrides the environment's", example = "spark://spark-master:7077")
    private String master;

    @Schema(description = "Dispatch timeout as ISO-8601 duration", example = "PT10M")
    private Duration timeout;
}
