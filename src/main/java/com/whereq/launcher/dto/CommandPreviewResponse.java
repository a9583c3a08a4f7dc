package com.whereq.launcher.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for a launch preview.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "The spark-submit command a launch request would dispatch")
public class CommandPreviewResponse {

    @Schema(description = "spark-submit arguments in submission order")
    private List<String> arguments;

    @Schema(description = "The same arguments quoted for a POSIX shell",
            example = "--master spark://spark-master:7077 --driver-memory 4G /app/src/main/batch_process_trip.py /app/config/application.properties prod")
    private String shellCommand;
}
