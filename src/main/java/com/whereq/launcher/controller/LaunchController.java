package com.whereq.launcher.controller;

import com.whereq.launcher.LauncherApplication;
import com.whereq.launcher.dto.CommandPreviewResponse;
import com.whereq.launcher.dto.LaunchRequest;
import com.whereq.launcher.exception.ErrorKind;
import com.whereq.launcher.exception.LaunchException;
import com.whereq.launcher.model.LaunchError;
import com.whereq.launcher.model.SubmissionResult;
import com.whereq.launcher.service.LaunchService;
import com.whereq.launcher.submit.SparkSubmitCommandSerializer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * REST controller for launching batch jobs.
 * Only active with the {@code server} profile; the default mode is the command line runner.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/launches")
@RequiredArgsConstructor
@Slf4j
@Validated
@Profile(LauncherApplication.SERVER_PROFILE)
@Tag(name = "Launches", description = "Validate and dispatch batch jobs to the cluster")
public class LaunchController {

    private final LaunchService launchService;
    private final SparkSubmitCommandSerializer serializer;

    @PostMapping
    @Operation(
        summary = "Launch job",
        description = "Resolve the configuration, validate dependencies and resources, and dispatch the job once. "
            + "Returns 202 when the cluster accepted the job.",
        requestBody = @io.swagger.v3.oas.annotations.parameters.RequestBody(
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = LaunchRequest.class),
                examples = @ExampleObject(
                    name = "Production trip statistics",
                    value = """
                    {
                      "configFile": "config/application.properties",
                      "environment": "prod",
                      "driverMemory": "4G",
                      "executorMemory": "4G"
                    }
                    """
                )
            )
        )
    )
    public Mono<ResponseEntity<SubmissionResult>> launch(@Valid @RequestBody LaunchRequest request) {
        log.info("Received launch request: environment={}, config={}",
                request.getEnvironment(), request.getConfigFile());

        return Mono.fromCallable(() -> launchService.launch(request))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.status(statusFor(result)).body(result));
    }

    @PostMapping("/preview")
    @Operation(summary = "Preview launch", description = "Validate the request and render the spark-submit command without dispatching it")
    public Mono<ResponseEntity<CommandPreviewResponse>> preview(@Valid @RequestBody LaunchRequest request) {
        return Mono.fromCallable(() -> {
                    List<String> arguments = serializer.render(launchService.prepare(request));
                    return ResponseEntity.ok(CommandPreviewResponse.builder()
                            .arguments(arguments)
                            .shellCommand(serializer.toShellString(arguments))
                            .build());
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @ExceptionHandler(LaunchException.class)
    public ResponseEntity<LaunchError> handleLaunchException(LaunchException e) {
        log.warn("Launch request rejected: {}", e.getMessage());
        return ResponseEntity.status(statusFor(e.getKind())).body(e.getError());
    }

    static HttpStatus statusFor(SubmissionResult result) {
        return result.isSuccess() ? HttpStatus.ACCEPTED : statusFor(result.getError().getKind());
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case DISPATCH_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case DISPATCH_REJECTED, MASTER_UNREACHABLE -> HttpStatus.BAD_GATEWAY;
            case DISPATCHER_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.BAD_REQUEST;
        };
    }
}
