package com.example.tokenrelay.web.rest.controller;


import static com.example.tokenrelay.web.rest.ApiConstants.ApiPath.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Tag(
    name = "Health",
    description = "Health check endpoints for monitoring and orchestration"
)
@RequestMapping(
    value = HEALTH_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface HealthAPI {

  @Operation(
      summary = "Basic health check",
      description = "Simple health check for load balancers"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Service is healthy")
  })
  @GetMapping
  ResponseEntity<Map<String, Object>> health();

  @Operation(
      summary = "Liveness check",
      description = "Liveness check used to decide if the container should be restarted"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Service is alive"),
      @ApiResponse(responseCode = "503", description = "Service should be restarted")
  })
  @GetMapping(value = LIVE)
  ResponseEntity<Map<String, Object>> liveness();

  @Operation(
      summary = "Readiness check",
      description = "Reports key capacity, auth server circuit and session cache state"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Service is ready"),
      @ApiResponse(responseCode = "503", description = "Service is not ready")
  })
  @GetMapping(value = READY)
  ResponseEntity<Map<String, Object>> readiness();
}
