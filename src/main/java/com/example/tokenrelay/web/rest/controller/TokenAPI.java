package com.example.tokenrelay.web.rest.controller;

import static com.example.tokenrelay.web.rest.ApiConstants.ApiParam.*;
import static com.example.tokenrelay.web.rest.ApiConstants.ApiPath.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(
    name = "Token Relay",
    description = "Exchanges the browser session cookie for a token held by the authentication server"
)
@RequestMapping(value = TOKEN_BASE)
public interface TokenAPI {

  @Operation(
      summary = "Get a token for the current session",
      description = "Reads the session cookie, fetches (or reuses cached) session data from the "
          + "authentication server, verifies the identity token and returns the requested field "
          + "as plain text. Rejections are JSON objects with status BLOCKED and a reason."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200",
          description = "Token value, or a BLOCKED body for BAD_SESSION_ID, REJECTED_REQUEST "
              + "and TOKEN_EXPIRED"),
      @ApiResponse(responseCode = "500",
          description = "BLOCKED body for BAD_EMAIL, UNKNOWN or an unsupported token_type")
  })
  @GetMapping
  ResponseEntity<?> getToken(
      @Parameter(description = "Field to return: access_token, id_token or email",
          example = "id_token")
      @RequestParam(name = TOKEN_TYPE, defaultValue = DEFAULT_TOKEN_TYPE) String tokenType,
      HttpServletRequest request
                            );
}
