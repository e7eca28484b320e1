package com.botcore.toolgate.api.tools;

import com.botcore.toolgate.application.guard.IncomingAuthGuard;
import com.botcore.toolgate.application.service.ToolCallGateway;
import com.botcore.toolgate.domain.gate.FailureCode;
import com.botcore.toolgate.domain.gate.ToolResult;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * HTTP surface of the gateway.
 *
 * The body of every tool call is the ToolResult; the status code only mirrors it:
 * - 200 success, or confirmation required (the agent is expected to ask the operator)
 * - 401 / 403 / 404 / 400 / 429 / 502 / 504 for the failure codes
 */
@RestController
@RequestMapping("/api/v1/tools")
public class ToolController {

  private final ToolCallGateway gateway;
  private final IncomingAuthGuard guard;

  public ToolController(ToolCallGateway gateway, IncomingAuthGuard guard) {
    this.gateway = gateway;
    this.guard = guard;
  }

  @GetMapping
  public ResponseEntity<?> list(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    if (!guard.validate(authorization)) {
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
          .body(ToolResult.failure(FailureCode.AUTH_FAILURE, "Unauthorized: missing or invalid bearer token"));
    }
    List<ToolSummary> tools = gateway.catalog().all().stream()
        .map(ToolSummary::of)
        .sorted(Comparator.comparing(ToolSummary::name))
        .toList();
    return ResponseEntity.ok(Map.of("tools", tools, "count", tools.size()));
  }

  @PostMapping("/{name}")
  public ResponseEntity<ToolResult> invoke(
      @PathVariable("name") String name,
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @RequestBody(required = false) Map<String, Object> arguments
  ) {
    ToolResult result = gateway.invoke(authorization, name, arguments == null ? Map.of() : arguments);

    ResponseEntity.BodyBuilder res = ResponseEntity.status(statusOf(result));
    if (result.code() == FailureCode.RATE_LIMITED && result.retryAfterSeconds() != null) {
      res.header(HttpHeaders.RETRY_AFTER, String.valueOf(result.retryAfterSeconds()));
    }
    return res.body(result);
  }

  static HttpStatus statusOf(ToolResult result) {
    if (result.success()) return HttpStatus.OK;
    return switch (result.code()) {
      case CONFIRMATION_REQUIRED -> HttpStatus.OK;
      case AUTH_FAILURE -> HttpStatus.UNAUTHORIZED;
      case INVALID_CONFIRMATION -> HttpStatus.FORBIDDEN;
      case UNKNOWN_TOOL -> HttpStatus.NOT_FOUND;
      case INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
      case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
      case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
      case UPSTREAM_ERROR, UPSTREAM_AUTH_FAILURE, NETWORK_ERROR -> HttpStatus.BAD_GATEWAY;
    };
  }
}
