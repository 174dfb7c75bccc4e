package com.example.aggregator.api;

import com.example.aggregator.service.GatewayMetrics;
import com.example.aggregator.service.SourceIntegrationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
@RequiredArgsConstructor
public class GatewayApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(GatewayApiExceptionHandler.class);

  private final GatewayMetrics gatewayMetrics;

  @ExceptionHandler(SourceIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleSourceIntegration(SourceIntegrationException ex) {
    final HttpStatusCode status =
        switch (ex.reason()) {
          case MISCONFIGURED, INVALID_RESPONSE -> HttpStatus.INTERNAL_SERVER_ERROR;
          case BAD_REQUEST -> HttpStatus.BAD_REQUEST;
          case NOT_FOUND -> HttpStatus.NOT_FOUND;
          case UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
          case UPSTREAM_ERROR -> upstreamStatus(ex.upstreamStatus());
        };
    if (ex.reason() == SourceIntegrationException.Reason.MISCONFIGURED) {
      logger.warn("{} integration is misconfigured: {}", ex.source(), ex.getMessage());
    }
    gatewayMetrics.recordGatewayError(ex.reason().name());
    return ResponseEntity.status(status).body(new ApiErrorResponse(ex.getMessage()));
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingParameter(
      MissingServletRequestParameterException ex) {
    gatewayMetrics.recordGatewayError("BAD_REQUEST");
    return ResponseEntity.badRequest()
        .body(
            new ApiErrorResponse(
                "Query parameter '" + ex.getParameterName() + "' is required."));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    gatewayMetrics.recordGatewayError("BAD_REQUEST");
    return ResponseEntity.badRequest()
        .body(new ApiErrorResponse("Invalid value for '" + ex.getName() + "'."));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    gatewayMetrics.recordGatewayError("BAD_REQUEST");
    return ResponseEntity.badRequest().body(new ApiErrorResponse(ex.getMessage()));
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNoResource(NoResourceFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ApiErrorResponse("Not Found"));
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex) {
    return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
        .body(new ApiErrorResponse("Method Not Allowed"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleUnexpected(RuntimeException ex) {
    logger.error("unhandled exception", ex);
    gatewayMetrics.recordGatewayError("INTERNAL");
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("Internal server error"));
  }

  // Only client and server error statuses are passed through.
  private static HttpStatusCode upstreamStatus(int status) {
    if (status >= 400 && status <= 599) {
      return HttpStatusCode.valueOf(status);
    }
    return HttpStatus.BAD_GATEWAY;
  }
}
