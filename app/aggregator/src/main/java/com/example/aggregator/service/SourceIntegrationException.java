package com.example.aggregator.service;

/**
 * Failure of one upstream source, already classified into the gateway's error kinds.
 *
 * <p>{@link #source()} is the display name used in client-facing messages such as "Could not
 * connect to the GitHub API.".
 */
public class SourceIntegrationException extends RuntimeException {

  public enum Reason {
    MISCONFIGURED,
    BAD_REQUEST,
    NOT_FOUND,
    UPSTREAM_ERROR,
    UNAVAILABLE,
    INVALID_RESPONSE
  }

  private final Reason reason;
  private final String source;
  private final int upstreamStatus;

  public SourceIntegrationException(Reason reason, String source, String message) {
    this(reason, source, message, 0, null);
  }

  public SourceIntegrationException(
      Reason reason, String source, String message, int upstreamStatus, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.source = source;
    this.upstreamStatus = upstreamStatus;
  }

  public static SourceIntegrationException misconfigured(String source, String setting) {
    return new SourceIntegrationException(
        Reason.MISCONFIGURED, source, setting + " is not configured in the environment.");
  }

  public static SourceIntegrationException badRequest(String source, String message) {
    return new SourceIntegrationException(Reason.BAD_REQUEST, source, message);
  }

  public static SourceIntegrationException notFound(String source, String message) {
    return new SourceIntegrationException(Reason.NOT_FOUND, source, message);
  }

  public static SourceIntegrationException invalidResponse(String source, String message) {
    return new SourceIntegrationException(Reason.INVALID_RESPONSE, source, message);
  }

  public Reason reason() {
    return reason;
  }

  public String source() {
    return source;
  }

  /** Upstream HTTP status for {@link Reason#UPSTREAM_ERROR}, otherwise 0. */
  public int upstreamStatus() {
    return upstreamStatus;
  }
}
