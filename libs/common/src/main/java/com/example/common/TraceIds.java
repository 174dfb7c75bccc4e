package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** Returns the caller-supplied id when present, otherwise a freshly generated one. */
  public static String resolve(String candidate) {
    if (candidate == null || candidate.isBlank()) {
      return newTraceId();
    }
    return candidate.trim();
  }
}
