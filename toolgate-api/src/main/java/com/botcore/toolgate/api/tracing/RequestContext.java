package com.botcore.toolgate.api.tracing;

/**
 * Per-request context stored in ThreadLocal (request id only).
 */
public final class RequestContext {

  private static final ThreadLocal<String> TL = new ThreadLocal<>();

  private RequestContext() {}

  public static void set(String requestId) {
    TL.set(requestId);
  }

  public static void clear() {
    TL.remove();
  }

  public static String requestId() {
    return TL.get();
  }
}
