package io.b2mash.b2b.accessaudit.context;

/** Resolves the client IP address from a request, handling reverse proxy headers. */
public final class ClientIpResolver {

  private ClientIpResolver() {}

  /**
   * Extracts the client IP from the request. Checks X-Forwarded-For (first IP), then X-Real-IP,
   * then falls back to the socket remote address. Returns an empty string when nothing is known.
   */
  public static String resolve(RequestContext request) {
    if (request == null) {
      return "";
    }
    return firstNonBlank(
        request.header("X-Forwarded-For"), request.header("X-Real-IP"), request.remoteAddr());
  }

  private static String firstNonBlank(String xForwardedFor, String xRealIp, String remoteAddr) {
    if (xForwardedFor != null && !xForwardedFor.isBlank()) {
      return xForwardedFor.split(",")[0].trim();
    }
    if (xRealIp != null && !xRealIp.isBlank()) {
      return xRealIp.trim();
    }
    return remoteAddr != null ? remoteAddr.trim() : "";
  }
}
