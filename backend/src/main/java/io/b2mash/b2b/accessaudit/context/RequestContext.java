package io.b2mash.b2b.accessaudit.context;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Snapshot of the inbound request that triggered an audited operation. Header lookups are
 * case-insensitive.
 *
 * @param remoteAddr socket peer address; may be null
 * @param headers request headers (first value per name)
 * @param apiRequest true when the request was served by the REST API rather than the web UI
 * @param session session state owned by the authentication layer
 */
public record RequestContext(
    String remoteAddr, Map<String, String> headers, boolean apiRequest, SessionAttributes session) {

  public RequestContext {
    var copy = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
    if (headers != null) {
      copy.putAll(headers);
    }
    headers = Collections.unmodifiableMap(copy);
    if (session == null) {
      session = new MapSessionAttributes();
    }
  }

  /** Web UI request with a fresh in-memory session. */
  public static RequestContext of(String remoteAddr, Map<String, String> headers) {
    return new RequestContext(remoteAddr, headers, false, null);
  }

  /** REST API request with a fresh in-memory session. */
  public static RequestContext api(String remoteAddr, Map<String, String> headers) {
    return new RequestContext(remoteAddr, headers, true, null);
  }

  public static RequestContext fromServletRequest(HttpServletRequest request, boolean apiRequest) {
    var headers = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
    var names = request.getHeaderNames();
    while (names != null && names.hasMoreElements()) {
      String name = names.nextElement();
      headers.putIfAbsent(name, request.getHeader(name));
    }
    return new RequestContext(
        request.getRemoteAddr(), headers, apiRequest, new HttpSessionAttributes(request));
  }

  /** Returns the header value, or null if absent. */
  public String header(String name) {
    return headers.get(name);
  }
}
