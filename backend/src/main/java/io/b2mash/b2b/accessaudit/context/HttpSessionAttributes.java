package io.b2mash.b2b.accessaudit.context;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;

/**
 * {@link SessionAttributes} backed by the servlet session. Reads never create a session; writes
 * do.
 */
public class HttpSessionAttributes implements SessionAttributes {

  private final HttpServletRequest request;

  public HttpSessionAttributes(HttpServletRequest request) {
    this.request = request;
  }

  @Override
  public Object getAttribute(String name) {
    HttpSession session = request.getSession(false);
    return session != null ? session.getAttribute(name) : null;
  }

  @Override
  public void setAttribute(String name, Object value) {
    request.getSession(true).setAttribute(name, value);
  }
}
