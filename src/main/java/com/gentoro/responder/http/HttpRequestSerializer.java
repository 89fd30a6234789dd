package com.gentoro.responder.http;

import com.gentoro.responder.exception.RequestSerializationException;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Renders a {@link CapturedHttpRequest} in HTTP/1.x wire form:
 *
 * <pre>
 *   METHOD request-uri PROTOCOL
 *   Host: host
 *   Name: value          (remaining headers sorted by name, repeated values in arrival order)
 *
 *   body
 * </pre>
 *
 * Lines end with CRLF. A request whose framing cannot be expressed on the wire is rejected as a
 * whole.
 */
public final class HttpRequestSerializer {
  private static final String CRLF = "\r\n";
  private static final Pattern TOKEN = Pattern.compile("[!#$%&'*+\\-.^_`|~0-9A-Za-z]+");
  private static final Pattern PROTOCOL = Pattern.compile("HTTP/\\d(\\.\\d)?");
  private static final Comparator<CapturedHttpRequest.Header> BY_NAME =
      Comparator.comparing(CapturedHttpRequest.Header::name, String::compareToIgnoreCase);

  private HttpRequestSerializer() {}

  /**
   * @throws RequestSerializationException on a malformed method, request URI, protocol or header
   */
  public static String toWireFormat(CapturedHttpRequest request) {
    String method = request.method();
    if (method == null || !TOKEN.matcher(method).matches()) {
      throw new RequestSerializationException("malformed request method: " + quote(method));
    }
    String uri = request.requestUri();
    if (uri == null || uri.isEmpty() || containsWhitespaceOrControl(uri)) {
      throw new RequestSerializationException("malformed request URI: " + quote(uri));
    }
    String protocol = request.protocol();
    if (protocol == null || !PROTOCOL.matcher(protocol).matches()) {
      throw new RequestSerializationException("malformed protocol version: " + quote(protocol));
    }

    StringBuilder sb = new StringBuilder();
    sb.append(method).append(' ').append(uri).append(' ').append(protocol).append(CRLF);

    String host = request.host();
    if (host != null && !host.isEmpty()) {
      checkHeaderValue("Host", host);
      sb.append("Host: ").append(host).append(CRLF);
    }

    List<CapturedHttpRequest.Header> headers =
        request.headers().stream()
            .filter(h -> !h.name().equalsIgnoreCase("Host"))
            .sorted(BY_NAME)
            .toList();
    for (CapturedHttpRequest.Header header : headers) {
      if (!TOKEN.matcher(header.name()).matches()) {
        throw new RequestSerializationException("malformed header name: " + quote(header.name()));
      }
      checkHeaderValue(header.name(), header.value());
      sb.append(header.name()).append(": ").append(header.value()).append(CRLF);
    }

    sb.append(CRLF);
    sb.append(request.bodyAsString());
    return sb.toString();
  }

  private static void checkHeaderValue(String name, String value) {
    if (value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0 || value.indexOf('\0') >= 0) {
      throw new RequestSerializationException("malformed value for header " + name);
    }
  }

  private static boolean containsWhitespaceOrControl(String value) {
    return value.chars().anyMatch(c -> c <= ' ' || c == 0x7f);
  }

  private static String quote(String value) {
    return value == null ? "null" : "'" + value.replace("\r", "\\r").replace("\n", "\\n") + "'";
  }
}
