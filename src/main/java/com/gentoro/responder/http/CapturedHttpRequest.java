package com.gentoro.responder.http;

import com.gentoro.responder.exception.RequestSerializationException;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of an inbound HTTP request: request line, headers in arrival order and the
 * raw body. Safe to hand to another thread once built.
 */
public final class CapturedHttpRequest {

  public record Header(String name, String value) {
    public Header {
      Objects.requireNonNull(name, "name");
      value = value == null ? "" : value;
    }
  }

  private final String method;
  private final String requestUri;
  private final String protocol;
  private final String host;
  private final List<Header> headers;
  private final byte[] body;

  private CapturedHttpRequest(Builder builder) {
    this.method = builder.method;
    this.requestUri = builder.requestUri;
    this.protocol = builder.protocol;
    this.host = builder.host;
    this.headers = Collections.unmodifiableList(new ArrayList<>(builder.headers));
    this.body = builder.body.clone();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Captures a servlet request, consuming its body.
   *
   * @throws RequestSerializationException when the body cannot be read
   */
  public static CapturedHttpRequest from(HttpServletRequest request) {
    String uri = request.getRequestURI();
    if (request.getQueryString() != null) {
      uri = uri + "?" + request.getQueryString();
    }

    Builder builder =
        builder().method(request.getMethod()).requestUri(uri).protocol(request.getProtocol());

    String host = request.getHeader("Host");
    if (host == null || host.isBlank()) {
      host = request.getServerName();
      int port = request.getServerPort();
      if (host != null && port > 0 && port != 80 && port != 443) {
        host = host + ":" + port;
      }
    }
    builder.host(host);

    Enumeration<String> names = request.getHeaderNames();
    while (names != null && names.hasMoreElements()) {
      String name = names.nextElement();
      Enumeration<String> values = request.getHeaders(name);
      while (values != null && values.hasMoreElements()) {
        builder.header(name, values.nextElement());
      }
    }

    try {
      builder.body(request.getInputStream().readAllBytes());
    } catch (IOException e) {
      throw new RequestSerializationException("failed to read request body", e);
    }
    return builder.build();
  }

  public String method() {
    return method;
  }

  public String requestUri() {
    return requestUri;
  }

  public String protocol() {
    return protocol;
  }

  /** Value for the {@code Host} line; may be null when neither header nor server name is known. */
  public String host() {
    return host;
  }

  public List<Header> headers() {
    return headers;
  }

  public byte[] body() {
    return body.clone();
  }

  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return method + " " + requestUri + " " + protocol;
  }

  public static final class Builder {
    private String method = "GET";
    private String requestUri = "/";
    private String protocol = "HTTP/1.1";
    private String host;
    private final List<Header> headers = new ArrayList<>();
    private byte[] body = new byte[0];

    private Builder() {}

    public Builder method(String method) {
      this.method = method;
      return this;
    }

    public Builder requestUri(String requestUri) {
      this.requestUri = requestUri;
      return this;
    }

    public Builder protocol(String protocol) {
      this.protocol = protocol;
      return this;
    }

    /** Explicit host; when unset, the first {@code Host} header is used. */
    public Builder host(String host) {
      this.host = host;
      return this;
    }

    public Builder header(String name, String value) {
      this.headers.add(new Header(name, value));
      return this;
    }

    public Builder body(byte[] body) {
      this.body = body == null ? new byte[0] : body;
      return this;
    }

    public Builder body(String body) {
      return body(body == null ? null : body.getBytes(StandardCharsets.UTF_8));
    }

    public CapturedHttpRequest build() {
      if (host == null) {
        host =
            headers.stream()
                .filter(h -> h.name().equalsIgnoreCase("Host"))
                .map(Header::value)
                .findFirst()
                .orElse(null);
      }
      return new CapturedHttpRequest(this);
    }
  }
}
