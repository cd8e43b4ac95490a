package com.polycopy.polymarket.http;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

public final class HttpRequestFactory {

  private final URI baseUri;

  public HttpRequestFactory(URI baseUri) {
    this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
  }

  public HttpRequest.Builder request(String path, Map<String, String> query) {
    return HttpRequest.newBuilder(uri(path, query));
  }

  URI uri(String path, Map<String, String> query) {
    String base = baseUri.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    String p = path == null ? "" : path;
    if (!p.isEmpty() && !p.startsWith("/")) {
      p = "/" + p;
    }
    if (query == null || query.isEmpty()) {
      return URI.create(base + p);
    }
    StringJoiner qs = new StringJoiner("&");
    for (Map.Entry<String, String> e : query.entrySet()) {
      if (e.getValue() == null) {
        continue;
      }
      qs.add(encode(e.getKey()) + "=" + encode(e.getValue()));
    }
    String q = qs.toString();
    return URI.create(q.isEmpty() ? base + p : base + p + "?" + q);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
