package com.wakelink.external;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Общий вызов внешнего HTTP-сервиса с таймаутом. Любой статус 4xx/5xx считается ошибкой.
 */
class JsonHttpCaller {

  private final HttpClient httpClient;
  private final Duration timeout;

  JsonHttpCaller(HttpClient httpClient, Duration timeout) {
    this.httpClient = httpClient;
    this.timeout = timeout;
  }

  String send(String method, String url, String contentType, HttpRequest.BodyPublisher body, String what)
      throws ExternalCallException {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(url))
        .header("Content-Type", contentType)
        .method(method, body)
        .timeout(timeout)
        .build();
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() >= 400) {
        throw new ExternalCallException(what + " вернул ошибку: " + response.statusCode());
      }
      return response.body();
    } catch (HttpTimeoutException e) {
      throw new ExternalCallException(what + ": таймаут " + timeout.toSeconds() + " с", e);
    } catch (IOException e) {
      throw new ExternalCallException(what + ": ошибка ввода-вывода", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExternalCallException(what + ": вызов прерван", e);
    }
  }
}
