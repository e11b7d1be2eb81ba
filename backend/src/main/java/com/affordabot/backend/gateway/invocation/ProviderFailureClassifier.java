package com.affordabot.backend.gateway.invocation;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Maps provider client errors onto {@link ProviderCallException.Kind}. HTTP 429 is rate limiting;
 * 5xx and client errors caused by the provider's own state (auth, billing, unknown model) are
 * transient because another provider may serve the same request; remaining 4xx codes mean the
 * request itself is malformed.
 */
public final class ProviderFailureClassifier {

  private static final Set<Integer> PROVIDER_SIDE_CLIENT_ERRORS = Set.of(401, 402, 403, 404, 408, 409);

  private ProviderFailureClassifier() {}

  public static ProviderCallException classify(String providerId, Throwable throwable) {
    Throwable failure = unwrap(throwable);
    if (failure instanceof ProviderCallException providerCallException) {
      return providerCallException;
    }
    if (failure instanceof RestClientResponseException restException) {
      return fromStatus(
          providerId, restException.getStatusCode().value(), restException.getResponseHeaders(), restException);
    }
    if (failure instanceof WebClientResponseException webClientException) {
      return fromStatus(
          providerId, webClientException.getStatusCode().value(), webClientException.getHeaders(), webClientException);
    }
    if (failure instanceof NonTransientAiException nonTransient) {
      return ProviderCallException.rejected(providerId, null, describe(nonTransient), nonTransient);
    }
    // I/O errors, TransientAiException and anything unexpected: worth trying the next provider
    return ProviderCallException.transientFailure(providerId, describe(failure), failure);
  }

  static ProviderCallException fromStatus(
      String providerId, int status, HttpHeaders headers, Throwable cause) {
    String message = "HTTP " + status + " from provider " + providerId;
    if (status == 429) {
      return ProviderCallException.rateLimited(providerId, parseRetryAfter(headers), message, cause);
    }
    if (status >= 500 || PROVIDER_SIDE_CLIENT_ERRORS.contains(status)) {
      return new ProviderCallException(
          providerId, ProviderCallException.Kind.TRANSIENT, status, null, message, cause);
    }
    return ProviderCallException.rejected(providerId, status, message, cause);
  }

  static Duration parseRetryAfter(HttpHeaders headers) {
    if (headers == null) {
      return null;
    }
    String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
    if (!StringUtils.hasText(value)) {
      return null;
    }
    try {
      long seconds = Long.parseLong(value.trim());
      return seconds > 0 ? Duration.ofSeconds(seconds) : null;
    } catch (NumberFormatException httpDate) {
      return null;
    }
  }

  private static Throwable unwrap(Throwable throwable) {
    Throwable current = throwable;
    while ((current instanceof ExecutionException || current instanceof CompletionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static String describe(Throwable failure) {
    if (failure == null) {
      return "unknown failure";
    }
    String message = failure.getMessage();
    return StringUtils.hasText(message)
        ? failure.getClass().getSimpleName() + ": " + message
        : failure.getClass().getSimpleName();
  }
}
