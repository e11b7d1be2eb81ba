package com.affordabot.backend.gateway.search;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

/**
 * Web search request.
 *
 * @param count number of results, 1 to 25
 * @param domains optional domain filters such as {@code *.gov}
 * @param recency optional time filter: {@code 1d}, {@code 1w}, {@code 1m} or {@code 1y}
 */
public record SearchQuery(String query, int count, List<String> domains, String recency) {

  public static final int DEFAULT_COUNT = 10;
  public static final int MAX_COUNT = 25;

  private static final List<String> RECENCY_FILTERS = List.of("1d", "1w", "1m", "1y");

  public SearchQuery {
    if (!StringUtils.hasText(query)) {
      throw new IllegalArgumentException("query must not be blank");
    }
    if (count < 1 || count > MAX_COUNT) {
      throw new IllegalArgumentException("count must be between 1 and " + MAX_COUNT);
    }
    domains =
        CollectionUtils.isEmpty(domains)
            ? List.of()
            : domains.stream().filter(StringUtils::hasText).map(String::trim).toList();
    recency = StringUtils.hasText(recency) ? recency.trim().toLowerCase(Locale.ROOT) : null;
    if (recency != null && !RECENCY_FILTERS.contains(recency)) {
      throw new IllegalArgumentException("recency must be one of " + RECENCY_FILTERS);
    }
  }

  public static SearchQuery of(String query) {
    return new SearchQuery(query, DEFAULT_COUNT, List.of(), null);
  }

  public SearchQuery withCount(int count) {
    return new SearchQuery(query, count, domains, recency);
  }

  public SearchQuery withDomains(List<String> domains) {
    return new SearchQuery(query, count, domains, recency);
  }

  public SearchQuery withRecency(String recency) {
    return new SearchQuery(query, count, domains, recency);
  }

  /** Query text with collapsed whitespace, case preserved. */
  public String normalizedQuery() {
    return query.trim().replaceAll("\\s+", " ");
  }

  /**
   * Stable key over every parameter that changes the result set. Query case and domain order do
   * not matter.
   */
  public String cacheKey() {
    String canonical =
        normalizedQuery().toLowerCase(Locale.ROOT)
            + "|"
            + count
            + "|"
            + String.join(",", new TreeSet<>(domains))
            + "|"
            + (recency != null ? recency : "");
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException exception) {
      throw new IllegalStateException("SHA-256 is not available", exception);
    }
  }
}
