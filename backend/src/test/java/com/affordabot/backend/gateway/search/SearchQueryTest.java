package com.affordabot.backend.gateway.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class SearchQueryTest {

  @Test
  void defaultsToTenResultsWithoutFilters() {
    SearchQuery query = SearchQuery.of("San Jose housing bond");

    assertThat(query.count()).isEqualTo(SearchQuery.DEFAULT_COUNT);
    assertThat(query.domains()).isEmpty();
    assertThat(query.recency()).isNull();
  }

  @Test
  void rejectsBlankQueryAndOutOfRangeCount() {
    assertThatThrownBy(() -> SearchQuery.of("  ")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SearchQuery.of("x").withCount(0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SearchQuery.of("x").withCount(26)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SearchQuery.of("x").withRecency("2w"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("1d");
  }

  @Test
  void cacheKeyIgnoresCaseWhitespaceAndDomainOrder() {
    SearchQuery first =
        SearchQuery.of("San Jose  housing bond").withDomains(List.of("*.gov", "sanjoseca.gov")).withRecency("1M");
    SearchQuery second =
        SearchQuery.of(" san jose housing BOND ").withDomains(List.of("sanjoseca.gov", "*.gov")).withRecency("1m");

    assertThat(first.cacheKey()).isEqualTo(second.cacheKey()).hasSize(64);
    assertThat(first.normalizedQuery()).isEqualTo("San Jose housing bond");
  }

  @Test
  void cacheKeyChangesWithResultShapingParameters() {
    SearchQuery base = SearchQuery.of("rent control ordinance");

    assertThat(base.withCount(5).cacheKey()).isNotEqualTo(base.cacheKey());
    assertThat(base.withDomains(List.of("*.gov")).cacheKey()).isNotEqualTo(base.cacheKey());
    assertThat(base.withRecency("1w").cacheKey()).isNotEqualTo(base.cacheKey());
  }
}
