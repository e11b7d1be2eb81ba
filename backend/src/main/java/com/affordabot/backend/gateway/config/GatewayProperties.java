package com.affordabot.backend.gateway.config;

import com.affordabot.backend.gateway.cost.BudgetPeriod;
import com.affordabot.backend.gateway.provider.model.CostUnit;
import com.affordabot.backend.gateway.provider.model.ProviderFamily;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "app.gateway")
@Validated
public class GatewayProperties {

  @Valid private Budget budget = new Budget();

  /** Per-attempt timeout used when neither the request nor the provider defines one. */
  private Duration defaultTimeout = Duration.ofSeconds(30);

  /**
   * Longest time the engine waits for the highest-priority candidate's rate window to roll over
   * before moving on. Zero keeps the skip-and-move-on behaviour.
   */
  private Duration rateLimitWait = Duration.ZERO;

  /** Provider entries keyed by identifier. Declaration order breaks priority ties. */
  @Valid private Map<String, Provider> providers = new LinkedHashMap<>();

  @Valid private Search search = new Search();

  public Budget getBudget() {
    return budget;
  }

  public void setBudget(Budget budget) {
    this.budget = budget;
  }

  public Duration getDefaultTimeout() {
    return defaultTimeout;
  }

  public void setDefaultTimeout(Duration defaultTimeout) {
    this.defaultTimeout = defaultTimeout;
  }

  public Duration getRateLimitWait() {
    return rateLimitWait;
  }

  public void setRateLimitWait(Duration rateLimitWait) {
    this.rateLimitWait = rateLimitWait;
  }

  public Map<String, Provider> getProviders() {
    return providers;
  }

  public void setProviders(Map<String, Provider> providers) {
    this.providers = providers;
  }

  public Search getSearch() {
    return search;
  }

  public void setSearch(Search search) {
    this.search = search;
  }

  public static class Budget {

    @NotNull @PositiveOrZero private BigDecimal ceiling = new BigDecimal("5.00");
    private String currency = "USD";
    private BudgetPeriod period = BudgetPeriod.DAILY;

    /** Share of the ceiling after which a warning is logged once per budget period. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double alertThreshold = 0.8;

    public BigDecimal getCeiling() {
      return ceiling;
    }

    public void setCeiling(BigDecimal ceiling) {
      this.ceiling = ceiling;
    }

    public String getCurrency() {
      return currency;
    }

    public void setCurrency(String currency) {
      this.currency = currency;
    }

    public BudgetPeriod getPeriod() {
      return period;
    }

    public void setPeriod(BudgetPeriod period) {
      this.period = period;
    }

    public double getAlertThreshold() {
      return alertThreshold;
    }

    public void setAlertThreshold(double alertThreshold) {
      this.alertThreshold = alertThreshold;
    }
  }

  public static class Provider {

    private boolean enabled = true;
    private ProviderType type;
    private ProviderFamily family;
    private String displayName;
    private int priority = 100;
    private List<String> capabilities = new ArrayList<>();
    private String model;
    private String baseUrl;
    private String apiKey;
    private String completionsPath;
    private String searchPath;
    private Duration timeout;
    private Integer maxTokens;
    private Double temperature;
    @Valid private Pricing pricing = new Pricing();
    @Valid private RateLimit rateLimit;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public ProviderType getType() {
      return type;
    }

    public void setType(ProviderType type) {
      this.type = type;
    }

    public ProviderFamily getFamily() {
      return family;
    }

    public void setFamily(ProviderFamily family) {
      this.family = family;
    }

    public String getDisplayName() {
      return displayName;
    }

    public void setDisplayName(String displayName) {
      this.displayName = displayName;
    }

    public int getPriority() {
      return priority;
    }

    public void setPriority(int priority) {
      this.priority = priority;
    }

    public List<String> getCapabilities() {
      return capabilities;
    }

    public void setCapabilities(List<String> capabilities) {
      this.capabilities = capabilities;
    }

    public String getModel() {
      return model;
    }

    public void setModel(String model) {
      this.model = model;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public String getCompletionsPath() {
      return completionsPath;
    }

    public void setCompletionsPath(String completionsPath) {
      this.completionsPath = completionsPath;
    }

    public String getSearchPath() {
      return searchPath;
    }

    public void setSearchPath(String searchPath) {
      this.searchPath = searchPath;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public Integer getMaxTokens() {
      return maxTokens;
    }

    public void setMaxTokens(Integer maxTokens) {
      this.maxTokens = maxTokens;
    }

    public Double getTemperature() {
      return temperature;
    }

    public void setTemperature(Double temperature) {
      this.temperature = temperature;
    }

    public Pricing getPricing() {
      return pricing;
    }

    public void setPricing(Pricing pricing) {
      this.pricing = pricing;
    }

    public RateLimit getRateLimit() {
      return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
      this.rateLimit = rateLimit;
    }
  }

  public static class Pricing {
    private CostUnit unit = CostUnit.PER_1K_TOKENS;
    @PositiveOrZero private BigDecimal inputPer1KTokens = BigDecimal.ZERO;
    @PositiveOrZero private BigDecimal outputPer1KTokens = BigDecimal.ZERO;
    @PositiveOrZero private BigDecimal perRequest = BigDecimal.ZERO;
    private String currency = "USD";

    public CostUnit getUnit() {
      return unit;
    }

    public void setUnit(CostUnit unit) {
      this.unit = unit;
    }

    public BigDecimal getInputPer1KTokens() {
      return inputPer1KTokens;
    }

    public void setInputPer1KTokens(BigDecimal inputPer1KTokens) {
      this.inputPer1KTokens = inputPer1KTokens;
    }

    public BigDecimal getOutputPer1KTokens() {
      return outputPer1KTokens;
    }

    public void setOutputPer1KTokens(BigDecimal outputPer1KTokens) {
      this.outputPer1KTokens = outputPer1KTokens;
    }

    public BigDecimal getPerRequest() {
      return perRequest;
    }

    public void setPerRequest(BigDecimal perRequest) {
      this.perRequest = perRequest;
    }

    public String getCurrency() {
      return currency;
    }

    public void setCurrency(String currency) {
      this.currency = currency;
    }
  }

  public static class RateLimit {
    private int maxCalls = 60;
    private Long maxTokens;
    private Duration window = Duration.ofMinutes(1);

    public int getMaxCalls() {
      return maxCalls;
    }

    public void setMaxCalls(int maxCalls) {
      this.maxCalls = maxCalls;
    }

    public Long getMaxTokens() {
      return maxTokens;
    }

    public void setMaxTokens(Long maxTokens) {
      this.maxTokens = maxTokens;
    }

    public Duration getWindow() {
      return window;
    }

    public void setWindow(Duration window) {
      this.window = window;
    }
  }

  public static class Search {
    @Valid private Cache cache = new Cache();

    public Cache getCache() {
      return cache;
    }

    public void setCache(Cache cache) {
      this.cache = cache;
    }
  }

  public static class Cache {

    private boolean enabled = true;

    /** TTL of the in-process cache tier. */
    private Duration memoryTtl = Duration.ofHours(1);

    /** Entry bound of the in-process cache tier. */
    private long memoryMaximumSize = 10_000;

    /** Enables the shared Redis tier when a {@code StringRedisTemplate} is available. */
    private boolean redisEnabled = true;

    private Duration redisTtl = Duration.ofHours(24);

    /** Prefix appended to Redis keys that store cached search results. */
    private String keyPrefix = "gateway:search";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getMemoryTtl() {
      return memoryTtl;
    }

    public void setMemoryTtl(Duration memoryTtl) {
      this.memoryTtl = memoryTtl;
    }

    public long getMemoryMaximumSize() {
      return memoryMaximumSize;
    }

    public void setMemoryMaximumSize(long memoryMaximumSize) {
      this.memoryMaximumSize = memoryMaximumSize;
    }

    public boolean isRedisEnabled() {
      return redisEnabled;
    }

    public void setRedisEnabled(boolean redisEnabled) {
      this.redisEnabled = redisEnabled;
    }

    public Duration getRedisTtl() {
      return redisTtl;
    }

    public void setRedisTtl(Duration redisTtl) {
      this.redisTtl = redisTtl;
    }

    public String getKeyPrefix() {
      return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
      this.keyPrefix = keyPrefix;
    }
  }
}
