package com.monotrack.provider.monobank;

import com.monotrack.config.MonobankProperties;
import com.monotrack.provider.BankingClient;
import com.monotrack.provider.BankingProviderException;
import com.monotrack.provider.ProviderAccount;
import com.monotrack.provider.ProviderCredentialException;
import com.monotrack.provider.ProviderRateLimitException;
import com.monotrack.provider.ProviderUnavailableException;
import com.monotrack.provider.StatementItem;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
public class MonobankClient implements BankingClient {
  private static final Logger log = LoggerFactory.getLogger(MonobankClient.class);
  private static final String TOKEN_HEADER = "X-Token";
  // 31 days + 1 hour, the longest statement range the API accepts.
  private static final long DEFAULT_WINDOW_SECONDS = 2_682_000L;
  private static final int DEFAULT_PAGE_LIMIT = 500;

  private final MonobankProperties properties;
  private final RestClient restClient;

  public MonobankClient(MonobankProperties properties,
                        @Qualifier("monobankRestClient") RestClient restClient) {
    this.properties = properties;
    this.restClient = restClient;
  }

  @Override
  public List<ProviderAccount> listAccounts(String credential) {
    requireCredential(credential);
    ClientInfoResponse body = call("client-info", () -> restClient.get()
        .uri("/personal/client-info")
        .header(TOKEN_HEADER, credential)
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .body(ClientInfoResponse.class));
    if (body == null) {
      return List.of();
    }
    List<ProviderAccount> accounts = body.toProviderAccounts();
    if (isDebugLogEnabled()) {
      log.info("Monobank client-info returned {} accounts", accounts.size());
    }
    return accounts;
  }

  @Override
  public List<StatementItem> listStatementItems(String credential, String accountId, long from, long to) {
    requireCredential(credential);
    List<StatementItem> items = call("statement " + accountId, () -> restClient.get()
        .uri("/personal/statement/{account}/{from}/{to}", accountId, from, to)
        .header(TOKEN_HEADER, credential)
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .body(new ParameterizedTypeReference<List<StatementItem>>() {}));
    if (isDebugLogEnabled()) {
      log.info("Monobank statement {} [{}, {}] returned {} items",
          accountId, from, to, items == null ? 0 : items.size());
    }
    return items == null ? List.of() : items;
  }

  @Override
  public Duration maxStatementWindow() {
    Long seconds = properties.maxStatementWindowSeconds();
    return Duration.ofSeconds(seconds == null || seconds <= 0 ? DEFAULT_WINDOW_SECONDS : seconds);
  }

  @Override
  public int statementPageLimit() {
    Integer limit = properties.statementPageLimit();
    return limit == null || limit <= 0 ? DEFAULT_PAGE_LIMIT : limit;
  }

  private <T> T call(String operation, Supplier<T> request) {
    try {
      return request.get();
    } catch (HttpClientErrorException ex) {
      HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
      String detail = truncate(ex.getResponseBodyAsString(), 500);
      if (status == HttpStatus.TOO_MANY_REQUESTS) {
        throw new ProviderRateLimitException("Monobank rate limit hit on " + operation, ex);
      }
      if (status == HttpStatus.UNAUTHORIZED || status == HttpStatus.FORBIDDEN) {
        throw new ProviderCredentialException("Monobank rejected the token on " + operation + ": " + detail, ex);
      }
      throw new BankingProviderException("Monobank " + operation + " failed with "
          + ex.getStatusCode().value() + ": " + detail, ex);
    } catch (HttpServerErrorException ex) {
      throw new ProviderUnavailableException("Monobank " + operation + " failed with "
          + ex.getStatusCode().value(), ex);
    } catch (ResourceAccessException ex) {
      throw new ProviderUnavailableException("Monobank " + operation + " unreachable: " + ex.getMessage(), ex);
    } catch (RestClientException ex) {
      throw new BankingProviderException("Monobank " + operation + " returned an unreadable response: "
          + ex.getMessage(), ex);
    }
  }

  private void requireCredential(String credential) {
    if (credential == null || credential.isBlank()) {
      throw new ProviderCredentialException("Missing Monobank token");
    }
  }

  private boolean isDebugLogEnabled() {
    return Boolean.TRUE.equals(properties.debugLogResponses());
  }

  private String truncate(String value, int maxLength) {
    if (value == null || value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength) + "...";
  }
}
