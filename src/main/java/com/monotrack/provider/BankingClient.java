package com.monotrack.provider;

import java.time.Duration;
import java.util.List;

/**
 * Read-only access to a banking provider on behalf of one credential.
 *
 * <p>Implementations translate transport failures into {@link BankingProviderException}
 * subtypes so callers can tell retryable failures from permanent ones.
 */
public interface BankingClient {
  List<ProviderAccount> listAccounts(String credential);

  /**
   * Statement items for {@code accountId} with time in {@code [from, to]} (unix seconds, inclusive).
   * A provider may return at most {@link #statementPageLimit()} items per call, newest first.
   */
  List<StatementItem> listStatementItems(String credential, String accountId, long from, long to);

  Duration maxStatementWindow();

  int statementPageLimit();
}
