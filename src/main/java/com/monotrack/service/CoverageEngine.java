package com.monotrack.service;

import com.monotrack.dto.CoverageSource;
import com.monotrack.dto.EarnUsage;
import com.monotrack.dto.ReportTotals;
import com.monotrack.dto.SpendCoverage;
import com.monotrack.model.BankTransaction;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Allocates a day's income to its spends, first in first out.
 *
 * <p>Earns and spends are both ordered by time, then id. Each spend draws from the earliest earn
 * that still has money left, moving on to the next one until the spend is paid or income runs out.
 * Holds are ignored on both sides. The result depends only on the input transactions.
 */
@Component
public class CoverageEngine {
  private static final Comparator<BankTransaction> BY_TIME_THEN_ID =
      Comparator.comparingLong(BankTransaction::getTime).thenComparing(BankTransaction::getId);

  public CoverageResult compute(List<BankTransaction> transactions) {
    List<BankTransaction> earns = new ArrayList<>();
    List<BankTransaction> spends = new ArrayList<>();
    for (BankTransaction tx : transactions) {
      if (tx.isHold()) {
        continue;
      }
      if (tx.isEarn()) {
        earns.add(tx);
      } else if (tx.isSpend()) {
        spends.add(tx);
      }
    }
    earns.sort(BY_TIME_THEN_ID);
    spends.sort(BY_TIME_THEN_ID);

    // TODO: seed the pool with unspent income carried over from earlier days once that is modeled.
    List<EarnSlice> pool = new ArrayList<>(earns.size());
    for (BankTransaction earn : earns) {
      pool.add(new EarnSlice(earn));
    }

    List<SpendCoverage> coverage = new ArrayList<>(spends.size());
    long spendTotal = 0;
    int head = 0;
    for (BankTransaction spend : spends) {
      long magnitude = -spend.getAmount();
      spendTotal += magnitude;
      long need = magnitude;
      List<CoverageSource> sources = new ArrayList<>();
      while (need > 0 && head < pool.size()) {
        EarnSlice slice = pool.get(head);
        if (slice.remaining == 0) {
          head++;
          continue;
        }
        long take = Math.min(need, slice.remaining);
        sources.add(new CoverageSource(slice.source.getId(), take));
        slice.remaining -= take;
        need -= take;
      }
      long covered = magnitude - need;
      coverage.add(new SpendCoverage(
          spend.getId(),
          spend.getAccountId(),
          spend.getTime(),
          spend.getDescription(),
          magnitude,
          need == 0,
          covered,
          need,
          List.copyOf(sources),
          need == 0 ? null : SpendCoverage.REASON_INSUFFICIENT_INCOME));
    }

    List<EarnUsage> usage = new ArrayList<>(pool.size());
    long earnTotal = 0;
    for (EarnSlice slice : pool) {
      long amount = slice.source.getAmount();
      earnTotal += amount;
      usage.add(new EarnUsage(
          slice.source.getId(),
          slice.source.getAccountId(),
          slice.source.getTime(),
          slice.source.getDescription(),
          amount,
          amount - slice.remaining,
          slice.remaining));
    }

    return new CoverageResult(
        List.copyOf(coverage),
        List.copyOf(usage),
        new ReportTotals(spendTotal, earnTotal, earnTotal - spendTotal));
  }

  private static final class EarnSlice {
    private final BankTransaction source;
    private long remaining;

    private EarnSlice(BankTransaction source) {
      this.source = source;
      this.remaining = source.getAmount();
    }
  }
}
