package com.monotrack.store;

import java.util.Optional;

public interface WatermarkStore {
  Optional<Long> getWatermark(String userId, String accountId);

  /**
   * Stores {@code time} as the account's watermark. A value lower than the stored one is ignored.
   */
  void setWatermark(String userId, String accountId, long time);
}
