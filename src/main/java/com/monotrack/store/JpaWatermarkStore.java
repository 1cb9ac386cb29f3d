package com.monotrack.store;

import com.monotrack.model.SyncWatermark;
import com.monotrack.model.WatermarkKey;
import com.monotrack.repository.SyncWatermarkRepository;
import java.util.Optional;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JpaWatermarkStore implements WatermarkStore {
  private final SyncWatermarkRepository watermarkRepository;

  public JpaWatermarkStore(SyncWatermarkRepository watermarkRepository) {
    this.watermarkRepository = watermarkRepository;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Long> getWatermark(String userId, String accountId) {
    return watermarkRepository.findById(new WatermarkKey(userId, accountId))
        .map(SyncWatermark::getLastSyncedTime);
  }

  @Override
  @Transactional
  public void setWatermark(String userId, String accountId, long time) {
    try {
      SyncWatermark watermark = watermarkRepository.findById(new WatermarkKey(userId, accountId))
          .orElseGet(() -> {
            SyncWatermark created = new SyncWatermark();
            created.setUserId(userId);
            created.setAccountId(accountId);
            created.setLastSyncedTime(time);
            return created;
          });
      if (time < watermark.getLastSyncedTime()) {
        return;
      }
      watermark.setLastSyncedTime(time);
      watermarkRepository.saveAndFlush(watermark);
    } catch (DataAccessException ex) {
      throw new StoreWriteException("Failed to store watermark for account " + accountId, ex);
    }
  }
}
