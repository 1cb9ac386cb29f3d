package com.monotrack.repository;

import com.monotrack.model.SyncWatermark;
import com.monotrack.model.WatermarkKey;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SyncWatermarkRepository extends JpaRepository<SyncWatermark, WatermarkKey> {
}
