package com.monotrack.repository;

import com.monotrack.model.UserProfile;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserProfileRepository extends JpaRepository<UserProfile, String> {
  List<UserProfile> findByActiveTrueOrderByIdAsc();
}
