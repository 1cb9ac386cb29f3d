package com.monotrack.store;

import com.monotrack.model.UserProfile;
import com.monotrack.repository.UserProfileRepository;
import java.util.List;
import java.util.Optional;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

@Component
public class JpaUserDirectory implements UserDirectory {
  private final UserProfileRepository userRepository;

  public JpaUserDirectory(UserProfileRepository userRepository) {
    this.userRepository = userRepository;
  }

  @Override
  public List<SyncUser> listActiveUsers() {
    try {
      return userRepository.findByActiveTrueOrderByIdAsc().stream()
          .map(JpaUserDirectory::toSyncUser)
          .toList();
    } catch (DataAccessException | TransactionException ex) {
      throw new UserDirectoryUnavailableException("Failed to list active users", ex);
    }
  }

  @Override
  public Optional<SyncUser> findUser(String userId) {
    try {
      return userRepository.findById(userId).map(JpaUserDirectory::toSyncUser);
    } catch (DataAccessException | TransactionException ex) {
      throw new UserDirectoryUnavailableException("Failed to load user " + userId, ex);
    }
  }

  private static SyncUser toSyncUser(UserProfile user) {
    return new SyncUser(user.getId(), user.isActive(), user.getMonoToken());
  }
}
