package com.monotrack.store;

import java.util.List;
import java.util.Optional;

public interface UserDirectory {
  /**
   * Active users in a stable order. Throws {@link UserDirectoryUnavailableException} when the
   * directory cannot be read at all.
   */
  List<SyncUser> listActiveUsers();

  Optional<SyncUser> findUser(String userId);
}
