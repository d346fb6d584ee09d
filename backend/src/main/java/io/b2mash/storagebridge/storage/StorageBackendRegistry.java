package io.b2mash.storagebridge.storage;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Maps each {@link StorageTarget} to the backend bean serving it. Built once at startup. */
@Component
public class StorageBackendRegistry {

  private final Map<StorageTarget, StorageBackend> backends = new EnumMap<>(StorageTarget.class);

  public StorageBackendRegistry(List<StorageBackend> backends) {
    // Fail fast if two backends claim the same target.
    for (var backend : backends) {
      var existing = this.backends.putIfAbsent(backend.target(), backend);
      if (existing != null) {
        throw new IllegalStateException(
            "Duplicate storage backend for target "
                + backend.target()
                + ": "
                + existing.getClass().getName()
                + " and "
                + backend.getClass().getName());
      }
    }
  }

  public Optional<StorageBackend> find(StorageTarget target) {
    return Optional.ofNullable(backends.get(target));
  }

  public List<StorageTarget> availableTargets() {
    return List.copyOf(backends.keySet());
  }
}
