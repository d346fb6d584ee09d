package io.b2mash.storagebridge.storage;

import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Decides per call which backend is current. The target property is read on every call and never
 * cached: during a migration window it may change between requests.
 *
 * <p>Only the literal {@value #CLOUD_MARKER} selects the cloud backend. Anything else, including
 * a missing value, selects the self-hosted one. Resolution never throws.
 */
@Component
public class StorageTargetResolver {

  private static final Logger log = LoggerFactory.getLogger(StorageTargetResolver.class);

  static final String TARGET_PROPERTY = "s3.target";
  static final String CLOUD_MARKER = "AWS";

  private final Environment environment;
  private final AtomicBoolean missingTargetReported = new AtomicBoolean();

  public StorageTargetResolver(Environment environment) {
    this.environment = environment;
  }

  public StorageTarget resolve() {
    String value = readTarget();
    if (value == null || value.isBlank()) {
      if (missingTargetReported.compareAndSet(false, true)) {
        log.warn("{} is not set, defaulting to the self-hosted backend", TARGET_PROPERTY);
      } else {
        log.debug("{} is not set, using the self-hosted backend", TARGET_PROPERTY);
      }
      return StorageTarget.SELF_HOSTED;
    }
    if (CLOUD_MARKER.equals(value)) {
      return StorageTarget.CLOUD;
    }
    log.debug(
        "{}={} is not the cloud marker, using the self-hosted backend", TARGET_PROPERTY, value);
    return StorageTarget.SELF_HOSTED;
  }

  private String readTarget() {
    try {
      return environment.getProperty(TARGET_PROPERTY);
    } catch (IllegalArgumentException e) {
      log.warn("Could not read {}: {}", TARGET_PROPERTY, e.getMessage());
      return null;
    }
  }
}
