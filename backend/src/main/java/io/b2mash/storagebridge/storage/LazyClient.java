package io.b2mash.storagebridge.storage;

import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.utils.SdkAutoCloseable;

/**
 * Get-or-create holder for one SDK client. The client is built on first {@link #get()} and reused
 * until {@link #reset()} closes it; the next {@code get()} then builds a fresh one, picking up
 * rotated credentials.
 */
public final class LazyClient<T extends SdkAutoCloseable> {

  private static final Logger log = LoggerFactory.getLogger(LazyClient.class);

  private final String name;
  private final Supplier<T> factory;
  private volatile T client;

  public LazyClient(String name, Supplier<T> factory) {
    this.name = name;
    this.factory = factory;
  }

  public T get() {
    T current = client;
    if (current == null) {
      synchronized (this) {
        current = client;
        if (current == null) {
          current = factory.get();
          client = current;
          log.info("Built {} client", name);
        }
      }
    }
    return current;
  }

  public synchronized void reset() {
    T current = client;
    client = null;
    if (current != null) {
      current.close();
      log.info("Closed {} client, it will be rebuilt on next use", name);
    }
  }

  public boolean isInitialized() {
    return client != null;
  }
}
