package com.codeheadsystems.keyshare.server.admin;

import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide maintenance flag raised while an admin operation runs. Readers see either no
 * message or the most recently set one; the last writer wins.
 */
@Singleton
public class MaintenanceStatus {

  public static final String BACKUP_MESSAGE = "Enclave is doing backup, please wait...";

  private static final Logger log = LoggerFactory.getLogger(MaintenanceStatus.class);

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private String message;

  /**
   * Instantiates a new Maintenance status with no message set.
   */
  @Inject
  public MaintenanceStatus() {
    log.info("MaintenanceStatus()");
  }

  /**
   * Sets the message and returns a scope that clears it on close.
   *
   * @param message the message
   * @return the scope
   */
  public Scope enter(final String message) {
    set(message);
    return new Scope();
  }

  public void set(final String message) {
    lock.writeLock().lock();
    try {
      this.message = message;
    } finally {
      lock.writeLock().unlock();
    }
    log.info("Maintenance: {}", message);
  }

  public void clear() {
    lock.writeLock().lock();
    try {
      this.message = null;
    } finally {
      lock.writeLock().unlock();
    }
    log.info("Maintenance cleared");
  }

  public Optional<String> current() {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(message);
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean inMaintenance() {
    return current().isPresent();
  }

  /**
   * Clears the maintenance message when closed. Closing twice is harmless.
   */
  public final class Scope implements AutoCloseable {

    private boolean closed;

    private Scope() {
    }

    @Override
    public void close() {
      if (!closed) {
        closed = true;
        clear();
      }
    }
  }
}
