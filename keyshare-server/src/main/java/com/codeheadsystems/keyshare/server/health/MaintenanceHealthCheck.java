package com.codeheadsystems.keyshare.server.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.keyshare.server.admin.MaintenanceStatus;
import java.util.Optional;

/**
 * Health check that reports unhealthy while an admin operation holds the maintenance flag.
 */
public class MaintenanceHealthCheck extends HealthCheck {

  private final MaintenanceStatus maintenanceStatus;

  /**
   * Instantiates a new Maintenance health check.
   *
   * @param maintenanceStatus the maintenance status
   */
  public MaintenanceHealthCheck(MaintenanceStatus maintenanceStatus) {
    this.maintenanceStatus = maintenanceStatus;
  }

  @Override
  protected Result check() {
    Optional<String> message = maintenanceStatus.current();
    if (message.isPresent()) {
      return Result.unhealthy(message.get());
    }
    return Result.healthy("not in maintenance");
  }
}
