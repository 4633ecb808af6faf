package com.codeheadsystems.keyshare.server.health;

import static org.assertj.core.api.Assertions.assertThat;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.keyshare.server.admin.MaintenanceStatus;
import org.junit.jupiter.api.Test;

class MaintenanceHealthCheckTest {

  @Test
  void check_reflectsMaintenance() {
    MaintenanceStatus status = new MaintenanceStatus();
    MaintenanceHealthCheck check = new MaintenanceHealthCheck(status);

    assertThat(check.execute().isHealthy()).isTrue();

    status.set(MaintenanceStatus.BACKUP_MESSAGE);
    HealthCheck.Result busy = check.execute();
    assertThat(busy.isHealthy()).isFalse();
    assertThat(busy.getMessage()).isEqualTo(MaintenanceStatus.BACKUP_MESSAGE);

    status.clear();
    assertThat(check.execute().isHealthy()).isTrue();
  }
}
