package com.wakelink.lineage;

import java.time.ZoneId;
import java.util.Locale;
import java.util.Set;

/**
 * Цепочка владения устройства: площадка, программа, компания, часовой пояс и расписания.
 */
public class DeviceLineage {

  private static final Set<String> APPROVED_STATUSES = Set.of("mapped", "active");

  private final String deviceId;
  private final String siteId;
  private final String programId;
  private final String companyId;
  private final ZoneId timezone;
  private final String deviceSchedule;
  private final String siteSchedule;
  private final String provisioningStatus;
  private final boolean active;

  public DeviceLineage(String deviceId, String siteId, String programId, String companyId, ZoneId timezone,
                       String deviceSchedule, String siteSchedule, String provisioningStatus, boolean active) {
    this.deviceId = deviceId;
    this.siteId = siteId;
    this.programId = programId;
    this.companyId = companyId;
    this.timezone = timezone;
    this.deviceSchedule = deviceSchedule;
    this.siteSchedule = siteSchedule;
    this.provisioningStatus = provisioningStatus;
    this.active = active;
  }

  /**
   * Устройство привязано к площадке.
   */
  public boolean isMapped() {
    return siteId != null;
  }

  /**
   * Устройство активно и его подготовка одобрена (статус mapped или active).
   */
  public boolean isApproved() {
    return active && provisioningStatus != null
        && APPROVED_STATUSES.contains(provisioningStatus.toLowerCase(Locale.ROOT));
  }

  public String getDeviceId() {
    return deviceId;
  }

  public String getSiteId() {
    return siteId;
  }

  public String getProgramId() {
    return programId;
  }

  public String getCompanyId() {
    return companyId;
  }

  /**
   * @return Часовой пояс площадки или null, если он неизвестен.
   */
  public ZoneId getTimezone() {
    return timezone;
  }

  public String getDeviceSchedule() {
    return deviceSchedule;
  }

  public String getSiteSchedule() {
    return siteSchedule;
  }

  public String getProvisioningStatus() {
    return provisioningStatus;
  }

  public boolean isActive() {
    return active;
  }
}
