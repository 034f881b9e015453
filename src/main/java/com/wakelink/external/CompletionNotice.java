package com.wakelink.external;

import com.wakelink.lineage.DeviceLineage;

import java.time.Instant;

/**
 * Уведомление о готовом снимке для связывания с наблюдением.
 */
public class CompletionNotice {

  private final String deviceId;
  private final String artifactName;
  private final String storageLocation;
  private final Long transferId;
  private final Long wakeId;
  private final DeviceLineage lineage;
  private final Instant capturedAt;
  private final int totalFragments;

  public CompletionNotice(String deviceId, String artifactName, String storageLocation, Long transferId,
                          Long wakeId, DeviceLineage lineage, Instant capturedAt, int totalFragments) {
    this.deviceId = deviceId;
    this.artifactName = artifactName;
    this.storageLocation = storageLocation;
    this.transferId = transferId;
    this.wakeId = wakeId;
    this.lineage = lineage;
    this.capturedAt = capturedAt;
    this.totalFragments = totalFragments;
  }

  public String getDeviceId() {
    return deviceId;
  }

  public String getArtifactName() {
    return artifactName;
  }

  public String getStorageLocation() {
    return storageLocation;
  }

  public Long getTransferId() {
    return transferId;
  }

  public Long getWakeId() {
    return wakeId;
  }

  public DeviceLineage getLineage() {
    return lineage;
  }

  public Instant getCapturedAt() {
    return capturedAt;
  }

  public int getTotalFragments() {
    return totalFragments;
  }
}
