package com.wakelink.external;

import com.wakelink.lineage.DeviceLineage;

import java.time.Instant;

/**
 * Собранный снимок для загрузки в хранилище.
 */
public class ArtifactUpload {

  public static final String CONTENT_TYPE = "image/jpeg";

  private final String deviceId;
  private final String artifactName;
  private final byte[] content;
  private final DeviceLineage lineage;
  private final Instant capturedAt;

  public ArtifactUpload(String deviceId, String artifactName, byte[] content, DeviceLineage lineage,
                        Instant capturedAt) {
    this.deviceId = deviceId;
    this.artifactName = artifactName;
    this.content = content;
    this.lineage = lineage;
    this.capturedAt = capturedAt;
  }

  public String getDeviceId() {
    return deviceId;
  }

  public String getArtifactName() {
    return artifactName;
  }

  public byte[] getContent() {
    return content;
  }

  /**
   * Может быть null, если цепочка владения не найдена.
   */
  public DeviceLineage getLineage() {
    return lineage;
  }

  public Instant getCapturedAt() {
    return capturedAt;
  }
}
