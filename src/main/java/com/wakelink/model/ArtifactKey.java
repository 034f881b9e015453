package com.wakelink.model;

import java.util.Objects;

/**
 * Составной ключ снимка: устройство + имя снимка.
 * Имя снимка без устройства ключом не является.
 */
public final class ArtifactKey {

  private final String deviceId;
  private final String artifactName;

  public ArtifactKey(String deviceId, String artifactName) {
    this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
    this.artifactName = Objects.requireNonNull(artifactName, "artifactName");
  }

  public String getDeviceId() {
    return deviceId;
  }

  public String getArtifactName() {
    return artifactName;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ArtifactKey)) {
      return false;
    }
    ArtifactKey other = (ArtifactKey) o;
    return deviceId.equals(other.deviceId) && artifactName.equals(other.artifactName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(deviceId, artifactName);
  }

  @Override
  public String toString() {
    return deviceId + "/" + artifactName;
  }
}
