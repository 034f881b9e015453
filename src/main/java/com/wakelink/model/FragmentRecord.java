package com.wakelink.model;

import java.time.Instant;

/**
 * Фрагмент снимка в хранилище. Ключ: (устройство, имя снимка, индекс).
 */
public class FragmentRecord {

  private final String deviceId;
  private final String artifactName;
  private final int index;
  private final byte[] data;
  private final Instant storedAt;
  private final Instant expiresAt;

  public FragmentRecord(String deviceId, String artifactName, int index, byte[] data,
                        Instant storedAt, Instant expiresAt) {
    this.deviceId = deviceId;
    this.artifactName = artifactName;
    this.index = index;
    this.data = data;
    this.storedAt = storedAt;
    this.expiresAt = expiresAt;
  }

  public String getDeviceId() {
    return deviceId;
  }

  public String getArtifactName() {
    return artifactName;
  }

  public int getIndex() {
    return index;
  }

  public byte[] getData() {
    return data;
  }

  public Instant getStoredAt() {
    return storedAt;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }
}
