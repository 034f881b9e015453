package com.wakelink.message;

import java.time.Instant;

/**
 * Метаданные снимка: имя, число фрагментов и телеметрия на момент съёмки.
 */
public class MetadataMessage extends InboundMessage {

  private final String artifactName;
  private final int totalFragments;
  private final Integer imageSize;
  private final Integer maxChunkSize;
  private final Instant capturedAt;
  private final SensorReadings readings;
  private final Integer errorCode;

  public MetadataMessage(String deviceId, String artifactName, int totalFragments, Integer imageSize,
                         Integer maxChunkSize, Instant capturedAt, SensorReadings readings, Integer errorCode) {
    super(deviceId);
    this.artifactName = artifactName;
    this.totalFragments = totalFragments;
    this.imageSize = imageSize;
    this.maxChunkSize = maxChunkSize;
    this.capturedAt = capturedAt;
    this.readings = readings;
    this.errorCode = errorCode;
  }

  @Override
  public MessageType getType() {
    return MessageType.METADATA;
  }

  public String getArtifactName() {
    return artifactName;
  }

  public int getTotalFragments() {
    return totalFragments;
  }

  public Integer getImageSize() {
    return imageSize;
  }

  public Integer getMaxChunkSize() {
    return maxChunkSize;
  }

  public Instant getCapturedAt() {
    return capturedAt;
  }

  public SensorReadings getReadings() {
    return readings;
  }

  public Integer getErrorCode() {
    return errorCode;
  }
}
