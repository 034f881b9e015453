package com.wakelink.external;

import java.time.Instant;

/**
 * Сбой передачи снимка с типизированной причиной.
 */
public class TransferFailure {

  private final String deviceId;
  private final String artifactName;
  private final Long transferId;
  private final FailureCode code;
  private final String message;
  private final Instant occurredAt;

  public TransferFailure(String deviceId, String artifactName, Long transferId, FailureCode code,
                         String message, Instant occurredAt) {
    this.deviceId = deviceId;
    this.artifactName = artifactName;
    this.transferId = transferId;
    this.code = code;
    this.message = message;
    this.occurredAt = occurredAt;
  }

  public String getDeviceId() {
    return deviceId;
  }

  public String getArtifactName() {
    return artifactName;
  }

  public Long getTransferId() {
    return transferId;
  }

  public FailureCode getCode() {
    return code;
  }

  public String getMessage() {
    return message;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }

  @Override
  public String toString() {
    return code.code() + " " + deviceId + "/" + artifactName + ": " + message;
  }
}
