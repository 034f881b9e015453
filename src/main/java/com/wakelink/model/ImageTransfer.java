package com.wakelink.model;

import java.time.Instant;

/**
 * Сборка одного снимка из фрагментов.
 * <p>
 * Пара (устройство, имя снимка) уникальна: повторные метаданные переиспользуют запись.
 * awaitedTailIndex: индекс фрагмента, после прихода которого проверяются пропуски
 * и отправляется запрос недостающих фрагментов.
 * lastRequestAt: время последнего запроса недостающих фрагментов.
 */
public class ImageTransfer {

  private Long id;
  private String deviceId;
  private String artifactName;
  private int totalFragments;
  private int receivedFragments;
  private TransferStatus status;
  private String storageLocation;
  private String failureCode;
  private int retryCount;
  private int awaitedTailIndex;
  private int missingRequests;
  private Instant capturedAt;
  private Instant createdAt;
  private Instant lastActivityAt;
  private Instant completedAt;
  private Instant lastRequestAt;

  public ImageTransfer() {}

  public static ImageTransfer receiving(String deviceId, String artifactName, int totalFragments,
                                        Instant capturedAt, Instant now) {
    ImageTransfer transfer = new ImageTransfer();
    transfer.deviceId = deviceId;
    transfer.artifactName = artifactName;
    transfer.totalFragments = totalFragments;
    transfer.status = TransferStatus.RECEIVING;
    transfer.awaitedTailIndex = totalFragments - 1;
    transfer.capturedAt = capturedAt;
    transfer.createdAt = now;
    transfer.lastActivityAt = now;
    return transfer;
  }

  public ArtifactKey key() {
    return new ArtifactKey(deviceId, artifactName);
  }

  public boolean isReceiving() {
    return status == TransferStatus.RECEIVING;
  }

  /**
   * Повторная попытка после FAILED: запись снова принимает фрагменты.
   */
  public void reopen(Instant now) {
    if (status != TransferStatus.FAILED) {
      throw new IllegalStateException("Повторно открыть можно только FAILED-передачу, текущий статус: " + status);
    }
    status = TransferStatus.RECEIVING;
    failureCode = null;
    retryCount++;
    awaitedTailIndex = totalFragments - 1;
    lastActivityAt = now;
  }

  public void markComplete(Instant now) {
    status = TransferStatus.COMPLETE;
    receivedFragments = totalFragments;
    completedAt = now;
    lastActivityAt = now;
  }

  public void markFailed(String code, Instant now) {
    status = TransferStatus.FAILED;
    failureCode = code;
    lastActivityAt = now;
  }

  public void touch(Instant now) {
    lastActivityAt = now;
  }

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public String getDeviceId() {
    return deviceId;
  }

  public void setDeviceId(String deviceId) {
    this.deviceId = deviceId;
  }

  public String getArtifactName() {
    return artifactName;
  }

  public void setArtifactName(String artifactName) {
    this.artifactName = artifactName;
  }

  public int getTotalFragments() {
    return totalFragments;
  }

  public void setTotalFragments(int totalFragments) {
    this.totalFragments = totalFragments;
  }

  public int getReceivedFragments() {
    return receivedFragments;
  }

  public void setReceivedFragments(int receivedFragments) {
    this.receivedFragments = receivedFragments;
  }

  public TransferStatus getStatus() {
    return status;
  }

  public void setStatus(TransferStatus status) {
    this.status = status;
  }

  public String getStorageLocation() {
    return storageLocation;
  }

  public void setStorageLocation(String storageLocation) {
    this.storageLocation = storageLocation;
  }

  public String getFailureCode() {
    return failureCode;
  }

  public void setFailureCode(String failureCode) {
    this.failureCode = failureCode;
  }

  public int getRetryCount() {
    return retryCount;
  }

  public void setRetryCount(int retryCount) {
    this.retryCount = retryCount;
  }

  public int getAwaitedTailIndex() {
    return awaitedTailIndex;
  }

  public void setAwaitedTailIndex(int awaitedTailIndex) {
    this.awaitedTailIndex = awaitedTailIndex;
  }

  public int getMissingRequests() {
    return missingRequests;
  }

  public void setMissingRequests(int missingRequests) {
    this.missingRequests = missingRequests;
  }

  public Instant getCapturedAt() {
    return capturedAt;
  }

  public void setCapturedAt(Instant capturedAt) {
    this.capturedAt = capturedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  public Instant getLastActivityAt() {
    return lastActivityAt;
  }

  public void setLastActivityAt(Instant lastActivityAt) {
    this.lastActivityAt = lastActivityAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public void setCompletedAt(Instant completedAt) {
    this.completedAt = completedAt;
  }

  public Instant getLastRequestAt() {
    return lastRequestAt;
  }

  public void setLastRequestAt(Instant lastRequestAt) {
    this.lastRequestAt = lastRequestAt;
  }
}
