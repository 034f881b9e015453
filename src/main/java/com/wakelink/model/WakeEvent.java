package com.wakelink.model;

import com.wakelink.protocol.IllegalStateTransitionException;
import com.wakelink.protocol.ProtocolState;

import java.time.Instant;

/**
 * Запись об одном пробуждении устройства.
 * <p>
 * Создаётся при первом сообщении пробуждения и изменяется только движком протокола.
 * Состояние меняется исключительно через {@link #transitionTo(ProtocolState, Instant)},
 * который проверяет таблицу переходов.
 * Счётчики imagesRequested/imagesCompleted сейчас всегда 1:1, но позволяют
 * в будущем запрашивать несколько снимков за одно пробуждение.
 */
public class WakeEvent {

  private Long id;
  private String deviceId;
  private Long transferId;
  private ProtocolState state;
  private String artifactName;
  private int pendingCount;
  private Instant helloAt;
  private Instant ackSentAt;
  private Instant snapSentAt;
  private Instant sleepSentAt;
  private Instant nextWakeAt;
  private boolean complete;
  private String failureReason;
  private int imagesRequested;
  private int imagesCompleted;
  private Instant updatedAt;

  public WakeEvent() {}

  /**
   * Новое пробуждение в состоянии HELLO_RECEIVED.
   */
  public static WakeEvent hello(String deviceId, int pendingCount, Instant now) {
    WakeEvent wake = new WakeEvent();
    wake.deviceId = deviceId;
    wake.state = ProtocolState.HELLO_RECEIVED;
    wake.pendingCount = pendingCount;
    wake.helloAt = now;
    wake.updatedAt = now;
    return wake;
  }

  /**
   * Переводит пробуждение в новое состояние и проставляет метку времени этапа.
   *
   * @throws IllegalStateTransitionException если переход не разрешён таблицей.
   */
  public void transitionTo(ProtocolState target, Instant now) {
    if (!state.canTransitionTo(target)) {
      throw new IllegalStateTransitionException(state, target);
    }
    state = target;
    updatedAt = now;
    switch (target) {
      case ACK_SENT:
        ackSentAt = now;
        break;
      case SNAP_SENT:
        snapSentAt = now;
        break;
      case SLEEP_ONLY:
        sleepSentAt = now;
        break;
      case COMPLETE:
        sleepSentAt = now;
        complete = true;
        break;
      default:
        break;
    }
  }

  /**
   * Переводит незавершённое пробуждение в FAILED с указанием причины.
   */
  public void fail(String reason, Instant now) {
    transitionTo(ProtocolState.FAILED, now);
    failureReason = reason;
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

  public Long getTransferId() {
    return transferId;
  }

  public void setTransferId(Long transferId) {
    this.transferId = transferId;
  }

  public ProtocolState getState() {
    return state;
  }

  /**
   * Только для загрузки из БД: проверка переходов не выполняется.
   */
  public void restoreState(ProtocolState state) {
    this.state = state;
  }

  public String getArtifactName() {
    return artifactName;
  }

  public void setArtifactName(String artifactName) {
    this.artifactName = artifactName;
  }

  public int getPendingCount() {
    return pendingCount;
  }

  public void setPendingCount(int pendingCount) {
    this.pendingCount = pendingCount;
  }

  public Instant getHelloAt() {
    return helloAt;
  }

  public void setHelloAt(Instant helloAt) {
    this.helloAt = helloAt;
  }

  public Instant getAckSentAt() {
    return ackSentAt;
  }

  public void setAckSentAt(Instant ackSentAt) {
    this.ackSentAt = ackSentAt;
  }

  public Instant getSnapSentAt() {
    return snapSentAt;
  }

  public void setSnapSentAt(Instant snapSentAt) {
    this.snapSentAt = snapSentAt;
  }

  public Instant getSleepSentAt() {
    return sleepSentAt;
  }

  public void setSleepSentAt(Instant sleepSentAt) {
    this.sleepSentAt = sleepSentAt;
  }

  public Instant getNextWakeAt() {
    return nextWakeAt;
  }

  public void setNextWakeAt(Instant nextWakeAt) {
    this.nextWakeAt = nextWakeAt;
  }

  public boolean isComplete() {
    return complete;
  }

  public void setComplete(boolean complete) {
    this.complete = complete;
  }

  public String getFailureReason() {
    return failureReason;
  }

  public void setFailureReason(String failureReason) {
    this.failureReason = failureReason;
  }

  public int getImagesRequested() {
    return imagesRequested;
  }

  public void setImagesRequested(int imagesRequested) {
    this.imagesRequested = imagesRequested;
  }

  public int getImagesCompleted() {
    return imagesCompleted;
  }

  public void setImagesCompleted(int imagesCompleted) {
    this.imagesCompleted = imagesCompleted;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }
}
