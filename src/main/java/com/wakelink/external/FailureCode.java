package com.wakelink.external;

/**
 * Типизированные причины сбоя передачи снимка.
 */
public enum FailureCode {
  ASSEMBLY_FAILED("assembly_failed"),
  UPLOAD_FAILED("upload_failed"),
  COMPLETION_FAILED("completion_failed"),
  TRANSFER_EXPIRED("transfer_expired"),
  PUBLISH_FAILED("publish_failed"),
  PROCESSING_ERROR("processing_error");

  private final String code;

  FailureCode(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
