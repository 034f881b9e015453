package com.wakelink.external;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wakelink.lineage.DeviceLineage;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;

/**
 * Уведомления внешних обработчиков о готовых снимках и о сбоях (JSON POST).
 */
public class HttpDownstreamNotifier implements CompletionNotifier, FailureNotifier {

  private static final String JSON = "application/json";

  private final JsonHttpCaller caller;
  private final String completionUrl;
  private final String failureUrl;
  private final ObjectMapper objectMapper;

  public HttpDownstreamNotifier(HttpClient httpClient, String completionUrl, String failureUrl, Duration timeout) {
    this.caller = new JsonHttpCaller(httpClient, timeout);
    this.completionUrl = completionUrl;
    this.failureUrl = failureUrl;
    this.objectMapper = new ObjectMapper();
  }

  @Override
  public void notifyCompletion(CompletionNotice notice) throws ExternalCallException {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("device_id", notice.getDeviceId());
    body.put("image_name", notice.getArtifactName());
    body.put("storage_location", notice.getStorageLocation());
    body.put("transfer_id", notice.getTransferId());
    body.put("wake_id", notice.getWakeId());
    body.put("total_chunks", notice.getTotalFragments());
    if (notice.getCapturedAt() != null) {
      body.put("captured_at", notice.getCapturedAt().toString());
    }
    DeviceLineage lineage = notice.getLineage();
    if (lineage != null) {
      body.put("site_id", lineage.getSiteId());
      body.put("program_id", lineage.getProgramId());
      body.put("company_id", lineage.getCompanyId());
    }
    post(completionUrl, body, "Обработчик завершения");
  }

  @Override
  public void notifyFailure(TransferFailure failure) throws ExternalCallException {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("device_id", failure.getDeviceId());
    body.put("image_name", failure.getArtifactName());
    body.put("transfer_id", failure.getTransferId());
    body.put("error_code", failure.getCode().code());
    body.put("error_message", failure.getMessage());
    body.put("occurred_at", failure.getOccurredAt().toString());
    post(failureUrl, body, "Обработчик сбоев");
  }

  private void post(String url, ObjectNode body, String what) throws ExternalCallException {
    caller.send("POST", url, JSON, HttpRequest.BodyPublishers.ofString(body.toString()), what);
  }
}
