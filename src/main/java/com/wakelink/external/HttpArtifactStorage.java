package com.wakelink.external;

import com.wakelink.lineage.DeviceLineage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;

/**
 * Загрузка снимков в объектное хранилище по HTTP PUT.
 * <p>
 * Путь: {@code {bucket}/{company}/{site}/{device}/{artifact}}; для устройства без
 * привязки к площадке: {@code {bucket}/{device}/{artifact}}.
 */
public class HttpArtifactStorage implements ArtifactStorage {

  private static final Logger logger = LoggerFactory.getLogger(HttpArtifactStorage.class);

  private final JsonHttpCaller caller;
  private final String baseUrl;
  private final String bucket;

  public HttpArtifactStorage(HttpClient httpClient, String baseUrl, String bucket, Duration timeout) {
    this.caller = new JsonHttpCaller(httpClient, timeout);
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.bucket = bucket;
  }

  @Override
  public String store(ArtifactUpload upload) throws ExternalCallException {
    String location = bucket + "/" + objectPath(upload);
    caller.send("PUT", baseUrl + "/" + location, ArtifactUpload.CONTENT_TYPE,
        HttpRequest.BodyPublishers.ofByteArray(upload.getContent()), "Хранилище снимков");
    logger.info("✅ Снимок {} ({} байт) загружен: {}", upload.getArtifactName(), upload.getContent().length, location);
    return location;
  }

  static String objectPath(ArtifactUpload upload) {
    DeviceLineage lineage = upload.getLineage();
    if (lineage != null && lineage.isMapped() && lineage.getCompanyId() != null) {
      return lineage.getCompanyId() + "/" + lineage.getSiteId() + "/" + upload.getDeviceId() + "/"
          + upload.getArtifactName();
    }
    return upload.getDeviceId() + "/" + upload.getArtifactName();
  }
}
