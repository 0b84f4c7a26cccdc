package com.datracker.sdk;

import com.datracker.sdk.internal.http.HttpHelpers;
import com.datracker.sdk.subsystems.HttpConfiguration;
import com.datracker.sdk.subsystems.RecordSender;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import okhttp3.ConnectionPool;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * The default implementation of delivering records to the collector via HTTP.
 * <p>
 * Each call makes one attempt; retrying is up to the uploader, which keeps the batch in the queue.
 */
final class DefaultRecordSender implements RecordSender {
  static final String PAYLOAD_ID_HEADER = "X-DA-Payload-ID";
  static final String RECORD_COUNT_HEADER = "X-DA-Record-Count";
  static final String ENCRYPTION_HEADER = "X-DA-Encryption";
  private static final MediaType JSON_CONTENT_TYPE = MediaType.parse("application/json; charset=utf-8");

  private final OkHttpClient httpClient;
  private final Headers baseHeaders;
  private final LDLogger logger;

  DefaultRecordSender(HttpConfiguration http, LDLogger logger) {
    this.httpClient = newHttpClient(http);
    Headers.Builder headers = new Headers.Builder();
    for (Map.Entry<String, String> kv: http.getDefaultHeaders()) {
      headers.add(kv.getKey(), kv.getValue());
    }
    this.baseHeaders = headers.add("Content-Type", "application/json").build();
    this.logger = logger;
  }

  // Visible for testing
  static OkHttpClient newHttpClient(HttpConfiguration http) {
    OkHttpClient.Builder builder = new OkHttpClient.Builder()
        .connectionPool(new ConnectionPool(1, 5, TimeUnit.SECONDS))
        .connectTimeout(http.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS)
        .readTimeout(http.getSocketTimeout().toMillis(), TimeUnit.MILLISECONDS)
        .writeTimeout(http.getSocketTimeout().toMillis(), TimeUnit.MILLISECONDS)
        .retryOnConnectionFailure(false); // a failed batch goes back to the queue instead
    if (http.getSocketFactory() != null) {
      builder.socketFactory(http.getSocketFactory());
    }
    if (http.getSslSocketFactory() != null) {
      builder.sslSocketFactory(http.getSslSocketFactory(), http.getTrustManager());
    }
    if (http.getProxy() != null) {
      builder.proxy(http.getProxy());
    }
    return builder.build();
  }

  /**
   * Decides what the uploader should do with a batch after the collector answered with the given
   * status. Client errors mean the collector will never take this batch or anything else from us
   * (a bad application key, an oversized payload), except for the few that are worth retrying.
   */
  static Result resultForStatus(int status) {
    if (status >= 200 && status < 300) {
      return Result.SUCCESS;
    }
    if (status >= 400 && status < 500) {
      switch (status) {
      case 400: // may be a transient proxy or gateway problem
      case 408:
      case 429:
        return Result.FAILURE;
      default:
        return Result.STOP;
      }
    }
    return Result.FAILURE;
  }

  @Override
  public void close() throws IOException {
    httpClient.dispatcher().cancelAll();
    httpClient.dispatcher().executorService().shutdown();
    httpClient.connectionPool().evictAll();
  }

  @Override
  public Result sendRecords(Payload payload, URI baseUri) {
    if (payload.getData() == null || payload.getData().length == 0) {
      // the uploader never sends an empty batch, but if it does, there is nothing to deliver
      return Result.SUCCESS;
    }

    Headers.Builder headersBuilder = baseHeaders.newBuilder()
        .add(PAYLOAD_ID_HEADER, UUID.randomUUID().toString())
        .add(RECORD_COUNT_HEADER, String.valueOf(payload.getRecordCount()));
    if (payload.getContentEncoding() != null) {
      headersBuilder.add("Content-Encoding", payload.getContentEncoding());
    }
    if (payload.getEncryption() != null) {
      headersBuilder.add(ENCRYPTION_HEADER, payload.getEncryption());
    }

    URI uri = HttpHelpers.concatenateUriPath(baseUri, StandardEndpoints.RECORDS_POST_REQUEST_PATH);
    Request request = new Request.Builder()
        .url(uri.toASCIIString())
        .post(RequestBody.create(payload.getData(), JSON_CONTENT_TYPE))
        .headers(headersBuilder.build())
        .build();

    logger.debug("Posting {} record(s) to {}", payload.getRecordCount(), uri);
    long startTime = System.currentTimeMillis();
    try (Response response = httpClient.newCall(request).execute()) {
      int status = response.code();
      logger.debug("Collector answered {} after {} ms", status, System.currentTimeMillis() - startTime);
      Result result = resultForStatus(status);
      switch (result) {
      case STOP:
        logger.error("Collector rejected {} record(s) with HTTP {}{}; no more uploads will be attempted",
            payload.getRecordCount(), status,
            status == 401 || status == 403 ? " (check the application key)" : "");
        break;
      case FAILURE:
        logger.warn("Collector returned HTTP {} for {} record(s); the batch will be retried",
            status, payload.getRecordCount());
        break;
      default:
        break;
      }
      return result;
    } catch (IOException e) {
      logger.warn("Could not reach the collector at {}; the batch will be retried: {}",
          uri, LogValues.exceptionSummary(e));
      return Result.FAILURE;
    }
  }
}
