package com.datracker.sdk;

import com.datracker.sdk.integrations.PayloadCodecs;
import com.datracker.sdk.subsystems.HttpConfiguration;
import com.datracker.sdk.subsystems.RecordSender;
import com.datracker.sdk.subsystems.RecordSender.Payload;
import com.google.common.collect.ImmutableMap;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.testhelpers.httptest.Handler;
import com.launchdarkly.testhelpers.httptest.Handlers;
import com.launchdarkly.testhelpers.httptest.HttpServer;
import com.launchdarkly.testhelpers.httptest.RequestInfo;

import org.junit.Test;

import okhttp3.OkHttpClient;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.equalToIgnoringCase;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class DefaultRecordSenderTest extends BaseTest {
  private static final String FAKE_DATA = "{\"records\":[]}";
  private static final byte[] FAKE_DATA_BYTES = FAKE_DATA.getBytes(StandardCharsets.UTF_8);

  private RecordSender makeSender() {
    return makeSender(httpConfig(null));
  }

  private RecordSender makeSender(HttpConfiguration http) {
    return new DefaultRecordSender(http, testLogger);
  }

  private static HttpConfiguration httpConfig(Map<String, String> headers) {
    return new HttpConfiguration(null, headers, null, null, null, null, null);
  }

  private static Payload payload() {
    return new Payload(FAKE_DATA_BYTES, 3, null, null);
  }

  private static Handler successResponse() {
    return Handlers.status(202);
  }

  @Test
  public void recordsAreDelivered() throws Exception {
    try (HttpServer server = HttpServer.start(successResponse())) {
      try (RecordSender rs = makeSender()) {
        assertEquals(RecordSender.Result.SUCCESS, rs.sendRecords(payload(), server.getUri()));
      }

      RequestInfo req = server.getRecorder().requireRequest();
      assertEquals("POST", req.getMethod());
      assertEquals(StandardEndpoints.RECORDS_POST_REQUEST_PATH, req.getPath());
      assertThat(req.getHeader("content-type"), startsWith("application/json"));
      assertEquals(FAKE_DATA, req.getBody());
    }
  }

  @Test
  public void basePathIsPreserved() throws Exception {
    try (HttpServer server = HttpServer.start(successResponse())) {
      try (RecordSender rs = makeSender()) {
        rs.sendRecords(payload(), server.getUri().resolve("/prefix/"));
      }

      RequestInfo req = server.getRecorder().requireRequest();
      assertEquals("/prefix" + StandardEndpoints.RECORDS_POST_REQUEST_PATH, req.getPath());
    }
  }

  @Test
  public void configuredHeadersAreSent() throws Exception {
    Map<String, String> headers = ImmutableMap.of("Authorization", "my-key", "name2", "value2");
    try (HttpServer server = HttpServer.start(successResponse())) {
      try (RecordSender rs = makeSender(httpConfig(headers))) {
        rs.sendRecords(payload(), server.getUri());
      }

      RequestInfo req = server.getRecorder().requireRequest();
      for (Map.Entry<String, String> kv: headers.entrySet()) {
        assertThat(req.getHeader(kv.getKey()), equalTo(kv.getValue()));
      }
    }
  }

  @Test
  public void recordCountAndPayloadIdAreSent() throws Exception {
    try (HttpServer server = HttpServer.start(successResponse())) {
      try (RecordSender rs = makeSender()) {
        rs.sendRecords(payload(), server.getUri());
        rs.sendRecords(payload(), server.getUri());
      }

      RequestInfo req1 = server.getRecorder().requireRequest();
      RequestInfo req2 = server.getRecorder().requireRequest();
      assertEquals("3", req1.getHeader(DefaultRecordSender.RECORD_COUNT_HEADER));
      String id1 = req1.getHeader(DefaultRecordSender.PAYLOAD_ID_HEADER);
      assertThat(id1, notNullValue());
      UUID.fromString(id1); // must be a valid UUID
      assertNotEquals(id1, req2.getHeader(DefaultRecordSender.PAYLOAD_ID_HEADER));
    }
  }

  @Test
  public void encodingHeadersAreSentOnlyWhenUsed() throws Exception {
    try (HttpServer server = HttpServer.start(successResponse())) {
      try (RecordSender rs = makeSender()) {
        rs.sendRecords(payload(), server.getUri());
        rs.sendRecords(new Payload(PayloadCodecs.gzip().encode(FAKE_DATA_BYTES), 1, "gzip", "aes-gcm"), server.getUri());
      }

      RequestInfo plain = server.getRecorder().requireRequest();
      assertThat(plain.getHeader("Content-Encoding"), nullValue());
      assertThat(plain.getHeader(DefaultRecordSender.ENCRYPTION_HEADER), nullValue());

      RequestInfo encoded = server.getRecorder().requireRequest();
      assertThat(encoded.getHeader("Content-Encoding"), equalToIgnoringCase("gzip"));
      assertThat(encoded.getHeader(DefaultRecordSender.ENCRYPTION_HEADER), equalTo("aes-gcm"));
    }
  }

  @Test
  public void timeoutsAreAppliedToHttpClient() {
    HttpConfiguration http = new HttpConfiguration(Duration.ofSeconds(3), null, null, null, Duration.ofSeconds(7),
        null, null);
    OkHttpClient client = DefaultRecordSender.newHttpClient(http);
    try {
      assertEquals(3000, client.connectTimeoutMillis());
      assertEquals(7000, client.readTimeoutMillis());
      assertEquals(7000, client.writeTimeoutMillis());
      assertFalse(client.retryOnConnectionFailure());
    } finally {
      client.dispatcher().executorService().shutdown();
    }
  }

  @Test
  public void statusesMapToUploadResults() {
    for (int status: new int[] { 200, 202, 204 }) {
      assertEquals("status " + status, RecordSender.Result.SUCCESS, DefaultRecordSender.resultForStatus(status));
    }
    for (int status: new int[] { 302, 400, 408, 429, 500, 502, 503 }) {
      assertEquals("status " + status, RecordSender.Result.FAILURE, DefaultRecordSender.resultForStatus(status));
    }
    for (int status: new int[] { 401, 403, 404, 413 }) {
      assertEquals("status " + status, RecordSender.Result.STOP, DefaultRecordSender.resultForStatus(status));
    }
  }

  @Test
  public void rejectedKeyIsLoggedAsError() throws Exception {
    try (HttpServer server = HttpServer.start(Handlers.status(401))) {
      try (RecordSender rs = makeSender()) {
        rs.sendRecords(payload(), server.getUri());
      }
    }
    assertTrue(hasLogMessage(LDLogLevel.ERROR, "HTTP 401 (check the application key)"));
  }

  @Test
  public void retryableStatusIsLoggedAsWarning() throws Exception {
    try (HttpServer server = HttpServer.start(Handlers.status(503))) {
      try (RecordSender rs = makeSender()) {
        rs.sendRecords(payload(), server.getUri());
      }
    }
    assertTrue(hasLogMessage(LDLogLevel.WARN, "Collector returned HTTP 503 for 3 record(s)"));
  }

  @Test
  public void http400ErrorIsRecoverable() throws Exception {
    testRecoverableHttpError(400);
  }

  @Test
  public void http408ErrorIsRecoverable() throws Exception {
    testRecoverableHttpError(408);
  }

  @Test
  public void http429ErrorIsRecoverable() throws Exception {
    testRecoverableHttpError(429);
  }

  @Test
  public void http500ErrorIsRecoverable() throws Exception {
    testRecoverableHttpError(500);
  }

  @Test
  public void http401ErrorIsUnrecoverable() throws Exception {
    testUnrecoverableHttpError(401);
  }

  @Test
  public void http403ErrorIsUnrecoverable() throws Exception {
    testUnrecoverableHttpError(403);
  }

  @Test
  public void http413ErrorIsUnrecoverable() throws Exception {
    testUnrecoverableHttpError(413);
  }

  @Test
  public void connectionFailureIsRecoverable() throws Exception {
    URI badUri;
    try (HttpServer server = HttpServer.start(successResponse())) {
      badUri = server.getUri();
    }
    try (RecordSender rs = makeSender()) {
      assertEquals(RecordSender.Result.FAILURE, rs.sendRecords(payload(), badUri));
    }
  }

  @Test
  public void emptyPayloadIsNotSent() throws Exception {
    try (HttpServer server = HttpServer.start(successResponse())) {
      try (RecordSender rs = makeSender()) {
        assertEquals(RecordSender.Result.SUCCESS, rs.sendRecords(new Payload(new byte[0], 0, null, null), server.getUri()));
      }
      assertEquals(0, server.getRecorder().count());
    }
  }

  private void testRecoverableHttpError(int status) throws Exception {
    try (HttpServer server = HttpServer.start(Handlers.status(status))) {
      try (RecordSender rs = makeSender()) {
        assertEquals(RecordSender.Result.FAILURE, rs.sendRecords(payload(), server.getUri()));
      }
      assertEquals(1, server.getRecorder().count());
    }
  }

  private void testUnrecoverableHttpError(int status) throws Exception {
    try (HttpServer server = HttpServer.start(Handlers.status(status))) {
      try (RecordSender rs = makeSender()) {
        assertEquals(RecordSender.Result.STOP, rs.sendRecords(payload(), server.getUri()));
      }
      assertEquals(1, server.getRecorder().count());
    }
  }
}
