package com.datracker.sdk;

import java.net.URI;

abstract class StandardEndpoints {
  private StandardEndpoints() {}

  static final URI DEFAULT_COLLECTOR_BASE_URI = URI.create("https://collector.datracker.com");

  static final String RECORDS_POST_REQUEST_PATH = "/v1/records";

  static URI selectBaseUri(URI configuredValue) {
    return configuredValue == null ? DEFAULT_COLLECTOR_BASE_URI : configuredValue;
  }
}
