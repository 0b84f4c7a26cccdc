package com.datracker.sdk;

import com.datracker.sdk.integrations.HttpConfigurationBuilder;
import com.datracker.sdk.integrations.LocalStorageBuilder;
import com.datracker.sdk.integrations.LoggingConfigurationBuilder;
import com.datracker.sdk.integrations.UploaderBuilder;
import com.datracker.sdk.subsystems.ClientContext;
import com.datracker.sdk.subsystems.HttpConfiguration;
import com.datracker.sdk.subsystems.LocalStorage;
import com.datracker.sdk.subsystems.LoggingConfiguration;
import com.datracker.sdk.subsystems.RecordSender;
import com.datracker.sdk.subsystems.UploaderConfiguration;
import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.LDSLF4J;
import com.launchdarkly.logging.Logs;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.URI;
import java.util.HashMap;
import java.util.Map;

/**
 * This class contains the package-private implementations of component factories and builders whose
 * public factory methods are in {@link Components}.
 */
abstract class ComponentsImpl {
  private ComponentsImpl() {}

  static final class InMemoryStorageBuilderImpl extends LocalStorageBuilder {
    @Override
    public LocalStorage build(ClientContext context) {
      return new InMemoryLocalStorage(capacity, context.getBaseLogger().subLogger(Loggers.QUEUE_LOGGER_NAME));
    }
  }

  static final class UploaderBuilderImpl extends UploaderBuilder {
    @Override
    public UploaderConfiguration build(ClientContext context) {
      RecordSender sender;
      if (recordSenderConfigurer == null) {
        sender = new DefaultRecordSender(
            context.getHttp(),
            context.getBaseLogger().subLogger(Loggers.UPLOAD_LOGGER_NAME));
      } else {
        sender = recordSenderConfigurer.build(context);
      }
      URI uri = StandardEndpoints.selectBaseUri(baseUri);
      return new UploaderConfiguration(
          uploadInterval,
          bulkSize,
          maxBackoff,
          uri,
          compression,
          encryption,
          sender);
    }
  }

  static final class HttpConfigurationBuilderImpl extends HttpConfigurationBuilder {
    @Override
    public HttpConfiguration build(ClientContext clientContext) {
      Map<String, String> headers = new HashMap<>();
      headers.put("Authorization", clientContext.getAppKey());
      headers.put("User-Agent", "DATrackerJava/" + Version.SDK_VERSION);
      if (!customHeaders.isEmpty()) {
        headers.putAll(customHeaders);
      }

      Proxy proxy = proxyHost == null ? null : new Proxy(Proxy.Type.HTTP, new InetSocketAddress(proxyHost, proxyPort));

      return new HttpConfiguration(
          connectTimeout,
          headers,
          proxy,
          socketFactory,
          socketTimeout,
          sslSocketFactory,
          trustManager);
    }
  }

  static final class LoggingConfigurationBuilderImpl extends LoggingConfigurationBuilder {
    @Override
    public LoggingConfiguration build(ClientContext clientContext) {
      LDLogAdapter adapter = logAdapter == null ? getDefaultLogAdapter() : logAdapter;
      LDLogAdapter filteredAdapter = Logs.level(adapter,
          minimumLevel == null ? LDLogLevel.INFO : minimumLevel);
      // If the adapter is for a framework like SLF4J that has its own external configuration
      // system, then calling Logs.level here has no effect.
      String name = baseName == null ? Loggers.BASE_LOGGER_NAME : baseName;
      return new LoggingConfiguration(name, filteredAdapter);
    }

    private static LDLogAdapter getDefaultLogAdapter() {
      // If SLF4J is present in the classpath, use that by default; otherwise use the console.
      try {
        Class.forName("org.slf4j.LoggerFactory");
        return LDSLF4J.adapter();
      } catch (ClassNotFoundException e) {
        return Logs.toConsole();
      }
    }
  }
}
