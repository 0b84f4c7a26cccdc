package com.datracker.sdk;

import com.datracker.sdk.subsystems.ClientContext;
import com.datracker.sdk.subsystems.HttpConfiguration;
import com.datracker.sdk.subsystems.LoggingConfiguration;

import java.util.concurrent.ScheduledExecutorService;

/**
 * This is the package-private implementation of {@link ClientContext} that contains additional
 * non-public tracker objects that may be used by our internal components.
 * <p>
 * The tracker constructor calls {@link #fromConfig(String, TrackerConfig, ScheduledExecutorService)}
 * to create the initial instance. Components receive it as a plain {@link ClientContext}.
 */
final class ClientContextImpl extends ClientContext {
  final ScheduledExecutorService sharedExecutor;

  private ClientContextImpl(ClientContext baseContext, ScheduledExecutorService sharedExecutor) {
    super(baseContext);
    this.sharedExecutor = sharedExecutor;
  }

  static ClientContextImpl fromConfig(
      String appKey,
      TrackerConfig config,
      ScheduledExecutorService sharedExecutor
      ) {
    ClientContext minimalContext = new ClientContext(appKey, config.appVersion, config.appChannel,
        null, null, config.offline, config.threadPriority);
    LoggingConfiguration loggingConfig = config.logging.build(minimalContext);

    ClientContext contextWithLogging = new ClientContext(appKey, config.appVersion, config.appChannel,
        null, loggingConfig, config.offline, config.threadPriority);
    HttpConfiguration httpConfig = config.http.build(contextWithLogging);

    if (httpConfig.getProxy() != null) {
      contextWithLogging.getBaseLogger().info("Using proxy: {}", httpConfig.getProxy());
    }

    ClientContext contextWithHttpAndLogging = new ClientContext(appKey, config.appVersion, config.appChannel,
        httpConfig, loggingConfig, config.offline, config.threadPriority);
    return new ClientContextImpl(contextWithHttpAndLogging, sharedExecutor);
  }
}
