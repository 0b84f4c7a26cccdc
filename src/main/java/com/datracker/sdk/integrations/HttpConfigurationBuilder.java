package com.datracker.sdk.integrations;

import com.datracker.sdk.Components;
import com.datracker.sdk.subsystems.ComponentConfigurer;
import com.datracker.sdk.subsystems.HttpConfiguration;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import javax.net.SocketFactory;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.X509TrustManager;

/**
 * Contains methods for configuring the tracker's networking behavior.
 * <p>
 * If you want to set non-default values for any of these properties, create a builder with
 * {@link Components#httpConfiguration()}, change its properties with the methods of this class,
 * and pass it to {@link com.datracker.sdk.TrackerConfig.Builder#http(ComponentConfigurer)}:
 * <pre><code>
 *     TrackerConfig config = new TrackerConfig.Builder()
 *         .http(
 *           Components.httpConfiguration()
 *             .connectTimeout(Duration.ofSeconds(3))
 *             .proxyHostAndPort("my-proxy", 8080)
 *          )
 *         .build();
 * </code></pre>
 * <p>
 * Note that this class is abstract; the actual implementation is created by calling {@link Components#httpConfiguration()}.
 */
public abstract class HttpConfigurationBuilder implements ComponentConfigurer<HttpConfiguration> {
  /**
   * The default value for {@link #connectTimeout(Duration)}: two seconds.
   */
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(2);

  /**
   * The default value for {@link #socketTimeout(Duration)}: 10 seconds.
   */
  public static final Duration DEFAULT_SOCKET_TIMEOUT = Duration.ofSeconds(10);

  protected Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
  protected String proxyHost;
  protected int proxyPort;
  protected Map<String, String> customHeaders = new HashMap<>();
  protected Duration socketTimeout = DEFAULT_SOCKET_TIMEOUT;
  protected SocketFactory socketFactory;
  protected SSLSocketFactory sslSocketFactory;
  protected X509TrustManager trustManager;

  /**
   * Sets the connection timeout. This is the time allowed for the underlying HTTP client to connect
   * to the collector. The default is {@link #DEFAULT_CONNECT_TIMEOUT}.
   * 
   * @param connectTimeout the connection timeout; null to use the default
   * @return the builder
   */
  public HttpConfigurationBuilder connectTimeout(Duration connectTimeout) {
    this.connectTimeout = connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
    return this;
  }

  /**
   * Sets an HTTP proxy for making connections to the collector.
   * 
   * @param host the proxy hostname
   * @param port the proxy port
   * @return the builder
   */
  public HttpConfigurationBuilder proxyHostAndPort(String host, int port) {
    this.proxyHost = host;
    this.proxyPort = port;
    return this;
  }

  /**
   * Sets the socket timeout. This is the amount of time without receiving data on a connection that the
   * HTTP client will allow before treating the upload attempt as failed. The default is
   * {@link #DEFAULT_SOCKET_TIMEOUT}.
   * 
   * @param socketTimeout the socket timeout; null to use the default
   * @return the builder
   */
  public HttpConfigurationBuilder socketTimeout(Duration socketTimeout) {
    this.socketTimeout = socketTimeout == null ? DEFAULT_SOCKET_TIMEOUT : socketTimeout;
    return this;
  }

  /**
   * Specifies a custom socket configuration for HTTP connections to the collector.
   * 
   * @param socketFactory the socket factory
   * @return the builder
   */
  public HttpConfigurationBuilder socketFactory(SocketFactory socketFactory) {
    this.socketFactory = socketFactory;
    return this;
  }

  /**
   * Specifies a custom security configuration for HTTPS connections to the collector.
   * 
   * @param sslSocketFactory the SSL socket factory
   * @param trustManager the trust manager
   * @return the builder
   */
  public HttpConfigurationBuilder sslSocketFactory(SSLSocketFactory sslSocketFactory, X509TrustManager trustManager) {
    this.sslSocketFactory = sslSocketFactory;
    this.trustManager = trustManager;
    return this;
  }

  /**
   * Specifies a custom HTTP header that should be added to all requests. Repeated calls with the same
   * header name will replace the previous value.
   * 
   * @param headerName the header name
   * @param headerValue the header value
   * @return the builder
   */
  public HttpConfigurationBuilder addCustomHeader(String headerName, String headerValue) {
    this.customHeaders.put(headerName, headerValue);
    return this;
  }
}
