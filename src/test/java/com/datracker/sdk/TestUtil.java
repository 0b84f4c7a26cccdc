package com.datracker.sdk;

@SuppressWarnings("javadoc")
public class TestUtil {
  public static String getSdkVersion() {
    return Version.SDK_VERSION;
  }
}
