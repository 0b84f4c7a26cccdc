package com.datracker.sdk;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.matchesPattern;

@SuppressWarnings("javadoc")
public class VersionTest {
  @Test
  public void versionIsFilledInFromBuild() {
    assertThat(Version.SDK_VERSION, matchesPattern("\\d+\\.\\d+\\.\\d+(-.+)?"));
  }
}
