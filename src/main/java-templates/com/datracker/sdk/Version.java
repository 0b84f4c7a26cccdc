package com.datracker.sdk;

abstract class Version {
  private Version() {}

  // The build fills this in from the project version
  static final String SDK_VERSION = "${project.version}";
}
