package com.datracker.sdk.subsystems;

/**
 * The common interface for tracker component factories and configuration builders. Applications
 * should not need to implement this interface.
 *
 * @param <T> the type of component or configuration object being constructed
 */
public interface ComponentConfigurer<T> {
  /**
   * Called internally by the tracker to create an implementation instance. Applications should not
   * need to call this method.
   * 
   * @param clientContext provides configuration properties and other components from the current
   *   tracker instance
   * @return an instance of the component type
   */
  T build(ClientContext clientContext);
}
