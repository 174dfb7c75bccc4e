package com.example.aggregator.routing;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a controller as the single router of one upstream source and supplies its entry in the
 * {@code /features} catalogue. The prefix itself comes from the controller's
 * {@code @RequestMapping}.
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface SourceDescription {

  /** A concrete, callable path under the controller's prefix. */
  String exampleEndpoint();

  String description();
}
