/*
 * どこで: Aggregator ルーティング
 * 何を: 登録済みソースコントローラからプレフィックスと /features カタログを導出する
 * なぜ: ルーティングと案内情報を別々に手書きすると、存在しないルートを案内するずれが起きるため
 */
package com.example.aggregator.routing;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.mvc.method.RequestMappingInfo;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

@Component
public class SourceRegistry {

  private static final Logger logger = LoggerFactory.getLogger(SourceRegistry.class);

  private static final Pattern SINGLE_SEGMENT = Pattern.compile("/[a-z0-9][a-z0-9_-]*");

  // Gateway-owned routes that are not sources.
  private static final Set<String> UNLISTED_PREFIXES = Set.of("/features", "/error", "/actuator");

  private final List<SourceDescriptor> sources;

  public SourceRegistry(
      ApplicationContext applicationContext,
      @Qualifier("requestMappingHandlerMapping") RequestMappingHandlerMapping handlerMapping) {
    final Set<Class<?>> routedTypes = new HashSet<>();
    final List<String> routedPatterns = new ArrayList<>();
    for (Map.Entry<RequestMappingInfo, HandlerMethod> entry :
        handlerMapping.getHandlerMethods().entrySet()) {
      routedTypes.add(ClassUtils.getUserClass(entry.getValue().getBeanType()));
      routedPatterns.addAll(entry.getKey().getPatternValues());
    }
    final List<Candidate> candidates = new ArrayList<>();
    final Map<String, Object> described =
        applicationContext.getBeansWithAnnotation(SourceDescription.class);
    for (Object bean : described.values()) {
      final Class<?> type = ClassUtils.getUserClass(bean);
      final SourceDescription description =
          AnnotatedElementUtils.findMergedAnnotation(type, SourceDescription.class);
      final RequestMapping mapping =
          AnnotatedElementUtils.findMergedAnnotation(type, RequestMapping.class);
      candidates.add(
          new Candidate(
              type.getSimpleName(),
              mapping == null ? List.of() : List.of(mapping.path()),
              description.exampleEndpoint(),
              description.description(),
              routedTypes.contains(type)));
    }
    this.sources = catalogue(candidates, routedPrefixes(routedPatterns));
    logger.info(
        "registered {} sources: {}",
        sources.size(),
        sources.stream().map(SourceDescriptor::prefix).toList());
  }

  /** Registered sources ordered by prefix. */
  public List<SourceDescriptor> sources() {
    return sources;
  }

  /**
   * Validates described controllers against the routed prefixes and builds the catalogue.
   *
   * @param routedPrefixes first path segment of every mapped handler, gateway routes excluded
   * @throws IllegalStateException when two controllers claim one prefix, a prefix is not a
   *     single path segment, a controller has no handler method, an example endpoint lives
   *     outside its prefix, or a routed prefix has no description
   */
  static List<SourceDescriptor> catalogue(List<Candidate> candidates, Set<String> routedPrefixes) {
    final Map<String, String> owners = new HashMap<>();
    final List<SourceDescriptor> result = new ArrayList<>();
    for (Candidate candidate : candidates) {
      if (candidate.mappedPaths().size() != 1) {
        throw new IllegalStateException(
            candidate.controller() + " must map exactly one prefix, found "
                + candidate.mappedPaths());
      }
      final String prefix = normalize(candidate.mappedPaths().get(0));
      if (!SINGLE_SEGMENT.matcher(prefix).matches()) {
        throw new IllegalStateException(
            candidate.controller() + " prefix '" + prefix + "' is not a single path segment");
      }
      final String previous = owners.putIfAbsent(prefix, candidate.controller());
      if (previous != null) {
        throw new IllegalStateException(
            "prefix '" + prefix + "' is claimed by both " + previous + " and "
                + candidate.controller());
      }
      if (!candidate.routed()) {
        throw new IllegalStateException(
            candidate.controller() + " is described but has no handler methods");
      }
      final String example = candidate.exampleEndpoint();
      if (!example.startsWith(prefix + "/") && !example.equals(prefix)) {
        throw new IllegalStateException(
            candidate.controller() + " example endpoint '" + example + "' is outside " + prefix);
      }
      result.add(new SourceDescriptor(prefix.substring(1), example, candidate.description()));
    }
    for (String routed : routedPrefixes) {
      if (!owners.containsKey(routed)) {
        throw new IllegalStateException(
            "prefix '" + routed + "' is routed but has no @SourceDescription controller");
      }
    }
    result.sort(Comparator.comparing(SourceDescriptor::prefix));
    return List.copyOf(result);
  }

  /** First path segment of each pattern, without the root and gateway-owned routes. */
  static Set<String> routedPrefixes(Collection<String> patterns) {
    final Set<String> prefixes = new TreeSet<>();
    for (String pattern : patterns) {
      final String path = pattern.startsWith("/") ? pattern.substring(1) : pattern;
      if (path.isEmpty()) {
        continue;
      }
      final int slash = path.indexOf('/');
      final String prefix = "/" + (slash < 0 ? path : path.substring(0, slash));
      if (!UNLISTED_PREFIXES.contains(prefix)) {
        prefixes.add(prefix);
      }
    }
    return prefixes;
  }

  private static String normalize(String path) {
    String value = path.trim();
    if (!value.startsWith("/")) {
      value = "/" + value;
    }
    while (value.length() > 1 && value.endsWith("/")) {
      value = value.substring(0, value.length() - 1);
    }
    return value;
  }

  record Candidate(
      String controller,
      List<String> mappedPaths,
      String exampleEndpoint,
      String description,
      boolean routed) {}
}
