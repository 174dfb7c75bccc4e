/*
 * どこで: Aggregator ルーティングテスト
 * 何を: ソースカタログの構築規則（重複・形式・未ルーティング・例の範囲）を検証する
 * なぜ: /features が実在しないルートを案内しないことを起動時に保証するため
 */
package com.example.aggregator.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.aggregator.routing.SourceRegistry.Candidate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationContext;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.mvc.method.RequestMappingInfo;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

class SourceRegistryTest {

  @Test
  void catalogueIsSortedByPrefix() {
    final List<SourceDescriptor> sources =
        catalogue(
            List.of(
                candidate("PypiController", "/pypi", "/pypi/requests"),
                candidate("GithubController", "/github", "/github/repos"),
                candidate("NpmController", "npm/", "/npm/react")));

    assertThat(sources)
        .containsExactly(
            new SourceDescriptor("github", "/github/repos", "desc"),
            new SourceDescriptor("npm", "/npm/react", "desc"),
            new SourceDescriptor("pypi", "/pypi/requests", "desc"));
  }

  @Test
  void rejectsTwoControllersOnOnePrefix() {
    assertThatThrownBy(
            () ->
                catalogue(
                    List.of(
                        candidate("GithubController", "/github", "/github/repos"),
                        candidate("OtherController", "/github", "/github/x"))))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("claimed by both");
  }

  @Test
  void rejectsNestedPrefix() {
    assertThatThrownBy(
            () ->
                catalogue(
                    List.of(candidate("NestedController", "/a/b", "/a/b/c"))))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("single path segment");
  }

  @Test
  void rejectsControllerWithoutHandlers() {
    assertThatThrownBy(
            () ->
                catalogue(
                    List.of(
                        new Candidate(
                            "EmptyController", List.of("/empty"), "/empty/x", "desc", false))))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("has no handler methods");
  }

  @Test
  void rejectsExampleOutsidePrefix() {
    assertThatThrownBy(
            () ->
                catalogue(
                    List.of(candidate("GitlabController", "/gitlab", "/github/repos"))))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("is outside");
  }

  @Test
  void rejectsMissingOrMultiplePrefixes() {
    assertThatThrownBy(
            () ->
                catalogue(
                    List.of(new Candidate("Bare", List.of(), "/x", "desc", true))))
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(
            () ->
                catalogue(
                    List.of(new Candidate("Twice", List.of("/a", "/b"), "/a", "desc", true))))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void rejectsRoutedPrefixWithoutDescription() {
    assertThatThrownBy(
            () ->
                SourceRegistry.catalogue(
                    List.of(candidate("GithubController", "/github", "/github/repos")),
                    Set.of("/github", "/undescribed")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("'/undescribed' is routed but has no @SourceDescription");
  }

  @Test
  void acceptsCatalogueCoveringEveryRoutedPrefix() {
    final List<SourceDescriptor> sources =
        SourceRegistry.catalogue(
            List.of(
                candidate("GithubController", "/github", "/github/repos"),
                candidate("NpmController", "/npm", "/npm/react")),
            Set.of("/github", "/npm"));

    assertThat(sources).extracting(SourceDescriptor::prefix).containsExactly("github", "npm");
  }

  @Test
  void routedPrefixesSkipsRootAndGatewayRoutes() {
    assertThat(
            SourceRegistry.routedPrefixes(
                List.of(
                    "/",
                    "",
                    "/features",
                    "/error",
                    "/actuator/health",
                    "/hackernews/item/{item_id}",
                    "/hackernews/topstories",
                    "/undescribed/x")))
        .containsExactly("/hackernews", "/undescribed");
  }

  @Test
  void startupFailsForRoutedControllerWithoutDescription() throws Exception {
    final ApplicationContext context = mock(ApplicationContext.class);
    when(context.getBeansWithAnnotation(SourceDescription.class)).thenReturn(Map.of());
    final RequestMappingHandlerMapping handlerMapping = mock(RequestMappingHandlerMapping.class);
    when(handlerMapping.getHandlerMethods())
        .thenReturn(
            Map.of(
                RequestMappingInfo.paths("/undescribed/x").build(),
                new HandlerMethod(
                    new UndescribedController(), UndescribedController.class.getMethod("x"))));

    assertThatThrownBy(() -> new SourceRegistry(context, handlerMapping))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("'/undescribed' is routed");
  }

  private static List<SourceDescriptor> catalogue(List<Candidate> candidates) {
    return SourceRegistry.catalogue(candidates, Set.of());
  }

  private static Candidate candidate(String controller, String path, String example) {
    return new Candidate(controller, List.of(path), example, "desc", true);
  }

  public static class UndescribedController {
    public String x() {
      return "x";
    }
  }
}
