package com.example.aggregator.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.aggregator.api.response.StackOverflowAnswer;
import com.example.aggregator.api.response.StackOverflowFeaturedQuestion;
import com.example.aggregator.api.response.StackOverflowQuestion;
import com.example.aggregator.api.response.StackOverflowSearchQuestion;
import com.example.aggregator.config.StackOverflowProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class StackOverflowClientTest {

  @Test
  void resolveUserIdFailsWithoutAnyIdentityAndMakesNoRequest() {
    final ClientFixture fixture = newFixture(null, null);

    assertThatThrownBy(() -> fixture.client.listUserQuestions(null, null))
        .isInstanceOf(SourceIntegrationException.class)
        .hasMessage("A Stack Overflow user_id or username must be provided.")
        .extracting(ex -> ((SourceIntegrationException) ex).reason())
        .isEqualTo(SourceIntegrationException.Reason.BAD_REQUEST);
    fixture.server.verify();
  }

  @Test
  void resolveUserIdPrefersExplicitIdOverConfiguredDefaults() {
    final ClientFixture fixture = newFixture("42", "someone");

    assertThat(fixture.client.resolveUserId(7L, "alice")).isEqualTo(7L);
  }

  @Test
  void resolveUserIdPrefersConfiguredIdOverExplicitUsername() {
    final ClientFixture fixture = newFixture("42", null);

    assertThat(fixture.client.resolveUserId(null, "alice")).isEqualTo(42L);
    fixture.server.verify();
  }

  @Test
  void resolveUserIdRejectsNonNumericConfiguredId() {
    final ClientFixture fixture = newFixture("abc", null);

    assertThatThrownBy(() -> fixture.client.resolveUserId(null, null))
        .isInstanceOf(SourceIntegrationException.class)
        .extracting(ex -> ((SourceIntegrationException) ex).reason())
        .isEqualTo(SourceIntegrationException.Reason.MISCONFIGURED);
  }

  @Test
  void listUserQuestionsLooksUpUsernameAndCapsResults() {
    final ClientFixture fixture = newFixture(null, null);
    fixture
        .server
        .expect(
            requestTo(
                "http://so.test/users?order=desc&sort=reputation&inname=alice&site=stackoverflow"))
        .andRespond(
            withSuccess(
                "{\"items\":[{\"user_id\":99},{\"user_id\":5}]}", MediaType.APPLICATION_JSON));
    final StringBuilder items = new StringBuilder();
    for (int id = 1; id <= 12; id++) {
      if (items.length() > 0) {
        items.append(',');
      }
      items
          .append("{\"question_id\":")
          .append(id)
          .append(",\"title\":\"Q")
          .append(id)
          .append("\",\"link\":\"https://stackoverflow.com/q/")
          .append(id)
          .append("\"}");
    }
    fixture
        .server
        .expect(
            requestTo(
                "http://so.test/users/99/questions?order=desc&sort=creation&site=stackoverflow"))
        .andRespond(withSuccess("{\"items\":[" + items + "]}", MediaType.APPLICATION_JSON));

    final List<StackOverflowQuestion> questions = fixture.client.listUserQuestions(null, "alice");

    assertThat(questions).hasSize(10);
    assertThat(questions.get(0).questionId()).isEqualTo(1L);
    assertThat(questions.get(0).title()).isEqualTo("Q1");
    fixture.server.verify();
  }

  @Test
  void listUserQuestionsReportsUnknownUsernameAsNotFound() {
    final ClientFixture fixture = newFixture(null, null);
    fixture
        .server
        .expect(
            requestTo(
                "http://so.test/users?order=desc&sort=reputation&inname=nobody&site=stackoverflow"))
        .andRespond(withSuccess("{\"items\":[]}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.listUserQuestions(null, "nobody"))
        .isInstanceOf(SourceIntegrationException.class)
        .hasMessage("Stack Overflow user 'nobody' not found")
        .extracting(ex -> ((SourceIntegrationException) ex).reason())
        .isEqualTo(SourceIntegrationException.Reason.NOT_FOUND);
  }

  @Test
  void listUserAnswersBuildsAnswerLinks() {
    final ClientFixture fixture = newFixture("42", null);
    fixture
        .server
        .expect(
            requestTo(
                "http://so.test/users/42/answers?order=desc&sort=creation&site=stackoverflow"))
        .andRespond(
            withSuccess(
                "{\"items\":[{\"answer_id\":1001,\"question_id\":77}]}",
                MediaType.APPLICATION_JSON));

    final List<StackOverflowAnswer> answers = fixture.client.listUserAnswers(null, null);

    assertThat(answers)
        .containsExactly(new StackOverflowAnswer(1001L, 77L, "https://stackoverflow.com/a/1001"));
  }

  @Test
  void listFeaturedQuestionsDefaultsMissingFields() {
    final ClientFixture fixture = newFixture(null, null);
    fixture
        .server
        .expect(
            requestTo(
                "http://so.test/questions/featured?order=desc&sort=activity&site=stackoverflow"))
        .andRespond(
            withSuccess(
                """
                {"items":[
                  {"title":"Bounty","link":"https://stackoverflow.com/q/1","bounty_amount":50,
                   "answer_count":2,"owner":{"display_name":"Ann"}},
                  {"title":"Plain","link":"https://stackoverflow.com/q/2"}
                ]}
                """,
                MediaType.APPLICATION_JSON));

    final List<StackOverflowFeaturedQuestion> featured = fixture.client.listFeaturedQuestions();

    assertThat(featured)
        .containsExactly(
            new StackOverflowFeaturedQuestion(
                "Bounty", "https://stackoverflow.com/q/1", 50, 2, "Ann"),
            new StackOverflowFeaturedQuestion(
                "Plain", "https://stackoverflow.com/q/2", 0, 0, null));
  }

  @Test
  void searchRequiresQueryAndTag() {
    final ClientFixture fixture = newFixture(null, null);

    assertThatThrownBy(() -> fixture.client.search(" ", "java"))
        .isInstanceOf(SourceIntegrationException.class)
        .extracting(ex -> ((SourceIntegrationException) ex).reason())
        .isEqualTo(SourceIntegrationException.Reason.BAD_REQUEST);
    assertThatThrownBy(() -> fixture.client.search("streams", ""))
        .isInstanceOf(SourceIntegrationException.class)
        .extracting(ex -> ((SourceIntegrationException) ex).reason())
        .isEqualTo(SourceIntegrationException.Reason.BAD_REQUEST);
    fixture.server.verify();
  }

  @Test
  void searchMapsOwnerTagsAndAnsweredFlag() {
    final ClientFixture fixture = newFixture(null, null);
    fixture
        .server
        .expect(
            requestTo(
                "http://so.test/search?intitle=streams&tagged=java&sort=relevance&order=desc"
                    + "&site=stackoverflow"))
        .andRespond(
            withSuccess(
                """
                {"items":[{"question_id":3,"title":"Java streams","link":"https://so/q/3",
                "owner":{"display_name":"Bob"},"tags":["java","stream"],"score":12,
                "is_answered":true}]}
                """,
                MediaType.APPLICATION_JSON));

    final List<StackOverflowSearchQuestion> results = fixture.client.search("streams", "java");

    assertThat(results).hasSize(1);
    final StackOverflowSearchQuestion question = results.get(0);
    assertThat(question.owner().displayName()).isEqualTo("Bob");
    assertThat(question.tags()).containsExactly("java", "stream");
    assertThat(question.score()).isEqualTo(12L);
    assertThat(question.answered()).isTrue();
  }

  private ClientFixture newFixture(String defaultUserId, String defaultUsername) {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://so.test").build();
    final UpstreamExchange exchange =
        new UpstreamExchange(new GatewayMetrics(new SimpleMeterRegistry()));
    final StackOverflowClient client =
        new StackOverflowClient(
            restClient,
            new StackOverflowProperties(
                "http://so.test", "stackoverflow", defaultUserId, defaultUsername),
            exchange);
    return new ClientFixture(client, server);
  }

  private record ClientFixture(StackOverflowClient client, MockRestServiceServer server) {}
}
