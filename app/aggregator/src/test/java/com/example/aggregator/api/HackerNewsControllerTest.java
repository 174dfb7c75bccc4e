package com.example.aggregator.api;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.aggregator.api.response.HackerNewsStory;
import com.example.aggregator.service.GatewayMetrics;
import com.example.aggregator.service.HackerNewsClient;
import com.example.aggregator.service.HackerNewsClient.StoryFeed;
import com.example.aggregator.service.SourceIntegrationException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(HackerNewsController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(GatewayApiExceptionHandler.class)
class HackerNewsControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private HackerNewsClient hackerNewsClient;
  @MockitoBean private GatewayMetrics gatewayMetrics;

  @Test
  void topStoriesReturnsSnakeCaseRecords() throws Exception {
    when(hackerNewsClient.listStories(StoryFeed.TOP))
        .thenReturn(
            List.of(new HackerNewsStory(1L, "Title", null, "pg", 10, 1700000000, "story", 4)));

    mockMvc
        .perform(get("/hackernews/topstories"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value(1))
        .andExpect(jsonPath("$[0].by").value("pg"))
        .andExpect(jsonPath("$[0].descendants").value(4));
  }

  @Test
  void itemReturns404WithDetail() throws Exception {
    when(hackerNewsClient.getItem(999L))
        .thenThrow(
            SourceIntegrationException.notFound("Hacker News", "Item with ID 999 not found."));

    mockMvc
        .perform(get("/hackernews/item/999"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.detail").value("Item with ID 999 not found."));
  }

  @Test
  void nonNumericItemIdIsRejectedBeforeCallingUpstream() throws Exception {
    mockMvc
        .perform(get("/hackernews/item/abc"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Invalid value for 'item_id'."));
    verifyNoInteractions(hackerNewsClient);
  }

  @Test
  void searchWithoutQueryReturns400() throws Exception {
    mockMvc
        .perform(get("/hackernews/search"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Query parameter 'query' is required."));
  }
}
