package com.example.aggregator.api;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.aggregator.api.response.CodeforcesContest;
import com.example.aggregator.api.response.CodeforcesUser;
import com.example.aggregator.service.CodeforcesClient;
import com.example.aggregator.service.GatewayMetrics;
import com.example.aggregator.service.SourceIntegrationException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(CodeforcesController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(GatewayApiExceptionHandler.class)
class CodeforcesControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private CodeforcesClient codeforcesClient;
  @MockitoBean private GatewayMetrics gatewayMetrics;

  @Test
  void contestsReturnsUpcomingContests() throws Exception {
    when(codeforcesClient.listUpcomingContests())
        .thenReturn(
            List.of(
                new CodeforcesContest(
                    2000L, "Round 2000", "BEFORE", "https://codeforces.com/contest/2000")));

    mockMvc
        .perform(get("/codeforces/contests"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].link").value("https://codeforces.com/contest/2000"))
        .andExpect(jsonPath("$[0].phase").value("BEFORE"));
  }

  @Test
  void meUsesConfiguredHandleInsteadOfLookingUpMe() throws Exception {
    when(codeforcesClient.getDefaultUser())
        .thenReturn(
            new CodeforcesUser(
                "tourist", null, null, null, null, 3800, 4000, null, null, null,
                "https://codeforces.com/profile/tourist"));

    mockMvc
        .perform(get("/codeforces/userinfo/me"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.handle").value("tourist"))
        .andExpect(jsonPath("$.max_rating").value(4000))
        .andExpect(jsonPath("$.profile_link").value("https://codeforces.com/profile/tourist"));
    verify(codeforcesClient).getDefaultUser();
    verifyNoMoreInteractions(codeforcesClient);
  }

  @Test
  void missingDefaultHandleReturns500NamingTheSetting() throws Exception {
    when(codeforcesClient.getDefaultUser())
        .thenThrow(SourceIntegrationException.misconfigured("Codeforces", "CODEFORCES_HANDLE"));

    mockMvc
        .perform(get("/codeforces/userinfo/me"))
        .andExpect(status().isInternalServerError())
        .andExpect(
            jsonPath("$.detail").value("CODEFORCES_HANDLE is not configured in the environment."));
  }
}
