package com.mk.fx.qa.chatflow.execution.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.chatflow.execution.cfg.ObjectMapperConfig;
import com.mk.fx.qa.chatflow.execution.grouping.CaseGrouper;
import com.mk.fx.qa.chatflow.execution.service.TestCaseStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class TestCaseControllerTest {

  private static final String UPLOAD =
      "["
          + "{\"group_id\":\"A\",\"turn_number\":1,\"user_message\":\"hi\"},"
          + "{\"group_id\":\"A\",\"turn_number\":\"2\",\"user_message\":\"bye\","
          + "\"extra_inputs\":\"{\\\"lang\\\":\\\"en\\\"}\"},"
          + "{\"对话ID\":\"B\",\"轮次\":2,\"用户问题\":\"late\"}"
          + "]";

  private final ObjectMapper objectMapper = new ObjectMapperConfig().objectMapper();
  private final TestCaseStore store = new TestCaseStore();
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    var controller = new TestCaseController(store, new CaseGrouper(objectMapper));
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
            .build();
  }

  @Test
  void uploadReplacesRowsAndReportsValidation() throws Exception {
    mockMvc
        .perform(post("/api/test-cases").contentType(MediaType.APPLICATION_JSON).content(UPLOAD))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.rows", is(3)))
        .andExpect(jsonPath("$.validGroups", is(1)))
        .andExpect(jsonPath("$.validTurns", is(2)))
        .andExpect(jsonPath("$.validationErrors", hasSize(1)))
        .andExpect(jsonPath("$.validationErrors[0].groupId", is("B")));

    assertThat(store.size()).isEqualTo(3);
    assertThat(store.getAll().get(2).getUserMessage()).isEqualTo("late");

    mockMvc
        .perform(get("/api/test-cases"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(3)))
        .andExpect(jsonPath("$[0].group_id", is("A")));
  }

  @Test
  void validateDoesNotStoreRows() throws Exception {
    mockMvc
        .perform(
            post("/api/test-cases/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(UPLOAD))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.validGroups", is(1)));

    assertThat(store.size()).isZero();
  }

  @Test
  void clearRemovesRows() throws Exception {
    mockMvc.perform(
        post("/api/test-cases").contentType(MediaType.APPLICATION_JSON).content(UPLOAD));

    mockMvc.perform(delete("/api/test-cases")).andExpect(status().isNoContent());

    assertThat(store.getAll()).isEmpty();
  }

  @Test
  void malformedBodyIsBadRequest() throws Exception {
    mockMvc
        .perform(post("/api/test-cases").contentType(MediaType.APPLICATION_JSON).content("{oops"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error", is("Invalid Request Body")));
  }
}
