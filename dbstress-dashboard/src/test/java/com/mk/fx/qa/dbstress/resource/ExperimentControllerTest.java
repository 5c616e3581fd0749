package com.mk.fx.qa.dbstress.resource;

import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.mk.fx.qa.dbstress.error.ExperimentAlreadyRunningException;
import com.mk.fx.qa.dbstress.experiment.ExperimentConfig;
import com.mk.fx.qa.dbstress.experiment.ExperimentPhase;
import com.mk.fx.qa.dbstress.experiment.ExperimentRunner;
import com.mk.fx.qa.dbstress.experiment.ExperimentStatus;
import com.mk.fx.qa.dbstress.model.EntityKey;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@ExtendWith(MockitoExtension.class)
class ExperimentControllerTest {

  private static final String REQUEST =
      "{\"runA\": {\"prefix\": \"a\", \"label\": \"baseline\"},"
          + " \"runB\": {\"prefix\": \"b\", \"sessions\": 20},"
          + " \"warmupSeconds\": 5, \"measurementSeconds\": 30}";

  @Mock private ExperimentRunner experimentRunner;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcSupport.mockMvc(
            new ExperimentController(
                experimentRunner,
                Mappers.getMapper(DashboardMapper.class),
                new ApiResponseFactory()));
  }

  @Test
  void run_startsExperimentAndReturnsAccepted() throws Exception {
    when(experimentRunner.run(any())).thenReturn(new CompletableFuture<>());

    mockMvc
        .perform(post("/api/experiment").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.message", is("Experiment started: baseline vs B")));

    var captor = ArgumentCaptor.forClass(ExperimentConfig.class);
    verify(experimentRunner).run(captor.capture());
    var config = captor.getValue();
    assertEquals(EntityKey.of("A"), config.variantA().entityKey());
    assertEquals(20, config.variantB().workload().sessions());
    assertEquals(5, config.warmupSeconds());
    assertEquals(30, config.measurementSeconds());
  }

  @Test
  void run_whileRunning_returnsConflict() throws Exception {
    when(experimentRunner.run(any())).thenThrow(new ExperimentAlreadyRunningException());

    mockMvc
        .perform(post("/api/experiment").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
        .andExpect(status().isConflict());
  }

  @Test
  void run_withoutVariantB_isRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/experiment")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"runA\": {\"prefix\": \"a\"}}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void stop_whenIdle_reportsNothingToStop() throws Exception {
    when(experimentRunner.stop()).thenReturn(false);

    mockMvc
        .perform(post("/api/experiment/stop"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success", is(false)))
        .andExpect(jsonPath("$.message", is("No experiment running")));
  }

  @Test
  void get_withoutResult_returnsStatusOnly() throws Exception {
    when(experimentRunner.status())
        .thenReturn(new ExperimentStatus(false, ExperimentPhase.IDLE, null, 0, 0, 0));
    when(experimentRunner.experimentResult()).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/api/experiment"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status.phase", is("IDLE")))
        .andExpect(jsonPath("$.result").doesNotExist());
  }
}
