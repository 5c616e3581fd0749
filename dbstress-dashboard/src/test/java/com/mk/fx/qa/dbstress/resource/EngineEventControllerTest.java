package com.mk.fx.qa.dbstress.resource;

import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.mk.fx.qa.dbstress.event.EngineEvent;
import com.mk.fx.qa.dbstress.event.EngineEventLoop;
import com.mk.fx.qa.dbstress.event.EngineEventParser;
import com.mk.fx.qa.dbstress.event.OperationProgressEvent;
import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.telemetry.LenientNumberReader;
import com.mk.fx.qa.dbstress.telemetry.MalformedFieldTracker;
import java.time.Clock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@ExtendWith(MockitoExtension.class)
class EngineEventControllerTest {

  @Mock private EngineEventLoop eventLoop;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    var parser =
        new EngineEventParser(
            new LenientNumberReader(new MalformedFieldTracker()), Clock.systemUTC());
    mockMvc =
        MockMvcSupport.mockMvc(
            new EngineEventController(parser, eventLoop, new ApiResponseFactory()));
  }

  @Test
  void push_progress_isParsedAndQueued() throws Exception {
    when(eventLoop.submit(any())).thenReturn(true);

    mockMvc
        .perform(
            post("/api/engine/events/progress")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"schemaId\": \"s1\", \"step\": \"Gathering stats\", \"progress\": 90}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.message", is("Queued")));

    var captor = ArgumentCaptor.forClass(EngineEvent.class);
    verify(eventLoop).submit(captor.capture());
    var event = assertInstanceOf(OperationProgressEvent.class, captor.getValue());
    assertEquals(EntityKey.of("S1"), event.id());
    assertEquals(90, event.percent());
  }

  @Test
  void push_unknownType_isRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/engine/events/metrics")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error", is("Invalid Argument")));

    verify(eventLoop, never()).submit(any());
  }

  @Test
  void push_progressWithoutId_isRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/engine/events/progress")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"progress\": 10}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void push_whenQueueFull_returnsServiceUnavailable() throws Exception {
    when(eventLoop.submit(any())).thenReturn(false);

    mockMvc
        .perform(
            post("/api/engine/events/telemetry")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tps\": 12}"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.success", is(false)));
  }
}
