package com.mk.fx.qa.dbstress.resource;

import com.mk.fx.qa.dbstress.cfg.ObjectMapperConfig;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/** Standalone MockMvc wired with the application's exception handler and Jackson setup. */
final class MockMvcSupport {

  private MockMvcSupport() {}

  static MockMvc mockMvc(Object controller) {
    return MockMvcBuilders.standaloneSetup(controller)
        .setControllerAdvice(new GlobalExceptionHandler())
        .setMessageConverters(
            new MappingJackson2HttpMessageConverter(new ObjectMapperConfig().objectMapper()))
        .build();
  }
}
