package com.autoflow.api.rest;

import com.autoflow.core.exception.DuplicateDefinitionException;
import com.autoflow.core.exception.InvalidStateTransitionException;
import com.autoflow.core.model.ExecutionStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ApiExceptionHandlerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mockMvc = MockMvcBuilders.standaloneSetup(new FailingController())
            .setControllerAdvice(new ApiExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(mapper))
            .build();
    }

    @Test
    void duplicateDefinitionIsConflict() throws Exception {
        mockMvc.perform(get("/test/duplicate"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error_code").value(DuplicateDefinitionException.ERROR_CODE))
            .andExpect(jsonPath("$.violations").doesNotExist());
    }

    @Test
    void invalidTransitionIsConflict() throws Exception {
        mockMvc.perform(get("/test/transition"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error_code").value(InvalidStateTransitionException.ERROR_CODE));
    }

    @Test
    void unexpectedExceptionIsInternalError() throws Exception {
        mockMvc.perform(get("/test/boom"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error_code").value(ApiExceptionHandler.INTERNAL_ERROR))
            .andExpect(jsonPath("$.message").value("Internal error"));
    }

    @RestController
    static class FailingController {

        @GetMapping("/test/duplicate")
        public String duplicate() {
            throw new DuplicateDefinitionException("greeting", 2);
        }

        @GetMapping("/test/transition")
        public String transition() {
            throw new InvalidStateTransitionException(UUID.randomUUID(), ExecutionStatus.COMPLETED, ExecutionStatus.RUNNING);
        }

        @GetMapping("/test/boom")
        public String boom() {
            throw new IllegalStateException("boom");
        }
    }
}
