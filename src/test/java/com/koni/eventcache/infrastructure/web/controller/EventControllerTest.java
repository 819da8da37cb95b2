package com.koni.eventcache.infrastructure.web.controller;

import com.koni.eventcache.application.query.EventResponse;
import com.koni.eventcache.application.query.ListEventsQuery;
import com.koni.eventcache.application.query.ListEventsQueryHandler;
import com.koni.eventcache.domain.exception.ValidationException;
import com.koni.eventcache.tags.UnitTest;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for EventController.
 *
 * Tests:
 * - GET /api/v1/events parameter binding and defaults
 * - JSON shape of the response
 * - 400 on invalid parameters
 */
@UnitTest
@WebMvcTest(EventController.class)
class EventControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ListEventsQueryHandler queryHandler;

    @Test
    void shouldReturnEventsForDevice() throws Exception {
        // Given
        Map<String, Object> data = Map.of("temperature", 21, "motion", true);
        when(queryHandler.handle(any(ListEventsQuery.class))).thenReturn(Arrays.asList(
                new EventResponse("4711", 1717000000L, 21, true, data),
                new EventResponse("4711", 1717000060L, null, null, Collections.emptyMap())));

        // When / Then
        mockMvc.perform(get("/api/v1/events")
                        .param("deviceId", "4711")
                        .param("max", "2")
                        .param("since", "1717000000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].deviceId").value("4711"))
                .andExpect(jsonPath("$[0].creationTime").value(1717000000L))
                .andExpect(jsonPath("$[0].temperature").value(21))
                .andExpect(jsonPath("$[0].motion").value(true))
                .andExpect(jsonPath("$[1].temperature").doesNotExist());

        ArgumentCaptor<ListEventsQuery> captor = ArgumentCaptor.forClass(ListEventsQuery.class);
        verify(queryHandler).handle(captor.capture());
        assertThat(captor.getValue().getDeviceId()).isEqualTo("4711");
        assertThat(captor.getValue().getMax()).isEqualTo(2);
        assertThat(captor.getValue().getSince()).isEqualTo(1717000000L);
    }

    @Test
    void shouldApplyDefaultsWhenParametersAreOmitted() throws Exception {
        // Given
        when(queryHandler.handle(any(ListEventsQuery.class))).thenReturn(Collections.emptyList());

        // When / Then
        mockMvc.perform(get("/api/v1/events"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        ArgumentCaptor<ListEventsQuery> captor = ArgumentCaptor.forClass(ListEventsQuery.class);
        verify(queryHandler).handle(captor.capture());
        assertThat(captor.getValue().getDeviceId()).isNull();
        assertThat(captor.getValue().getMax()).isZero();
        assertThat(captor.getValue().getSince()).isZero();
    }

    @Test
    void shouldReturnBadRequestForNonNumericMax() throws Exception {
        mockMvc.perform(get("/api/v1/events").param("max", "ten"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("Invalid value for parameter max"));

        verify(queryHandler, never()).handle(any());
    }

    @Test
    void shouldReturnBadRequestWhenQueryIsRejected() throws Exception {
        // Given
        when(queryHandler.handle(any(ListEventsQuery.class))).thenThrow(new ValidationException("deviceId is required"));

        // When / Then
        mockMvc.perform(get("/api/v1/events"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("deviceId is required"));
    }
}
