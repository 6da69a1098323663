package com.pgoutbox.adapter.in.web;

import com.pgoutbox.application.port.in.GetSubscriptionStatusUseCase;
import com.pgoutbox.domain.model.SubscriptionState;
import com.pgoutbox.domain.model.SubscriptionStatus;
import com.pgoutbox.domain.model.WalPosition;
import com.pgoutbox.infrastructure.exception.ConnectionFailureException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SuppressWarnings("removal")
@WebMvcTest(SubscriptionController.class)
class SubscriptionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GetSubscriptionStatusUseCase getSubscriptionStatusUseCase;

    @Test
    void shouldReturnStatus() throws Exception {
        when(getSubscriptionStatusUseCase.getStatus()).thenReturn(
            new SubscriptionStatus(SubscriptionState.STREAMING, WalPosition.parse("16/B374D848"), 42, 1));

        mockMvc.perform(get("/api/v1/subscription"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("STREAMING"))
            .andExpect(jsonPath("$.confirmedPosition").value("16/B374D848"))
            .andExpect(jsonPath("$.dispatched").value(42))
            .andExpect(jsonPath("$.failed").value(1));
    }

    @Test
    void shouldReturnNotStartedStatus() throws Exception {
        when(getSubscriptionStatusUseCase.getStatus()).thenReturn(SubscriptionStatus.notStarted());

        mockMvc.perform(get("/api/v1/subscription"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("DISCONNECTED"))
            .andExpect(jsonPath("$.confirmedPosition").value("0/0"));
    }

    @Test
    void shouldMapOutboxErrorsToServiceUnavailable() throws Exception {
        when(getSubscriptionStatusUseCase.getStatus()).thenThrow(new ConnectionFailureException("database unreachable"));

        mockMvc.perform(get("/api/v1/subscription"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("CONNECTION_FAILURE"));
    }
}
