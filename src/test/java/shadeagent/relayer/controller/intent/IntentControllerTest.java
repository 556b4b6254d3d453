package shadeagent.relayer.controller.intent;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.server.ResponseStatusException;

import com.fasterxml.jackson.databind.ObjectMapper;

import shadeagent.relayer.dto.intent.IntentAckResponse;
import shadeagent.relayer.dto.intent.IntentMessage;
import shadeagent.relayer.dto.intent.IntentStatusResponse;
import shadeagent.relayer.exception.GlobalExceptionHandler;
import shadeagent.relayer.exception.IntentAuthorizationException;
import shadeagent.relayer.exception.IntentValidationException;
import shadeagent.relayer.service.intent.IntentService;
import shadeagent.relayer.support.TestIntents;

@ExtendWith(MockitoExtension.class)
@DisplayName("IntentController Tests")
class IntentControllerTest {

    @Mock
    private IntentService intentService;

    @InjectMocks
    private IntentController intentController;

    private MockMvc mockMvc;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(intentController)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
        objectMapper = new ObjectMapper();
    }

    @Nested
    @DisplayName("Submit Endpoint Tests")
    class SubmitTests {

        @Test
        @DisplayName("Should return 202 with the acknowledgement")
        void shouldAcceptIntent() throws Exception {
            when(intentService.submit(any()))
                .thenReturn(new IntentAckResponse("i1", "pending", null, "2026-01-01T00:00:00Z"));

            mockMvc.perform(post("/api/intents")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(TestIntents.swapMessage("i1"))))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.intentId").value("i1"))
                .andExpect(jsonPath("$.state").value("pending"));
        }

        @Test
        @DisplayName("Should return 400 naming the invalid field")
        void shouldReturnBadRequestForInvalidIntent() throws Exception {
            when(intentService.submit(any())).thenThrow(new IntentValidationException("sourceAmount", "sourceAmount must be greater than zero"));

            mockMvc.perform(post("/api/intents")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(TestIntents.swapMessage("i1"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.field").value("sourceAmount"));
        }

        @Test
        @DisplayName("Should return 403 for a rejected proof")
        void shouldReturnForbiddenForUnauthorizedIntent() throws Exception {
            when(intentService.submit(any())).thenThrow(new IntentAuthorizationException("identity", "Authorization failed"));

            mockMvc.perform(post("/api/intents")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(TestIntents.swapMessage("i1"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.check").value("identity"));
        }

        @Test
        @DisplayName("Should return 400 for an unknown chain")
        void shouldRejectUnknownChain() throws Exception {
            mockMvc.perform(post("/api/intents")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"intentId\":\"i1\",\"destinationChain\":\"dogechain\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed intent payload"));

            verify(intentService, never()).submit(any());
        }

        @Test
        @DisplayName("Should return 400 with field errors for an oversized intent id")
        void shouldRejectOversizedIntentId() throws Exception {
            IntentMessage message = TestIntents.swapMessage("x".repeat(129));

            mockMvc.perform(post("/api/intents")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(message)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"))
                .andExpect(jsonPath("$.errors.intentId").value("intentId must be at most 128 characters"));

            verify(intentService, never()).submit(any());
        }
    }

    @Nested
    @DisplayName("Status Endpoint Tests")
    class StatusTests {

        @Test
        @DisplayName("Should return the current status")
        void shouldReturnStatus() throws Exception {
            when(intentService.queryStatus("i1")).thenReturn(new IntentStatusResponse(
                "i1", "succeeded", 1, "abc", null, null, null, null, null, "chain-swap completed", null));

            mockMvc.perform(get("/api/intents/i1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("succeeded"))
                .andExpect(jsonPath("$.txId").value("abc"))
                .andExpect(jsonPath("$.intentData").doesNotExist());
        }

        @Test
        @DisplayName("Should return 404 for an unknown intent")
        void shouldReturnNotFound() throws Exception {
            when(intentService.queryStatus("missing"))
                .thenThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "Intent not found"));

            mockMvc.perform(get("/api/intents/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Intent not found"));
        }
    }
}
