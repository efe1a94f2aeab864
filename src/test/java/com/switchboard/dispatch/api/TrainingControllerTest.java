package com.switchboard.dispatch.api;

import com.switchboard.core.model.RetrainResult;
import com.switchboard.core.model.TrainingResult;
import com.switchboard.core.model.TrainingStats;
import com.switchboard.core.training.TrainingStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TrainingController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class TrainingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TrainingStore trainingStore;

    @Test
    @DisplayName("POST /examples reports partial success in the body")
    void trainPartial() throws Exception {
        when(trainingStore.trainOnExamples(anyList()))
                .thenReturn(new TrainingResult(false, 1, List.of("Unknown intent: order_pizza")));

        mockMvc.perform(post("/api/v1/training/examples")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"examples":[
                                  {"message":"make a todo for taxes","intent":"create_task"},
                                  {"message":"get me a pizza","intent":"order_pizza"}
                                ]}"""))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.trainedCount").value(1))
                .andExpect(jsonPath("$.errors[0]").value("Unknown intent: order_pizza"));
    }

    @Test
    @DisplayName("POST /examples without examples returns 400")
    void trainEmpty() throws Exception {
        mockMvc.perform(post("/api/v1/training/examples")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("At least one example is required"));
        verifyNoInteractions(trainingStore);
    }

    @Test
    @DisplayName("POST /retrain returns the replay count")
    void retrain() throws Exception {
        when(trainingStore.retrainFromExamples()).thenReturn(new RetrainResult(true, 4));

        mockMvc.perform(post("/api/v1/training/retrain"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.retrained").value(4));
    }

    @Test
    @DisplayName("GET /stats returns counts per intent")
    void stats() throws Exception {
        when(trainingStore.getTrainingStats()).thenReturn(new TrainingStats(3, Map.of("create_task", 3),
                Instant.parse("2026-03-01T09:00:00Z"), Instant.parse("2026-03-02T09:00:00Z")));

        mockMvc.perform(get("/api/v1/training/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalExamples").value(3))
                .andExpect(jsonPath("$.examplesByIntent.create_task").value(3))
                .andExpect(jsonPath("$.oldestExample").value("2026-03-01T09:00:00Z"));
    }
}
