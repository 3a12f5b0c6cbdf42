package com.assethealth.anomaly.controller;

import com.assethealth.anomaly.config.ScoringProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SystemController.class)
@Import(ScoringProperties.class)
class SystemControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void info_listsModelFormatsAndDefaults() throws Exception {
        mockMvc.perform(get("/api/v1/system/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.model").value("Isolation Forest"))
                .andExpect(jsonPath("$.supportedFormats[0]").value("csv"))
                .andExpect(jsonPath("$.topFeatureCount").value(7))
                .andExpect(jsonPath("$.trainingMeanThreshold").value(10.0))
                .andExpect(jsonPath("$.defaults.timestampColumn").value("Time"))
                .andExpect(jsonPath("$.defaults.contamination").value(0.1))
                .andExpect(jsonPath("$.defaults.minTrainingHours").value(72))
                .andExpect(jsonPath("$.defaults.defaultTrainingHours").value(120));
    }
}
