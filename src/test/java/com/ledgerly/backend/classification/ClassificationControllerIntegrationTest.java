package com.ledgerly.backend.classification;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop",
        "spring.datasource.url=jdbc:h2:mem:ledgerly_classification_test;DB_CLOSE_DELAY=-1;MODE=PostgreSQL",
        "spring.datasource.driverClassName=org.h2.Driver",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "spring.jpa.database-platform=org.hibernate.dialect.H2Dialect",
        "ledgerly.categorizer.bootstrap-on-startup=false"
})
@AutoConfigureMockMvc
class ClassificationControllerIntegrationTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    CategoryModelTrainingService trainingService;

    @Test
    void retrain_queued_returnsAccepted() throws Exception {
        when(trainingService.retrainFromLedger()).thenReturn(new CompletableFuture<>());

        mockMvc.perform(post("/api/classification/model/retrain"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Retraining started"));

        verify(trainingService).retrainFromLedger();
    }

    @Test
    void retrain_trainingQueueFull_returnsConflict() throws Exception {
        when(trainingService.retrainFromLedger()).thenThrow(new TaskRejectedException("queue full"));

        mockMvc.perform(post("/api/classification/model/retrain"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("A retrain is already in progress, try again later"));
    }
}
