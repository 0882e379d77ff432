package com.medwatch.anomaly.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.repository.MedicineDataRepository;
import com.medwatch.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(MedicineController.class)
class MedicineControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private MedicineDataRepository medicineDataRepository;

    @Test
    void upsert_accepted() throws Exception {
        DataPoint dp = TestDataFactory.createDataPoint("MED-0001");

        mockMvc.perform(post("/api/v1/medicines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(dp)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.medicineId").value("MED-0001"))
                .andExpect(jsonPath("$.status").value("pending"));

        ArgumentCaptor<DataPoint> saved = ArgumentCaptor.forClass(DataPoint.class);
        verify(medicineDataRepository).save(saved.capture());
        assertThat(saved.getValue().getStockHistory()).containsExactly(1000L, 1020L, 1040L);
        assertThat(saved.getValue().getCriticalThreshold()).isEqualTo(200L);
    }

    @Test
    void upsert_missingMedicineId_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/medicines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"medicineName\":\"Amoxil 500mg\",\"currentStock\":10}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("medicineId is required"));
        verify(medicineDataRepository, never()).save(any());
    }

    @Test
    void getMedicine_found() throws Exception {
        when(medicineDataRepository.findById("MED-0001")).thenReturn(TestDataFactory.createDataPoint("MED-0001"));

        mockMvc.perform(get("/api/v1/medicines/MED-0001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.medicineName").value("Amoxil 500mg"))
                .andExpect(jsonPath("$.currentStock").value(1000));
    }

    @Test
    void getMedicine_notFound() throws Exception {
        when(medicineDataRepository.findById("MISSING")).thenReturn(null);

        mockMvc.perform(get("/api/v1/medicines/MISSING"))
                .andExpect(status().isNotFound());
    }
}
