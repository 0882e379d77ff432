package com.medwatch.anomaly.controller;

import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.repository.MedicineDataRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/medicines")
@Tag(name = "Medicines", description = "Ingest medicine supply data for the next detection batch")
public class MedicineController {

    private final MedicineDataRepository medicineDataRepository;

    public MedicineController(MedicineDataRepository medicineDataRepository) {
        this.medicineDataRepository = medicineDataRepository;
    }

    @Operation(summary = "Upsert medicine supply data",
            description = "Stores the record and queues it for the next batch. Re-posting an ID replaces the record and queues it again.")
    @PostMapping
    public ResponseEntity<?> upsert(@RequestBody DataPoint dataPoint) {
        if (dataPoint.getMedicineId() == null || dataPoint.getMedicineId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "medicineId is required"));
        }
        medicineDataRepository.save(dataPoint);
        return ResponseEntity.accepted().body(Map.of("medicineId", dataPoint.getMedicineId(), "status", "pending"));
    }

    @Operation(summary = "Get medicine supply data by ID")
    @GetMapping("/{medicineId}")
    public ResponseEntity<DataPoint> getMedicine(
            @Parameter(description = "Medicine ID", example = "MED-0001")
            @PathVariable String medicineId) {
        DataPoint dataPoint = medicineDataRepository.findById(medicineId);
        if (dataPoint == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(dataPoint);
    }
}
