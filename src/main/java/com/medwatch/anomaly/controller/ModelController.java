package com.medwatch.anomaly.controller;

import com.medwatch.anomaly.service.ModelTrainingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Isolation Forest model training and metadata")
public class ModelController {

    private final ModelTrainingService trainingService;

    public ModelController(ModelTrainingService trainingService) {
        this.trainingService = trainingService;
    }

    @Operation(summary = "Train the global IF model",
            description = "Trains an Isolation Forest on every stored medicine across 6 supply features, " +
                    "persists it and swaps it into the running detector.")
    @PostMapping("/train")
    public ResponseEntity<Map<String, Object>> train(
            @Parameter(description = "Number of isolation trees", example = "100")
            @RequestParam(defaultValue = "100") int numTrees,
            @Parameter(description = "Sub-sampling size per tree", example = "256")
            @RequestParam(defaultValue = "256") int sampleSize) {
        try {
            return ResponseEntity.ok(trainingService.train(numTrees, sampleSize));
        } catch (IllegalStateException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "List trained models",
            description = "Returns metadata for each stored model: tree count, feature count, training samples and training timestamp.")
    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> listModels() {
        return ResponseEntity.ok(trainingService.listModels());
    }
}
