package com.ella.forecasting.controllers;

import java.util.List;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.ella.forecasting.dto.ApiResponse;
import com.ella.forecasting.dto.forecast.AccuracyUpdateSummaryDTO;
import com.ella.forecasting.dto.forecast.ForecastAlertDTO;
import com.ella.forecasting.dto.forecast.ForecastRequest;
import com.ella.forecasting.dto.forecast.ForecastResponseDTO;
import com.ella.forecasting.dto.forecast.ForecastSummaryDTO;
import com.ella.forecasting.dto.forecast.SeasonalPatternDTO;
import com.ella.forecasting.dto.forecast.SpendingTrendDTO;
import com.ella.forecasting.services.ForecastAccuracyService;
import com.ella.forecasting.services.ForecastService;
import com.ella.forecasting.services.ForecastSummaryService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/forecasting")
@RequiredArgsConstructor
@Tag(name = "Forecasting", description = "Spending forecasts, alerts and accuracy tracking")
public class ForecastController {

    private static final String USER_HEADER = "X-User-Id";

    private final ForecastService forecastService;
    private final ForecastAccuracyService accuracyService;
    private final ForecastSummaryService summaryService;

    @PostMapping("/generate")
    @Operation(summary = "Generate a spending forecast")
    public ResponseEntity<ApiResponse<ForecastResponseDTO>> generate(
            @RequestHeader(USER_HEADER) UUID userId,
            @Valid @RequestBody(required = false) ForecastRequest request
    ) {
        ForecastRequest body = request != null ? request : new ForecastRequest();
        ForecastResponseDTO forecast = forecastService.generateForecast(userId, body);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(forecast, "Forecast generated successfully"));
    }

    @GetMapping("/forecasts/{id}")
    public ResponseEntity<ApiResponse<ForecastResponseDTO>> getForecast(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable UUID id
    ) {
        return ResponseEntity.ok(ApiResponse.success(forecastService.getForecastById(id, userId), null));
    }

    @GetMapping("/forecasts")
    public ResponseEntity<ApiResponse<List<ForecastResponseDTO>>> listForecasts(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String periodType
    ) {
        return ResponseEntity.ok(ApiResponse.list(forecastService.getUserForecasts(userId, category, periodType)));
    }

    @PostMapping("/update-accuracy")
    @Operation(summary = "Record realized spending against past predictions")
    public ResponseEntity<ApiResponse<AccuracyUpdateSummaryDTO>> updateAccuracy(
            @RequestHeader(USER_HEADER) UUID userId
    ) {
        AccuracyUpdateSummaryDTO result = accuracyService.updateForecastAccuracy(userId);
        return ResponseEntity.ok(ApiResponse.success(result, result.message()));
    }

    @GetMapping("/summary")
    public ResponseEntity<ApiResponse<ForecastSummaryDTO>> summary(@RequestHeader(USER_HEADER) UUID userId) {
        return ResponseEntity.ok(ApiResponse.success(summaryService.getForecastSummary(userId), null));
    }

    @PutMapping("/forecasts/{id}/alerts/{alertId}/acknowledge")
    public ResponseEntity<ApiResponse<ForecastResponseDTO>> acknowledgeAlert(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable UUID id,
            @PathVariable UUID alertId
    ) {
        ForecastResponseDTO forecast = forecastService.acknowledgeAlert(id, alertId, userId);
        return ResponseEntity.ok(ApiResponse.success(forecast, "Alert acknowledged"));
    }

    @PutMapping("/forecasts/{id}/archive")
    public ResponseEntity<ApiResponse<ForecastResponseDTO>> archive(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable UUID id
    ) {
        return ResponseEntity.ok(ApiResponse.success(forecastService.archiveForecast(id, userId), "Forecast archived"));
    }

    @GetMapping("/alerts")
    public ResponseEntity<ApiResponse<List<ForecastAlertDTO>>> alerts(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestParam(required = false) String severity
    ) {
        return ResponseEntity.ok(ApiResponse.list(forecastService.getUnacknowledgedAlerts(userId, severity)));
    }

    @GetMapping("/patterns/trends")
    public ResponseEntity<ApiResponse<List<SpendingTrendDTO>>> trends(@RequestHeader(USER_HEADER) UUID userId) {
        return ResponseEntity.ok(ApiResponse.list(forecastService.getSpendingTrends(userId)));
    }

    @GetMapping("/patterns/seasonal")
    public ResponseEntity<ApiResponse<SeasonalPatternDTO>> seasonal(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestParam(required = false) String category
    ) {
        return ResponseEntity.ok(ApiResponse.success(forecastService.getSeasonalPatterns(userId, category), null));
    }
}
