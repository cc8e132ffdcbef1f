package com.ella.forecasting.services.forecasting.models;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.ella.forecasting.enums.ForecastAlgorithm;

@Component
public class ForecastModelSelector {

    private final Map<ForecastAlgorithm, ForecastModel> models = new EnumMap<>(ForecastAlgorithm.class);

    public ForecastModelSelector(List<ForecastModel> forecastModels) {
        for (ForecastModel model : forecastModels) {
            ForecastModel previous = models.put(model.algorithm(), model);
            if (previous != null) {
                throw new IllegalStateException("Duplicate forecast model for " + model.algorithm());
            }
        }
    }

    public ForecastModel select(ForecastAlgorithm algorithm) {
        ForecastModel model = models.get(algorithm);
        if (model == null) {
            throw new IllegalStateException("No forecast model registered for " + algorithm);
        }
        return model;
    }
}
