package com.ella.forecasting.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeasonalFactor {

    public static final String HIGH_SPENDING_EVENT = "High spending period";
    public static final String LOW_SPENDING_EVENT = "Low spending period";

    // 1 = janeiro
    @Column(name = "calendar_month", nullable = false)
    private int month;

    @Column(nullable = false)
    private double factor;

    @Column(length = 50)
    private String event;
}
