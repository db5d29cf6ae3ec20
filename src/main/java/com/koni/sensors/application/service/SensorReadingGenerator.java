package com.koni.sensors.application.service;

import com.koni.sensors.domain.model.AxisReading;
import com.koni.sensors.domain.model.SensorReading;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Generates plausible readings in the ranges an indoor board reports.
 * Floating point values are rounded to two decimals.
 */
@Component
public class SensorReadingGenerator {

    private static final double VARIATION = 0.1;

    private final Supplier<Random> random;

    @Autowired
    public SensorReadingGenerator() {
        this(ThreadLocalRandom::current);
    }

    public SensorReadingGenerator(Supplier<Random> random) {
        this.random = random;
    }

    public SensorReading generate() {
        Random rnd = random.get();
        return SensorReading.builder()
                .temperature(round(uniform(rnd, 20.0, 23.0) + uniform(rnd, -VARIATION, VARIATION)))
                .humidity(round(uniform(rnd, 45.0, 55.0) + uniform(rnd, -VARIATION, VARIATION)))
                .voc(between(rnd, 0, 500))
                .light(between(rnd, 100, 3000))
                .sound(between(rnd, 50, 2000))
                // z carries gravity
                .accelerometer(new AxisReading(
                        round(uniform(rnd, -0.5, 0.5)),
                        round(uniform(rnd, -0.5, 0.5)),
                        round(uniform(rnd, 9.5, 10.0))))
                .gyroscope(new AxisReading(
                        round(uniform(rnd, -0.1, 0.1)),
                        round(uniform(rnd, -0.1, 0.1)),
                        round(uniform(rnd, -0.1, 0.1))))
                .build();
    }

    private static double uniform(Random rnd, double min, double max) {
        return min + (max - min) * rnd.nextDouble();
    }

    private static int between(Random rnd, int min, int maxInclusive) {
        return min + rnd.nextInt(maxInclusive - min + 1);
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
