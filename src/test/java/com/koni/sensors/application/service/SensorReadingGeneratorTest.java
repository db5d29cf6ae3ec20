package com.koni.sensors.application.service;

import com.koni.sensors.domain.model.SensorReading;
import com.koni.sensors.tags.UnitTest;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

@UnitTest
class SensorReadingGeneratorTest {

    private final SensorReadingGenerator generator = new SensorReadingGenerator();

    @RepeatedTest(50)
    void shouldGenerateReadingsWithinIndoorRanges() {
        SensorReading reading = generator.generate();

        reading.validate();
        assertThat(reading.getTemperature()).isBetween(19.9, 23.1);
        assertThat(reading.getHumidity()).isBetween(44.9, 55.1);
        assertThat(reading.getVoc()).isBetween(0L, 500L);
        assertThat(reading.getLight()).isBetween(100, 3000);
        assertThat(reading.getSound()).isBetween(50, 2000);
        assertThat(reading.getAccelerometer().getZ()).isBetween(9.5, 10.0);
        assertThat(reading.getGyroscope().getX()).isBetween(-0.1, 0.1);
        assertThat(reading.getId()).isNull();
        assertThat(reading.getTimestamp()).isNull();
    }

    @Test
    void shouldRoundToTwoDecimals() {
        SensorReading reading = generator.generate();

        assertThat(BigDecimal.valueOf(reading.getTemperature()).scale()).isLessThanOrEqualTo(2);
        assertThat(BigDecimal.valueOf(reading.getHumidity()).scale()).isLessThanOrEqualTo(2);
        assertThat(BigDecimal.valueOf(reading.getAccelerometer().getX()).scale()).isLessThanOrEqualTo(2);
    }

    @Test
    void shouldBeReproducibleWithSeededRandom() {
        Random first = new Random(99);
        Random second = new Random(99);

        SensorReading a = new SensorReadingGenerator(() -> first).generate();
        SensorReading b = new SensorReadingGenerator(() -> second).generate();

        assertThat(a).isEqualTo(b);
    }
}
