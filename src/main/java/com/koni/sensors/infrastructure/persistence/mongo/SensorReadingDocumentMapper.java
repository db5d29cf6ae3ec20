package com.koni.sensors.infrastructure.persistence.mongo;

import com.koni.sensors.domain.exception.DocumentValidationException;
import com.koni.sensors.domain.model.AxisReading;
import com.koni.sensors.domain.model.SensorReading;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Date;

/**
 * Maps sensor readings to and from their MongoDB documents.
 *
 * Document layout:
 * <pre>
 * { _id, timestamp (BSON date), temperature, humidity, voc, light, sound,
 *   accelerometer: {x, y, z}, gyroscope: {x, y, z} }
 * </pre>
 */
@Component
public class SensorReadingDocumentMapper {

    static final String ID = "_id";
    static final String TIMESTAMP = MongoConnectionManager.TIMESTAMP_FIELD;
    static final String TEMPERATURE = "temperature";
    static final String HUMIDITY = "humidity";
    static final String VOC = "voc";
    static final String LIGHT = "light";
    static final String SOUND = "sound";
    static final String ACCELEROMETER = "accelerometer";
    static final String GYROSCOPE = "gyroscope";

    /**
     * Builds the document for a reading stored at the given instant.
     * The identifier is left to the store.
     */
    public Document toDocument(SensorReading reading, Instant timestamp) {
        return new Document(TIMESTAMP, Date.from(timestamp))
                .append(TEMPERATURE, reading.getTemperature())
                .append(HUMIDITY, reading.getHumidity())
                .append(VOC, reading.getVoc())
                .append(LIGHT, reading.getLight())
                .append(SOUND, reading.getSound())
                .append(ACCELEROMETER, toDocument(reading.getAccelerometer()))
                .append(GYROSCOPE, toDocument(reading.getGyroscope()));
    }

    /**
     * Reads a stored document back into a reading; the generated {@code _id} becomes the string id.
     *
     * @throws DocumentValidationException if a field is missing or has the wrong type
     */
    public SensorReading fromDocument(Document document) {
        return SensorReading.builder()
                .id(requireId(document))
                .timestamp(requireDate(document, TIMESTAMP))
                .temperature(requireDouble(document, TEMPERATURE))
                .humidity(requireDouble(document, HUMIDITY))
                .voc(requireLong(document, VOC))
                .light(requireInt(document, LIGHT))
                .sound(requireInt(document, SOUND))
                .accelerometer(requireAxis(document, ACCELEROMETER))
                .gyroscope(requireAxis(document, GYROSCOPE))
                .build();
    }

    private Document toDocument(AxisReading axis) {
        return new Document("x", axis.getX())
                .append("y", axis.getY())
                .append("z", axis.getZ());
    }

    private String requireId(Document document) {
        Object id = document.get(ID);
        if (id == null) {
            throw missing(ID);
        }
        return id instanceof ObjectId ? ((ObjectId) id).toHexString() : id.toString();
    }

    private Instant requireDate(Document document, String field) {
        Object value = require(document, field);
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        throw wrongType(field, "date", value);
    }

    private double requireDouble(Document document, String field) {
        Object value = require(document, field);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw wrongType(field, "number", value);
    }

    private long requireLong(Document document, String field) {
        Object value = require(document, field);
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof Double && ((Double) value) % 1 == 0) {
            return ((Double) value).longValue();
        }
        throw wrongType(field, "integer", value);
    }

    private int requireInt(Document document, String field) {
        long value = requireLong(document, field);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new DocumentValidationException("Invalid sensor document: field '" + field + "' is out of range");
        }
        return (int) value;
    }

    private AxisReading requireAxis(Document document, String field) {
        Object value = require(document, field);
        if (!(value instanceof Document)) {
            throw wrongType(field, "object", value);
        }
        Document axis = (Document) value;
        return new AxisReading(
                requireDouble(axis, "x"),
                requireDouble(axis, "y"),
                requireDouble(axis, "z"));
    }

    private Object require(Document document, String field) {
        Object value = document.get(field);
        if (value == null) {
            throw missing(field);
        }
        return value;
    }

    private DocumentValidationException missing(String field) {
        return new DocumentValidationException("Invalid sensor document: field '" + field + "' is missing");
    }

    private DocumentValidationException wrongType(String field, String expected, Object value) {
        return new DocumentValidationException("Invalid sensor document: field '" + field + "' should be "
                + expected + " but was " + value.getClass().getSimpleName());
    }
}
