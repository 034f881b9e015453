package com.wakelink.message;

/**
 * Показания датчиков окружающей среды. Любое поле может отсутствовать.
 */
public class SensorReadings {

  private static final SensorReadings EMPTY = new SensorReadings(null, null, null, null);

  private final Double temperature;
  private final Double humidity;
  private final Double pressure;
  private final Double gasResistance;

  public SensorReadings(Double temperature, Double humidity, Double pressure, Double gasResistance) {
    this.temperature = temperature;
    this.humidity = humidity;
    this.pressure = pressure;
    this.gasResistance = gasResistance;
  }

  public static SensorReadings empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return temperature == null && humidity == null && pressure == null && gasResistance == null;
  }

  public Double getTemperature() {
    return temperature;
  }

  public Double getHumidity() {
    return humidity;
  }

  public Double getPressure() {
    return pressure;
  }

  public Double getGasResistance() {
    return gasResistance;
  }
}
