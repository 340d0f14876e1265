package io.b2mash.forecast.projection;

/** Revenue streams a forecast is broken down into. */
public enum RevenueStream {
  TICKET("ticket"),
  FOOD_AND_BEVERAGE("food_and_beverage"),
  MERCHANDISE("merchandise"),
  DIGITAL("digital");

  private final String key;

  RevenueStream(String key) {
    this.key = key;
  }

  /** Stable lowercase key used in metric names such as {@code revenue.ticket}. */
  public String key() {
    return key;
  }
}
