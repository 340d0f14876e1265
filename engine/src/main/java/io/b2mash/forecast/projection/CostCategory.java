package io.b2mash.forecast.projection;

/** Cost categories a weekly projection is broken down into. */
public enum CostCategory {
  MARKETING("marketing"),
  STAFFING("staffing"),
  EVENT("event"),
  SETUP("setup"),
  COST_OF_GOODS("cost_of_goods");

  private final String key;

  CostCategory(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }
}
