package io.b2mash.forecast.actuals;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/** Reads actual records from a JSON array resource (fixtures, seeded defaults). */
@Component
public class ActualsFixtureLoader {

  private static final Logger log = LoggerFactory.getLogger(ActualsFixtureLoader.class);

  private final ResourceLoader resourceLoader;
  private final ObjectMapper objectMapper;

  public ActualsFixtureLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
    this.resourceLoader = resourceLoader;
    this.objectMapper = objectMapper;
  }

  /**
   * Loads the records at a location.
   *
   * @param location Spring resource location; blank means no records
   * @return the records in file order
   * @throws IllegalStateException if the resource is missing or cannot be parsed
   */
  public List<ActualRecord> load(String location) {
    if (location == null || location.isBlank()) {
      return List.of();
    }
    Resource resource = resourceLoader.getResource(location);
    if (!resource.exists()) {
      throw new IllegalStateException("Actuals fixture not found: " + location);
    }
    try (InputStream in = resource.getInputStream()) {
      ActualRecord[] records = objectMapper.readValue(in, ActualRecord[].class);
      log.info("Loaded {} actual record(s) from {}", records.length, location);
      return List.copyOf(Arrays.asList(records));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read actuals fixture: " + location, e);
    } catch (RuntimeException e) {
      throw new IllegalStateException("Failed to parse actuals fixture: " + location, e);
    }
  }
}
