package com.gnovoa.publeague.rosters;

import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scheduler")
public record SchedulerProperties(
    List<String> fields,
    LocalTime startTime,
    int matchDurationMinutes,
    int maxRetryAttempts,
    Rosters rosters) {
  public SchedulerProperties {
    if (fields == null || fields.isEmpty()) fields = List.of("North", "South");
    if (startTime == null) startTime = LocalTime.of(8, 20);
    if (matchDurationMinutes <= 0) matchDurationMinutes = 70;
    if (maxRetryAttempts <= 0) maxRetryAttempts = 6;
    if (rosters == null) rosters = new Rosters(".", null);
  }

  /** Division id to roster file name, resolved against {@code baseDir}. */
  public record Rosters(String baseDir, Map<String, String> files) {
    public Rosters {
      if (files == null) files = new LinkedHashMap<>();
    }
  }

  public static SchedulerProperties defaults() {
    return new SchedulerProperties(null, null, 0, 0, null);
  }
}
