package org.ecoacoustics.refine.event;

import org.ecoacoustics.refine.utils.Constants;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;
import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Ordering;

/**
 * Number of times one species was detected in one 10 second chunk of one recording. This is the unit of the
 * detection events table every downstream analysis reads.
 */
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE,
  isGetterVisibility = JsonAutoDetect.Visibility.NONE,
  fieldVisibility = JsonAutoDetect.Visibility.NONE)
@JsonPropertyOrder({"site_id", "date", "start_time", "split_index", "time_of_day", "restoration_type", "hour_of_day",
  "species_code", "detection_count"})
public final class DetectionEvent {

  /**
   * Output row order: recording identity first, species last.
   */
  public static final Comparator<DetectionEvent> ORDER = new Comparator<DetectionEvent>() {
    @Override
    public int compare(DetectionEvent a, DetectionEvent b) {
      return ComparisonChain.start()
        .compare(a.siteId, b.siteId)
        .compare(a.date, b.date)
        .compare(a.startTime, b.startTime)
        .compare(a.splitIndex, b.splitIndex)
        .compare(a.timeOfDay, b.timeOfDay)
        .compare(a.restorationType, b.restorationType, Ordering.<String>natural().nullsFirst())
        .compare(a.speciesCode, b.speciesCode)
        .result();
    }
  };

  private final String siteId;
  private final LocalDate date;
  private final String startTime;
  private final String splitIndex;
  private final TimeOfDay timeOfDay;
  private final HourOfDay hourOfDay;
  private final String restorationType;
  private final String speciesCode;
  private final int detectionCount;

  public DetectionEvent(String siteId, LocalDate date, String startTime, String splitIndex, TimeOfDay timeOfDay,
    @Nullable HourOfDay hourOfDay, @Nullable String restorationType, String speciesCode, int detectionCount) {
    if (detectionCount < 0) {
      throw new IllegalArgumentException("Negative detection count " + detectionCount + " for " + speciesCode);
    }
    this.siteId = Objects.requireNonNull(siteId, "siteId");
    this.date = Objects.requireNonNull(date, "date");
    this.startTime = Objects.requireNonNull(startTime, "startTime");
    this.splitIndex = Objects.requireNonNull(splitIndex, "splitIndex");
    this.timeOfDay = Objects.requireNonNull(timeOfDay, "timeOfDay");
    this.hourOfDay = hourOfDay;
    this.restorationType = restorationType;
    this.speciesCode = Objects.requireNonNull(speciesCode, "speciesCode");
    this.detectionCount = detectionCount;
  }

  /**
   * @return copy of this event with the hour of day bucket set
   */
  public DetectionEvent withHourOfDay(@Nullable HourOfDay bucket) {
    return new DetectionEvent(siteId, date, startTime, splitIndex, timeOfDay, bucket, restorationType, speciesCode,
      detectionCount);
  }

  /**
   * @return copy of this event with the start time replaced
   */
  public DetectionEvent withStartTime(String time) {
    return new DetectionEvent(siteId, date, time, splitIndex, timeOfDay, hourOfDay, restorationType, speciesCode,
      detectionCount);
  }

  @JsonProperty("site_id")
  public String getSiteId() {
    return siteId;
  }

  public LocalDate getDate() {
    return date;
  }

  @JsonProperty("date")
  public String getIsoDate() {
    return date.format(Constants.ISO_DF);
  }

  @JsonProperty("start_time")
  public String getStartTime() {
    return startTime;
  }

  @JsonProperty("split_index")
  public String getSplitIndex() {
    return splitIndex;
  }

  public TimeOfDay getTimeOfDay() {
    return timeOfDay;
  }

  @JsonProperty("time_of_day")
  public String getTimeOfDayLabel() {
    return timeOfDay.getLabel();
  }

  @Nullable
  public HourOfDay getHourOfDay() {
    return hourOfDay;
  }

  @Nullable
  @JsonProperty("hour_of_day")
  public String getHourOfDayLabel() {
    return hourOfDay == null ? null : hourOfDay.getLabel();
  }

  @Nullable
  @JsonProperty("restoration_type")
  public String getRestorationType() {
    return restorationType;
  }

  @JsonProperty("species_code")
  public String getSpeciesCode() {
    return speciesCode;
  }

  @JsonProperty("detection_count")
  public int getDetectionCount() {
    return detectionCount;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DetectionEvent)) {
      return false;
    }
    DetectionEvent that = (DetectionEvent) o;
    return detectionCount == that.detectionCount && siteId.equals(that.siteId) && date.equals(that.date)
           && startTime.equals(that.startTime) && splitIndex.equals(that.splitIndex) && timeOfDay == that.timeOfDay
           && hourOfDay == that.hourOfDay && Objects.equals(restorationType, that.restorationType)
           && speciesCode.equals(that.speciesCode);
  }

  @Override
  public int hashCode() {
    return Objects.hash(siteId, date, startTime, splitIndex, timeOfDay, hourOfDay, restorationType, speciesCode,
      detectionCount);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
      .add("siteId", siteId)
      .add("date", date)
      .add("startTime", startTime)
      .add("splitIndex", splitIndex)
      .add("timeOfDay", timeOfDay)
      .add("hourOfDay", hourOfDay)
      .add("restorationType", restorationType)
      .add("speciesCode", speciesCode)
      .add("detectionCount", detectionCount)
      .toString();
  }
}
