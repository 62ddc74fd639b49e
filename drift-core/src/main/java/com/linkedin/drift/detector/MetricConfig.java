/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.detector;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.kafka.common.config.ConfigException;

import static com.linkedin.drift.common.utils.Utils.isFinite;
import static com.linkedin.drift.common.utils.Utils.validateNotNull;


/**
 * Immutable detection config of a single metric: the algorithm, its parameters, whether the metric is enabled, and
 * a free-form description.
 *
 * <p>Parameters of both algorithms are always present and validated, so that switching the algorithm of a metric
 * never yields an invalid config. Use {@link Builder} to create a new config or to derive one from an existing
 * config.
 */
public final class MetricConfig {
  public static final String ALGORITHM = "algorithm";
  public static final String THRESHOLD = "threshold";
  public static final String DRIFT = "drift";
  public static final String REFERENCE_MEAN = "reference.mean";
  public static final String ALPHA = "alpha";
  public static final String THRESHOLD_SIGMA = "threshold.sigma";
  public static final String ENABLED = "enabled";
  public static final String DESCRIPTION = "description";

  public static final DetectionAlgorithm DEFAULT_ALGORITHM = DetectionAlgorithm.CUMULATIVE;
  public static final double DEFAULT_THRESHOLD = 5.0;
  public static final double DEFAULT_DRIFT = 0.5;
  public static final double DEFAULT_ALPHA = 0.3;
  public static final double DEFAULT_THRESHOLD_SIGMA = 3.0;

  private final DetectionAlgorithm _algorithm;
  private final double _threshold;
  private final double _drift;
  private final Double _referenceMean;
  private final double _alpha;
  private final double _thresholdSigma;
  private final boolean _enabled;
  private final String _description;

  private MetricConfig(Builder builder) {
    _algorithm = validateNotNull(builder._algorithm, "Detection algorithm cannot be null.");
    _threshold = builder._threshold;
    _drift = builder._drift;
    _referenceMean = builder._referenceMean;
    _alpha = builder._alpha;
    _thresholdSigma = builder._thresholdSigma;
    _enabled = builder._enabled;
    _description = builder._description == null ? "" : builder._description;
    validate();
  }

  private void validate() {
    if (!isFinite(_threshold) || _threshold <= 0) {
      throw new ConfigException(THRESHOLD, _threshold, "Threshold must be a finite number greater than 0.");
    }
    if (!isFinite(_drift) || _drift < 0) {
      throw new ConfigException(DRIFT, _drift, "Drift must be a finite non-negative number.");
    }
    if (_referenceMean != null && !isFinite(_referenceMean)) {
      throw new ConfigException(REFERENCE_MEAN, _referenceMean, "Reference mean must be a finite number if set.");
    }
    if (!isFinite(_alpha) || _alpha <= 0 || _alpha > 1) {
      throw new ConfigException(ALPHA, _alpha, "Alpha must be in (0, 1].");
    }
    if (!isFinite(_thresholdSigma) || _thresholdSigma <= 0) {
      throw new ConfigException(THRESHOLD_SIGMA, _thresholdSigma, "Threshold sigma must be a finite number greater than 0.");
    }
  }

  public DetectionAlgorithm algorithm() {
    return _algorithm;
  }

  public double threshold() {
    return _threshold;
  }

  public double drift() {
    return _drift;
  }

  /**
   * @return The configured baseline of {@link DetectionAlgorithm#CUMULATIVE}, or {@code null} to learn the baseline
   * from the first observed sample.
   */
  public Double referenceMean() {
    return _referenceMean;
  }

  public double alpha() {
    return _alpha;
  }

  public double thresholdSigma() {
    return _thresholdSigma;
  }

  public boolean enabled() {
    return _enabled;
  }

  public String description() {
    return _description;
  }

  /**
   * @return The score above which a sample is anomalous under the configured algorithm.
   */
  public double alertThreshold() {
    return _algorithm == DetectionAlgorithm.CUMULATIVE ? _threshold : _thresholdSigma;
  }

  /**
   * @return The detector implementing the configured algorithm.
   */
  public MetricDetector detector() {
    return _algorithm.detector();
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> structure = new LinkedHashMap<>();
    structure.put(ALGORITHM, _algorithm.name());
    if (_algorithm == DetectionAlgorithm.CUMULATIVE) {
      structure.put(THRESHOLD, _threshold);
      structure.put(DRIFT, _drift);
      if (_referenceMean != null) {
        structure.put(REFERENCE_MEAN, _referenceMean);
      }
    } else {
      structure.put(ALPHA, _alpha);
      structure.put(THRESHOLD_SIGMA, _thresholdSigma);
    }
    structure.put(ENABLED, _enabled);
    structure.put(DESCRIPTION, _description);
    return structure;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    MetricConfig that = (MetricConfig) o;
    return Double.compare(that._threshold, _threshold) == 0
           && Double.compare(that._drift, _drift) == 0
           && Double.compare(that._alpha, _alpha) == 0
           && Double.compare(that._thresholdSigma, _thresholdSigma) == 0
           && _enabled == that._enabled
           && _algorithm == that._algorithm
           && Objects.equals(_referenceMean, that._referenceMean)
           && _description.equals(that._description);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_algorithm, _threshold, _drift, _referenceMean, _alpha, _thresholdSigma, _enabled, _description);
  }

  @Override
  public String toString() {
    return getJsonStructure().toString();
  }

  /**
   * A builder for {@link MetricConfig}. A builder created from an existing config starts with its parameters, so
   * that only the explicitly set parameters change.
   */
  public static class Builder {
    private DetectionAlgorithm _algorithm;
    private double _threshold;
    private double _drift;
    private Double _referenceMean;
    private double _alpha;
    private double _thresholdSigma;
    private boolean _enabled;
    private String _description;

    public Builder() {
      _algorithm = DEFAULT_ALGORITHM;
      _threshold = DEFAULT_THRESHOLD;
      _drift = DEFAULT_DRIFT;
      _referenceMean = null;
      _alpha = DEFAULT_ALPHA;
      _thresholdSigma = DEFAULT_THRESHOLD_SIGMA;
      _enabled = true;
      _description = "";
    }

    public Builder(MetricConfig base) {
      validateNotNull(base, "Base metric config cannot be null.");
      _algorithm = base._algorithm;
      _threshold = base._threshold;
      _drift = base._drift;
      _referenceMean = base._referenceMean;
      _alpha = base._alpha;
      _thresholdSigma = base._thresholdSigma;
      _enabled = base._enabled;
      _description = base._description;
    }

    public Builder algorithm(DetectionAlgorithm algorithm) {
      _algorithm = algorithm;
      return this;
    }

    /**
     * @param algorithmName Case insensitive name or alias of the algorithm.
     * @return This builder.
     */
    public Builder algorithm(String algorithmName) {
      _algorithm = DetectionAlgorithm.forName(algorithmName);
      return this;
    }

    public Builder threshold(double threshold) {
      _threshold = threshold;
      return this;
    }

    public Builder drift(double drift) {
      _drift = drift;
      return this;
    }

    /**
     * @param referenceMean Baseline of the cumulative sum, or {@code null} to learn it from the first sample.
     * @return This builder.
     */
    public Builder referenceMean(Double referenceMean) {
      _referenceMean = referenceMean;
      return this;
    }

    public Builder alpha(double alpha) {
      _alpha = alpha;
      return this;
    }

    public Builder thresholdSigma(double thresholdSigma) {
      _thresholdSigma = thresholdSigma;
      return this;
    }

    public Builder enabled(boolean enabled) {
      _enabled = enabled;
      return this;
    }

    public Builder description(String description) {
      _description = description;
      return this;
    }

    /**
     * @return A validated metric config.
     */
    public MetricConfig build() {
      return new MetricConfig(this);
    }
  }
}
