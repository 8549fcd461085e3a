/**
 * Rule-driven threat detectors.
 *
 * <p>
 * All detectors implement the
 * {@link com.threatsentinel.core.detection.ThreatDetector}
 * interface and are instantiated via
 * {@link com.threatsentinel.core.detection.DetectorFactory}.
 * Built-in detector types:
 * </p>
 * <ul>
 * <li>{@link com.threatsentinel.core.detection.SignatureDetector}: regex
 * signatures over the payload</li>
 * <li>{@link com.threatsentinel.core.detection.RateSpikeDetector}: event rate
 * per key within a sliding window</li>
 * <li>{@link com.threatsentinel.core.detection.ThresholdDetector}: static
 * numeric threshold</li>
 * <li>{@link com.threatsentinel.core.detection.StatisticalOutlierDetector}:
 * moving average ± N × σ</li>
 * <li>{@link com.threatsentinel.core.detection.BlacklistDetector}: source IP
 * in threat intelligence</li>
 * <li>{@link com.threatsentinel.core.detection.LanguageModelDetector}: model
 * verdict, the expensive stage</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a new rule type, implement {@code ThreatDetector} and register
 * the type string in {@code DetectorFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.detection;
