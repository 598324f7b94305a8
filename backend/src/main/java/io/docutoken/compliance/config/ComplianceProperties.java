package io.docutoken.compliance.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the compliance engine.
 *
 * @param rulesLocation resource pattern the jurisdiction packs are loaded from at startup
 * @param report settings for the compliance report skeleton
 */
@Validated
@ConfigurationProperties("compliance")
public record ComplianceProperties(
    @DefaultValue("classpath:jurisdiction-rules/*.json") @NotBlank String rulesLocation,
    @DefaultValue @Valid Report report) {

  /**
   * @param defaultTimeRangeDays window used when a caller passes a non-positive time range
   */
  public record Report(@DefaultValue("30") @Positive int defaultTimeRangeDays) {}
}
