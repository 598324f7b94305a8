package io.docutoken.compliance.config;

import io.docutoken.compliance.report.ComplianceStatistics;
import io.docutoken.compliance.report.ComplianceStatisticsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ComplianceProperties.class)
public class ComplianceEngineConfig {

  private static final Logger log = LoggerFactory.getLogger(ComplianceEngineConfig.class);

  /**
   * Fallback used until an aggregation collaborator is wired in. Reports built against it carry an
   * all-zero summary and no issues.
   */
  @Bean
  @ConditionalOnMissingBean(ComplianceStatisticsProvider.class)
  ComplianceStatisticsProvider emptyComplianceStatisticsProvider() {
    log.info("No ComplianceStatisticsProvider configured, compliance reports will carry empty counts");
    return (agencyId, jurisdictionCodes, window) -> ComplianceStatistics.empty();
  }
}
