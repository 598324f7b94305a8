package io.docutoken.compliance.jurisdiction;

import io.docutoken.compliance.config.ComplianceProperties;
import io.docutoken.compliance.exception.RuleRepositoryNotLoadedException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Repository;
import tools.jackson.databind.ObjectMapper;

/**
 * Loads jurisdiction packs (one JSON file per jurisdiction) from the configured resource pattern,
 * by default classpath:jurisdiction-rules/&#42;.json. Loading happens once, at construction; a
 * missing, unreadable or conflicting pack fails application startup.
 */
@Repository
public class ClasspathJurisdictionRuleRepository implements JurisdictionRuleRepository {

  private static final Logger log =
      LoggerFactory.getLogger(ClasspathJurisdictionRuleRepository.class);

  private final Map<String, JurisdictionRuleSet> ruleSetsByCode;
  private final List<JurisdictionRuleSet> ruleSetsSortedByCode;

  public ClasspathJurisdictionRuleRepository(
      ResourcePatternResolver resourceResolver,
      ObjectMapper objectMapper,
      ComplianceProperties properties) {
    this.ruleSetsByCode = loadPacks(resourceResolver, objectMapper, properties.rulesLocation());
    this.ruleSetsSortedByCode =
        ruleSetsByCode.values().stream()
            .sorted(Comparator.comparing(JurisdictionRuleSet::code))
            .toList();
    log.info(
        "Loaded {} jurisdiction rule sets from {}: {}",
        ruleSetsByCode.size(),
        properties.rulesLocation(),
        ruleSetsByCode.keySet());
  }

  @Override
  public Optional<JurisdictionRuleSet> findByCode(String code) {
    if (code == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(ruleSetsByCode.get(code));
  }

  @Override
  public List<JurisdictionRuleSet> findAll() {
    return ruleSetsSortedByCode;
  }

  private static Map<String, JurisdictionRuleSet> loadPacks(
      ResourcePatternResolver resourceResolver, ObjectMapper objectMapper, String location) {
    Resource[] resources;
    try {
      resources = resourceResolver.getResources(location);
    } catch (IOException e) {
      throw new RuleRepositoryNotLoadedException(
          "Failed to scan for jurisdiction packs at " + location, e);
    }
    if (resources.length == 0) {
      throw new RuleRepositoryNotLoadedException("No jurisdiction packs found at " + location);
    }

    var loaded = new LinkedHashMap<String, JurisdictionRuleSet>();
    for (Resource resource : resources) {
      var ruleSet = readPack(resource, objectMapper);
      var previous = loaded.putIfAbsent(ruleSet.code(), ruleSet);
      if (previous != null) {
        throw new RuleRepositoryNotLoadedException(
            "Duplicate jurisdiction code '"
                + ruleSet.code()
                + "' in pack "
                + resource.getFilename());
      }
      log.debug(
          "Jurisdiction pack {} ({}): {} required fields, {} documentation types",
          ruleSet.code(),
          resource.getFilename(),
          ruleSet.requiredFields().size(),
          ruleSet.documentationTypes().size());
    }
    return Map.copyOf(loaded);
  }

  private static JurisdictionRuleSet readPack(Resource resource, ObjectMapper objectMapper) {
    JurisdictionRulePack pack;
    try (InputStream in = resource.getInputStream()) {
      pack = objectMapper.readValue(in, JurisdictionRulePack.class);
    } catch (Exception e) {
      throw new RuleRepositoryNotLoadedException(
          "Failed to parse jurisdiction pack: " + resource.getFilename(), e);
    }
    if (pack == null || pack.code() == null || pack.code().isBlank()) {
      throw new RuleRepositoryNotLoadedException(
          "Jurisdiction pack " + resource.getFilename() + " does not declare a code");
    }
    return pack.toRuleSet();
  }
}
