package io.docutoken.compliance.requirement;

import static io.docutoken.compliance.testutil.TestJurisdictions.FL;
import static io.docutoken.compliance.testutil.TestJurisdictions.GA;
import static io.docutoken.compliance.testutil.TestJurisdictions.TX;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.docutoken.compliance.exception.JurisdictionNotFoundException;
import io.docutoken.compliance.exception.RuleRepositoryNotLoadedException;
import io.docutoken.compliance.jurisdiction.JurisdictionRuleSet;
import io.docutoken.compliance.jurisdiction.JurisdictionSummary;
import io.docutoken.compliance.testutil.TestJurisdictions;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RequirementMergerTest {

  private RequirementMerger merger;

  @BeforeEach
  void setUp() {
    merger = new RequirementMerger(TestJurisdictions.repository());
  }

  @Test
  void getStateRequirements_dropsUnknownCodesAndKeepsInputOrder() {
    var ruleSets = merger.getStateRequirements(List.of("FL", "XX", "GA"));

    assertThat(ruleSets).extracting(JurisdictionRuleSet::code).containsExactly("FL", "GA");
  }

  @Test
  void getStateRequirements_resolvesRepeatedCodeEachTime() {
    assertThat(merger.getStateRequirements(List.of("GA", "GA"))).hasSize(2);
  }

  @Test
  void getStateRequirements_ignoresNullCodes() {
    assertThat(merger.getStateRequirements(Arrays.asList("GA", null)))
        .extracting(JurisdictionRuleSet::code)
        .containsExactly("GA");
  }

  @Test
  void mergedCategoriesAreExactUnions() {
    var merged = merger.getMergedRequirements(List.of("GA", "FL"));

    assertThat(merged.allRequiredFields())
        .containsExactlyInAnyOrder(
            "patient_demographics", "care_plan", "physician_orders", "emergency_contacts");
    assertThat(merged.allDocumentationTypes())
        .containsExactlyInAnyOrder("visit_note", "care_plan", "incident_report");
    assertThat(merged.allVisitFrequencies()).containsExactlyInAnyOrder("Daily", "Weekly", "Monthly");
    assertThat(merged.allSignatureRequirements()).containsExactlyInAnyOrder("nurse", "supervisor");
    assertThat(merged.allSpecialRequirements())
        .containsExactlyInAnyOrder("90-day service plan review", "AHCA background screening");
  }

  @Test
  void mergeIsIndependentOfInputOrder() {
    assertThat(merger.getMergedRequirements(List.of("GA", "FL", "TX")))
        .isEqualTo(merger.getMergedRequirements(List.of("TX", "GA", "FL")));
  }

  @Test
  void mergeIsIdempotent() {
    var codes = List.of("GA", "TX");

    assertThat(merger.getMergedRequirements(codes)).isEqualTo(merger.getMergedRequirements(codes));
  }

  @Test
  void addingJurisdictionNeverRemovesRequirements() {
    var before = merger.getMergedRequirements(List.of("GA"));
    var after = merger.getMergedRequirements(List.of("GA", "TX"));

    assertThat(after.allRequiredFields()).containsAll(before.allRequiredFields());
    assertThat(after.allDocumentationTypes()).containsAll(before.allDocumentationTypes());
    assertThat(after.allVisitFrequencies()).containsAll(before.allVisitFrequencies());
    assertThat(after.allSignatureRequirements()).containsAll(before.allSignatureRequirements());
    assertThat(after.allSpecialRequirements()).containsAll(before.allSpecialRequirements());
  }

  @Test
  void everyContributingJurisdictionIsCovered() {
    var merged = merger.getMergedRequirements(List.of("GA", "FL", "TX"));

    for (var ruleSet : List.of(GA, FL, TX)) {
      assertThat(merged.allRequiredFields()).containsAll(ruleSet.requiredFields());
      assertThat(merged.allSignatureRequirements()).containsAll(ruleSet.signatureRequirements());
    }
  }

  @Test
  void emptyInputYieldsEmptyRequirements() {
    assertThat(merger.getMergedRequirements(List.of())).isEqualTo(MergedRequirements.empty());
    assertThat(merger.getMergedRequirements(null).isEmpty()).isTrue();
  }

  @Test
  void fullyUnresolvableInputYieldsEmptyRequirements() {
    var merged = merger.getMergedRequirements(List.of("XX", "YY"));

    assertThat(merged.isEmpty()).isTrue();
    assertThat(merged.allRequiredFields()).isEmpty();
    assertThat(merged.allSignatureRequirements()).isEmpty();
  }

  @Test
  void mergedRequirementsAreUnmodifiable() {
    var merged = merger.getMergedRequirements(List.of("GA"));

    assertThatThrownBy(() -> merged.allRequiredFields().add("extra"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void getSupportedJurisdictions_listsCodesAndNames() {
    assertThat(merger.getSupportedJurisdictions())
        .containsExactly(
            new JurisdictionSummary("FL", "Florida"),
            new JurisdictionSummary("GA", "Georgia"),
            new JurisdictionSummary("TX", "Texas"));
  }

  @Test
  void getJurisdiction_throwsForUnknownCode() {
    assertThat(merger.getJurisdiction("GA")).isEqualTo(GA);
    assertThatThrownBy(() -> merger.getJurisdiction("XX"))
        .isInstanceOfSatisfying(
            JurisdictionNotFoundException.class,
            ex -> {
              assertThat(ex.getJurisdictionCode()).isEqualTo("XX");
              assertThat(ex.getStatusCode().value()).isEqualTo(404);
              assertThat(ex.getBody().getDetail()).contains("'XX'");
            });
  }

  @Test
  void emptyRepositoryIsAStartupFault() {
    assertThatThrownBy(() -> new RequirementMerger(TestJurisdictions.emptyRepository()))
        .isInstanceOf(RuleRepositoryNotLoadedException.class);
  }
}
