package me.golemcore.leads.domain.service;

import me.golemcore.leads.domain.model.CandidateProfile;
import me.golemcore.leads.domain.model.Discrepancy;
import me.golemcore.leads.domain.model.DiscrepancySeverity;
import me.golemcore.leads.domain.model.PropertyType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProfileCrossValidatorTest {

    private ProfileCrossValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ProfileCrossValidator();
    }

    @Test
    void shouldReportNothingWhenProfilesAgree() {
        CandidateProfile profile = CandidateProfile.builder()
                .budget(3_000_000L)
                .city("CDMX")
                .area("Roma Norte")
                .bedrooms(2)
                .build();

        assertTrue(validator.compare(profile, profile.toBuilder().build()).isEmpty());
    }

    @Test
    void shouldIgnoreFieldsKnownToOnePathOnly() {
        CandidateProfile model = CandidateProfile.builder().budget(5_000_000L).phone("5512345678").build();
        CandidateProfile heuristic = CandidateProfile.builder().city("Monterrey").build();

        assertTrue(validator.compare(model, heuristic).isEmpty());
    }

    @Test
    void shouldFlagLargeBudgetGapAsHighSeverity() {
        CandidateProfile model = CandidateProfile.builder().budget(5_000_000L).build();
        CandidateProfile heuristic = CandidateProfile.builder().budget(3_000_000L).build();

        List<Discrepancy> discrepancies = validator.compare(model, heuristic);

        assertEquals(1, discrepancies.size());
        Discrepancy budget = discrepancies.get(0);
        assertEquals("budget", budget.getField());
        assertEquals(5_000_000L, budget.getModelValue());
        assertEquals(3_000_000L, budget.getHeuristicValue());
        assertEquals(40.0, budget.getDiffPct());
        assertEquals(DiscrepancySeverity.HIGH, budget.getSeverity());
    }

    @Test
    void shouldKeepThirtyPercentGapAtMediumSeverity() {
        CandidateProfile model = CandidateProfile.builder().budget(1_000_000L).build();
        CandidateProfile heuristic = CandidateProfile.builder().budget(700_000L).build();

        Discrepancy budget = validator.compare(model, heuristic).get(0);

        assertEquals(30.0, budget.getDiffPct());
        assertEquals(DiscrepancySeverity.MEDIUM, budget.getSeverity());
    }

    @Test
    void shouldFlagJustAboveThirtyPercentAsHighSeverity() {
        CandidateProfile model = CandidateProfile.builder().budget(1_000_000L).build();
        CandidateProfile heuristic = CandidateProfile.builder().budget(690_000L).build();

        Discrepancy budget = validator.compare(model, heuristic).get(0);

        assertEquals(31.0, budget.getDiffPct());
        assertEquals(DiscrepancySeverity.HIGH, budget.getSeverity());
    }

    @Test
    void shouldCompareRoomCountsAsNumbers() {
        CandidateProfile model = CandidateProfile.builder().bedrooms(3).bathrooms(2).build();
        CandidateProfile heuristic = CandidateProfile.builder().bedrooms(2).bathrooms(2).build();

        List<Discrepancy> discrepancies = validator.compare(model, heuristic);

        assertEquals(1, discrepancies.size());
        assertEquals("bedrooms", discrepancies.get(0).getField());
        assertEquals(33.3, discrepancies.get(0).getDiffPct());
        assertTrue(discrepancies.get(0).isHighSeverity());
    }

    @Test
    void shouldCompareCategoricalFieldsIgnoringCase() {
        CandidateProfile model = CandidateProfile.builder().city("cdmx").area("Condesa").build();
        CandidateProfile heuristic = CandidateProfile.builder().city("CDMX").area("Roma Norte").build();

        List<Discrepancy> discrepancies = validator.compare(model, heuristic);

        assertEquals(1, discrepancies.size());
        Discrepancy area = discrepancies.get(0);
        assertEquals("area", area.getField());
        assertNull(area.getDiffPct());
        assertEquals(DiscrepancySeverity.MEDIUM, area.getSeverity());
    }

    @Test
    void shouldListNumericFieldsBeforeCategoricalFields() {
        CandidateProfile model = CandidateProfile.builder()
                .budget(5_000_000L)
                .propertyType(PropertyType.HOUSE)
                .city("Guadalajara")
                .bathrooms(3)
                .build();
        CandidateProfile heuristic = CandidateProfile.builder()
                .budget(3_000_000L)
                .propertyType(PropertyType.APARTMENT)
                .city("Monterrey")
                .bathrooms(2)
                .build();

        List<String> fields = validator.compare(model, heuristic).stream()
                .map(Discrepancy::getField)
                .toList();

        assertEquals(List.of("budget", "bathrooms", "city", "property_type"), fields);
    }

    @Test
    void shouldRoundDiffPctToOneDecimal() {
        assertEquals(33.3, ProfileCrossValidator.diffPct(3, 2));
        assertEquals(40.0, ProfileCrossValidator.diffPct(3_000_000, 5_000_000));
        assertEquals(0.0, ProfileCrossValidator.diffPct(7, 7));
    }
}
