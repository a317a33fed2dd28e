package me.golemcore.leads.testsupport;

import me.golemcore.leads.domain.model.CandidateProfile;
import me.golemcore.leads.domain.model.ConversationTurn;
import me.golemcore.leads.domain.model.ExtractionConfidence;
import me.golemcore.leads.domain.model.PropertyType;
import me.golemcore.leads.port.outbound.ProfileExtractionPort;

import java.util.List;

/**
 * Canned conversations with the profile a model extractor answers for each.
 */
public final class ScenarioExtractionFixtures {

    public static final String BUDGET_SEEKER = "budget_seeker";
    public static final String BUDGET_MISMATCH = "budget_mismatch";
    public static final String PHONE_VS_BUDGET = "phone_vs_budget";

    private ScenarioExtractionFixtures() {
    }

    public record Scenario(String name, List<ConversationTurn> turns, CandidateProfile modelProfile) {

        public ProfileExtractionPort extractor() {
            return turns -> modelProfile;
        }
    }

    public static Scenario budgetSeeker() {
        return new Scenario(BUDGET_SEEKER,
                List.of(
                        ConversationTurn.user(0, "Busco un departamento en CDMX"),
                        ConversationTurn.agent(1, "¿En qué zona te gustaría?"),
                        ConversationTurn.user(2, "Roma Norte, 2 recámaras"),
                        ConversationTurn.agent(3, "¿Cuál es tu presupuesto?"),
                        ConversationTurn.user(4, "Hasta 3 millones")),
                CandidateProfile.builder()
                        .budget(3_000_000L)
                        .city("CDMX")
                        .area("Roma Norte")
                        .bedrooms(2)
                        .confidence(ExtractionConfidence.HIGH)
                        .build());
    }

    public static Scenario budgetMismatch() {
        return new Scenario(BUDGET_MISMATCH,
                List.of(
                        ConversationTurn.user(0, "Busco depa en Guadalajara"),
                        ConversationTurn.agent(1, "¿Cuál es tu presupuesto?"),
                        ConversationTurn.user(2, "Mi presupuesto es 5 millones pero realmente solo tengo 3")),
                CandidateProfile.builder()
                        .budget(5_000_000L)
                        .city("Guadalajara")
                        .propertyType(PropertyType.APARTMENT)
                        .confidence(ExtractionConfidence.MEDIUM)
                        .build());
    }

    public static Scenario phoneVsBudget() {
        return new Scenario(PHONE_VS_BUDGET,
                List.of(
                        ConversationTurn.user(0, "Busco casa en Monterrey"),
                        ConversationTurn.agent(1, "Cuéntame más sobre lo que buscas"),
                        ConversationTurn.user(2, "presupuesto 3 millones, mi tel es 5512345678")),
                CandidateProfile.builder()
                        .budget(3_000_000L)
                        .city("Monterrey")
                        .phone("5512345678")
                        .propertyType(PropertyType.HOUSE)
                        .confidence(ExtractionConfidence.HIGH)
                        .build());
    }

    public static List<Scenario> all() {
        return List.of(budgetSeeker(), budgetMismatch(), phoneVsBudget());
    }
}
