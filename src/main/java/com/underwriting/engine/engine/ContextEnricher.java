package com.underwriting.engine.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.Period;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Adds computed fields to a case context before rule evaluation.
 * <ul>
 *   <li>{@code applicant.age} from {@code applicant.dateOfBirth}</li>
 *   <li>{@code applicant.bmi} from {@code applicant.heightCm} and {@code applicant.weightKg}</li>
 *   <li>{@code riskFactorSummary.elevatedCount}, the number of high or moderate risk factors</li>
 * </ul>
 * Fields already present are left alone. The input is never modified; the
 * enriched context is a deep copy. {@code riskFactors} stays a plain list and
 * the derived count lives in its own record next to it.
 */
@ApplicationScoped
public class ContextEnricher {

    private static final Logger LOG = Logger.getLogger(ContextEnricher.class);

    public static final String RISK_FACTOR_SUMMARY = "riskFactorSummary";
    public static final String ELEVATED_COUNT = "elevatedCount";

    Clock clock = Clock.systemDefaultZone();

    public JsonNode enrich(JsonNode context) {
        if (context == null || !context.isObject()) {
            return context;
        }
        ObjectNode enriched = ((ObjectNode) context).deepCopy();

        JsonNode applicantNode = enriched.get("applicant");
        if (applicantNode instanceof ObjectNode applicant) {
            if (!FieldPathResolver.isDefined(applicant.get("age"))) {
                calculateAge(applicant.get("dateOfBirth")).ifPresent(age -> applicant.put("age", age));
            }
            if (!FieldPathResolver.isDefined(applicant.get("bmi"))) {
                calculateBmi(applicant.get("heightCm"), applicant.get("weightKg"))
                        .ifPresent(bmi -> applicant.put("bmi", bmi));
            }
        }

        JsonNode riskFactors = enriched.get("riskFactors");
        if (riskFactors != null && riskFactors.isArray() && !enriched.has(RISK_FACTOR_SUMMARY)) {
            int elevated = 0;
            for (JsonNode factor : riskFactors) {
                if (isElevated(factor.path("severity"))) {
                    elevated++;
                }
            }
            enriched.putObject(RISK_FACTOR_SUMMARY).put(ELEVATED_COUNT, elevated);
        }

        return enriched;
    }

    /**
     * Whole years between birth and today, one less when this year's birthday
     * has not been reached yet.
     */
    Optional<Integer> calculateAge(JsonNode dateOfBirth) {
        if (dateOfBirth == null || !dateOfBirth.isTextual() || dateOfBirth.textValue().isBlank()) {
            return Optional.empty();
        }
        String text = dateOfBirth.textValue().trim();
        LocalDate birth;
        try {
            birth = parseBirthDate(text);
        } catch (DateTimeParseException e) {
            LOG.debugf("Ignoring unparseable dateOfBirth '%s': %s", text, e.getMessage());
            return Optional.empty();
        }
        return Optional.of(Period.between(birth, LocalDate.now(clock)).getYears());
    }

    private static LocalDate parseBirthDate(String text) {
        if (text.length() <= 10) {
            return LocalDate.parse(text);
        }
        try {
            return OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC).toLocalDate();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(text).toLocalDate();
        }
    }

    /**
     * Weight over height in metres squared, rounded to one decimal.
     */
    static Optional<Double> calculateBmi(JsonNode heightCm, JsonNode weightKg) {
        if (heightCm == null || weightKg == null) {
            return Optional.empty();
        }
        double height = ValueComparator.toNumber(heightCm);
        double weight = ValueComparator.toNumber(weightKg);
        if (!(height > 0) || !(weight > 0)) {
            return Optional.empty();
        }
        double heightM = height / 100;
        return Optional.of(Math.round(weight / (heightM * heightM) * 10) / 10.0);
    }

    private static boolean isElevated(JsonNode severity) {
        if (!severity.isTextual()) {
            return false;
        }
        String value = severity.textValue().toLowerCase(Locale.ROOT);
        return "high".equals(value) || "moderate".equals(value);
    }
}
