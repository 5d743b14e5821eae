package com.herzen.obe.engine;

import com.herzen.obe.domain.DomainModels.AssessmentComponent;
import com.herzen.obe.domain.DomainModels.CourseOutcome;
import com.herzen.obe.domain.DomainModels.StudentMark;
import com.herzen.obe.engine.EngineModels.AssessmentScoringInput;
import com.herzen.obe.engine.EngineModels.AttainmentWarning;
import com.herzen.obe.engine.EngineModels.CoAssessmentAttainment;
import com.herzen.obe.engine.EngineModels.ExcludedOutcome;
import com.herzen.obe.exception.IncompleteMappingException;
import com.herzen.obe.exception.InvalidMarkException;
import com.herzen.obe.exception.InvalidMarkException.InvalidMarkRow;
import com.herzen.obe.governance.GovernanceModels.LevelThreshold;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Share of students reaching each outcome's expected proficiency in a single assessment.
 * Outcomes whose components add up to zero max marks get no row; they are reported through
 * {@code excluded} instead.
 */
@Component
public class CoAssessmentScorer {
    private final ThresholdClassifier classifier;

    public CoAssessmentScorer(ThresholdClassifier classifier) {
        this.classifier = classifier;
    }

    public List<CoAssessmentAttainment> score(String scopeKey,
                                              AssessmentScoringInput input,
                                              Map<String, CourseOutcome> outcomes,
                                              List<LevelThreshold> thresholds,
                                              List<ExcludedOutcome> excluded,
                                              List<AttainmentWarning> warnings) {
        String assessmentId = input.assessment().assessmentId();
        requireMapped(scopeKey, assessmentId, input.components(), outcomes);

        Map<String, AssessmentComponent> byNumber = input.components().stream()
                .collect(Collectors.toMap(AssessmentComponent::componentNumber, c -> c, (a, b) -> a));
        Map<String, Map<String, Double>> marksByStudent = validMarks(scopeKey, assessmentId, input.marks(), byNumber);

        SortedSet<String> students = new TreeSet<>(input.enrolledStudents() == null ? Set.of() : input.enrolledStudents());
        students.addAll(marksByStudent.keySet());
        if (students.isEmpty()) {
            warnings.add(new AttainmentWarning(AttainmentWarnings.NO_STUDENTS, scopeKey, assessmentId,
                    "No enrolled students or marks, outcomes score 0%"));
        }

        Map<String, List<AssessmentComponent>> byCo = input.components().stream()
                .collect(Collectors.groupingBy(AssessmentComponent::coId, TreeMap::new, Collectors.toList()));

        List<CoAssessmentAttainment> out = new ArrayList<>();
        for (var entry : byCo.entrySet()) {
            String coId = entry.getKey();
            List<AssessmentComponent> components = entry.getValue();
            double totalMax = components.stream().mapToDouble(AssessmentComponent::maxMarks).sum();
            if (totalMax <= 0.0) {
                warnings.add(new AttainmentWarning(AttainmentWarnings.EMPTY_DENOMINATOR, scopeKey, assessmentId + "/" + coId,
                        "Outcome has zero total max marks in this assessment and is excluded"));
                excluded.add(new ExcludedOutcome(assessmentId, input.assessment().category(), coId));
                continue;
            }

            double proficiency = outcomes.get(coId).expectedProficiency();
            long met = students.stream()
                    .filter(student -> {
                        Map<String, Double> marks = marksByStudent.getOrDefault(student, Map.of());
                        double obtained = components.stream()
                                .mapToDouble(c -> marks.getOrDefault(c.componentNumber(), 0.0))
                                .sum();
                        return obtained * 100.0 + Scores.EPSILON >= proficiency * totalMax;
                    })
                    .count();

            double percentage = students.isEmpty() ? 0.0 : Scores.round(met * 100.0 / students.size());
            out.add(new CoAssessmentAttainment(assessmentId, input.assessment().category(), coId,
                    percentage, classifier.classify(percentage, thresholds)));
        }
        return out;
    }

    private void requireMapped(String scopeKey, String assessmentId,
                               List<AssessmentComponent> components, Map<String, CourseOutcome> outcomes) {
        List<String> unmapped = components.stream()
                .filter(c -> c.coId() == null || c.coId().isBlank() || !outcomes.containsKey(c.coId()))
                .map(AssessmentComponent::componentNumber)
                .sorted()
                .toList();
        if (!unmapped.isEmpty()) {
            throw new IncompleteMappingException(scopeKey, assessmentId, unmapped);
        }
    }

    private Map<String, Map<String, Double>> validMarks(String scopeKey, String assessmentId,
                                                        List<StudentMark> marks,
                                                        Map<String, AssessmentComponent> byNumber) {
        List<InvalidMarkRow> invalid = new ArrayList<>();
        Map<String, Map<String, Double>> byStudent = new TreeMap<>();
        for (StudentMark mark : marks) {
            AssessmentComponent component = byNumber.get(mark.componentNumber());
            String reason = null;
            if (component == null) {
                reason = "unknown component";
            } else if (Double.isNaN(mark.mark()) || mark.mark() < 0.0) {
                reason = "negative";
            } else if (mark.mark() > component.maxMarks()) {
                reason = "exceeds max " + component.maxMarks();
            }

            Map<String, Double> studentMarks = byStudent.computeIfAbsent(mark.studentId(), k -> new TreeMap<>());
            if (reason == null && studentMarks.containsKey(mark.componentNumber())) {
                reason = "duplicate";
            }
            if (reason != null) {
                invalid.add(new InvalidMarkRow(mark.studentId(), mark.componentNumber(), mark.mark(), reason));
                continue;
            }
            studentMarks.put(mark.componentNumber(), mark.mark());
        }
        if (!invalid.isEmpty()) {
            throw new InvalidMarkException(scopeKey, assessmentId, invalid);
        }
        return byStudent;
    }
}
