package com.medical.records.service.impl;

import com.medical.records.config.SummarizerConfig;
import com.medical.records.exception.NotFoundException;
import com.medical.records.model.entity.ClinicalNote;
import com.medical.records.model.entity.User;
import com.medical.records.model.timeline.RecordKind;
import com.medical.records.model.timeline.Timeline;
import com.medical.records.repository.UserRepository;
import com.medical.records.security.Actor;
import com.medical.records.security.AuthorizationGuard;
import com.medical.records.security.Operation;
import com.medical.records.service.HealthSummaryService;
import com.medical.records.service.aggregation.RecordAggregator;
import com.medical.records.service.summary.Summarizer;
import com.medical.records.service.summary.SummaryPromptBuilder;
import com.medical.records.service.summary.SummaryRequest;
import com.medical.records.service.summary.SummaryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class HealthSummaryServiceImpl implements HealthSummaryService {

    private final AuthorizationGuard authorizationGuard;
    private final RecordAggregator recordAggregator;
    private final SummaryPromptBuilder summaryPromptBuilder;
    private final Summarizer summarizer;
    private final SummarizerConfig summarizerConfig;
    private final UserRepository userRepository;

    @Override
    public SummaryResult summarize(Actor actor, String patientId) {
        authorizationGuard.require(actor, patientId, Operation.SUMMARY_GENERATE);

        User patient = userRepository.findByUserId(patientId)
                .orElseThrow(() -> new NotFoundException("PATIENT_NOT_FOUND"));

        Timeline timeline = recordAggregator.aggregate(patientId);
        String document = summaryPromptBuilder.build(patient, timeline, noteAuthorNames(timeline));

        log.info("[Summary] doctor {} requested summary for patient {}, {} timeline entries, document length {}",
                actor.getId(), patientId, timeline.size(), document.length());

        SummaryResult result = summarizer.summarize(new SummaryRequest(
                document, summarizerConfig.getMaxTokens(), summarizerConfig.getTemperature()));

        if (result.isSuccess()) {
            log.info("[Summary] summary for patient {} generated, length {}", patientId, result.getSummaryText().length());
        } else {
            log.warn("[Summary] summary for patient {} unavailable: {} {}",
                    patientId, result.getFailureReason(), result.getDetail());
        }
        return result;
    }

    private Map<String, String> noteAuthorNames(Timeline timeline) {
        Set<String> doctorIds = timeline.entriesOf(RecordKind.NOTE, ClinicalNote.class).stream()
                .map(ClinicalNote::getDoctorId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        if (doctorIds.isEmpty()) {
            return Collections.emptyMap();
        }
        return userRepository.findByUserIdIn(doctorIds).stream()
                .filter(user -> user.getName() != null)
                .collect(Collectors.toMap(User::getUserId, User::getName, (a, b) -> a));
    }
}
