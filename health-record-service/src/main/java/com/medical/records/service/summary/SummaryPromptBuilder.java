package com.medical.records.service.summary;

import com.medical.records.config.SummarizerConfig;
import com.medical.records.model.entity.ClinicalNote;
import com.medical.records.model.entity.FileRecord;
import com.medical.records.model.entity.User;
import com.medical.records.model.entity.VitalRecord;
import com.medical.records.model.timeline.RecordKind;
import com.medical.records.model.timeline.Timeline;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Renders a patient's timeline into the document sent to the summarizer.
 * <p>
 * Sections appear in a fixed order (vitals, doctor's notes, uploaded files) and a section with
 * no entries is left out entirely. Each section keeps only its most recent entries, and note
 * text is clipped, so the document stays bounded however long the record grows.
 */
@Component
@RequiredArgsConstructor
public class SummaryPromptBuilder {

    static final String VITALS_HEADER = "Vitals History:";
    static final String NOTES_HEADER = "Doctor's Notes:";
    static final String FILES_HEADER = "Uploaded Files (names):";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private final SummarizerConfig summarizerConfig;

    /**
     * @param doctorNames display names keyed by doctor id; authors missing from the map render as "Unknown"
     */
    public String build(User patient, Timeline timeline, Map<String, String> doctorNames) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Generate a concise health summary for the patient '")
                .append(patient.getName())
                .append("' (Email: ")
                .append(patient.getEmail() != null ? patient.getEmail() : "not provided")
                .append(").\n\n");
        prompt.append("Include current and past health conditions based on the provided data. ")
                .append("Highlight any significant trends or concerns.\n\n");

        appendSection(prompt, VITALS_HEADER,
                timeline.entriesOf(RecordKind.VITAL, VitalRecord.class), this::vitalLine);
        appendSection(prompt, NOTES_HEADER,
                timeline.entriesOf(RecordKind.NOTE, ClinicalNote.class), note -> noteLine(note, doctorNames));
        appendSection(prompt, FILES_HEADER,
                timeline.entriesOf(RecordKind.FILE, FileRecord.class), this::fileLine);

        prompt.append("Based on this, provide a concise summary of the patient's health status, ")
                .append("key health events, and any notable observations. ")
                .append("Focus on clinically relevant information.");
        return prompt.toString();
    }

    private <T> void appendSection(StringBuilder prompt, String header, List<T> entries, Function<T, String> line) {
        if (entries.isEmpty()) {
            return;
        }
        int limit = summarizerConfig.getPrompt().getMaxEntriesPerSection();
        int omitted = Math.max(0, entries.size() - limit);

        prompt.append(header).append('\n');
        if (omitted > 0) {
            prompt.append("- (").append(omitted).append(" earlier entries omitted)\n");
        }
        for (T entry : entries.subList(omitted, entries.size())) {
            prompt.append(line.apply(entry)).append('\n');
        }
        prompt.append('\n');
    }

    private String vitalLine(VitalRecord vital) {
        List<String> values = new ArrayList<>();
        if (vital.getBloodPressure() != null && !vital.getBloodPressure().isBlank()) {
            values.add("BP " + vital.getBloodPressure());
        }
        if (vital.getSugar() != null) {
            values.add("Sugar " + number(vital.getSugar()));
        }
        if (vital.getHeartRate() != null) {
            values.add("HR " + vital.getHeartRate());
        }
        if (vital.getTemperature() != null) {
            values.add("Temp " + number(vital.getTemperature()));
        }
        if (vital.getWeight() != null) {
            values.add("Weight " + number(vital.getWeight()));
        }
        return "- " + date(vital.getCreatedAt()) + ": "
                + (values.isEmpty() ? "no values recorded" : String.join(", ", values));
    }

    private String noteLine(ClinicalNote note, Map<String, String> doctorNames) {
        String doctor = note.getDoctorId() != null ? doctorNames.get(note.getDoctorId()) : null;
        return "- " + date(note.getCreatedAt())
                + " (Dr. " + (doctor != null ? doctor : "Unknown") + "): "
                + clip(note.getContent());
    }

    private String fileLine(FileRecord file) {
        return "- " + file.getFileName() + " (" + date(file.getCreatedAt()) + ")";
    }

    private String clip(String text) {
        if (text == null) {
            return "";
        }
        int max = summarizerConfig.getPrompt().getMaxNoteLength();
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }

    private static String date(LocalDateTime time) {
        return time != null ? DATE.format(time) : "unknown date";
    }

    private static String number(Double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
