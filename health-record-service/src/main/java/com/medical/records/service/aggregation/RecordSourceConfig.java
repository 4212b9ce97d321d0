package com.medical.records.service.aggregation;

import com.medical.records.model.timeline.RecordKind;
import com.medical.records.repository.ClinicalNoteRepository;
import com.medical.records.repository.FileRecordRepository;
import com.medical.records.repository.PrescriptionRepository;
import com.medical.records.repository.VitalRecordRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RecordSourceConfig {

    @Bean
    public RecordSource vitalRecordSource(VitalRecordRepository repository) {
        return new RepositoryRecordSource(RecordKind.VITAL, repository::findByPatientIdOrderByCreatedAtAscIdAsc);
    }

    @Bean
    public RecordSource clinicalNoteSource(ClinicalNoteRepository repository) {
        return new RepositoryRecordSource(RecordKind.NOTE, repository::findByPatientIdOrderByCreatedAtAscIdAsc);
    }

    @Bean
    public RecordSource fileRecordSource(FileRecordRepository repository) {
        return new RepositoryRecordSource(RecordKind.FILE, repository::findByPatientIdOrderByCreatedAtAscIdAsc);
    }

    @Bean
    public RecordSource prescriptionSource(PrescriptionRepository repository) {
        return new RepositoryRecordSource(RecordKind.PRESCRIPTION, repository::findByPatientIdOrderByCreatedAtAscIdAsc);
    }
}
