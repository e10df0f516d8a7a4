package com.securehealth.application;

import com.securehealth.domain.model.FieldValue;
import com.securehealth.domain.model.Patient;
import com.securehealth.domain.repository.PatientRepository;
import com.securehealth.domain.schema.PatientSchema;
import com.securehealth.infrastructure.audit.AuditEventKind;
import com.securehealth.infrastructure.audit.AuditService;
import com.securehealth.infrastructure.security.CallerContext;
import com.securehealth.infrastructure.security.ProjectedView;
import com.securehealth.infrastructure.security.RoleProjection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Application service for patient records.
 *
 * <p>Orchestrates:
 * <ul>
 *   <li>Encrypted persistence through {@link PatientRepository}</li>
 *   <li>Role-scoped views for the current caller</li>
 *   <li>Audit of every view served</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatientRecordService {

    private static final String ACTOR_PREFIX = "user:";

    private final PatientRepository patientRepository;
    private final PatientSchema patientSchema;
    private final RoleProjection roleProjection;
    private final CallerContextProvider callerContextProvider;
    private final AuditService auditService;

    /**
     * Saves a patient, stamping creation and update times.
     *
     * @throws com.securehealth.infrastructure.crypto.CryptoException if any field cannot be encrypted
     */
    public Patient save(Patient patient) {
        Instant now = Instant.now();
        Patient stamped = patient.toBuilder()
            .createdAt(patient.getCreatedAt() == null ? now : patient.getCreatedAt())
            .updatedAt(now)
            .build();
        Patient saved = patientRepository.save(stamped);
        log.info("Saved patient {}", saved.getId());
        return saved;
    }

    /**
     * Appends a clinical note on behalf of the current caller.
     *
     * @throws IllegalArgumentException if the patient does not exist
     */
    public Patient addNote(String patientId, String content, String authorName) {
        CallerContext caller = callerContextProvider.getCurrentCaller();
        Patient patient = patientRepository.findById(patientId)
            .orElseThrow(() -> new IllegalArgumentException("Patient not found: " + patientId));
        return save(patient.withNote(content, caller.getPrincipalId(), authorName, Instant.now()));
    }

    public Optional<ProjectedView> viewPatient(String patientId) {
        CallerContext caller = callerContextProvider.getCurrentCaller();
        return patientRepository.findById(patientId).map(patient -> project(patient, caller));
    }

    /**
     * @throws IllegalArgumentException if no criterion is set
     */
    public List<ProjectedView> search(PatientSearchCriteria criteria) {
        CallerContext caller = callerContextProvider.getCurrentCaller();
        Map<String, FieldValue> fieldCriteria = criteria.toFieldCriteria();
        if (fieldCriteria.isEmpty()) {
            throw new IllegalArgumentException("At least one search criterion is required");
        }
        List<ProjectedView> views = new ArrayList<>();
        for (Patient patient : patientRepository.findByEquality(fieldCriteria)) {
            views.add(project(patient, caller));
        }
        log.debug("Patient search on {} returned {} records", fieldCriteria.keySet(), views.size());
        return views;
    }

    private ProjectedView project(Patient patient, CallerContext caller) {
        ProjectedView view = roleProjection.project(patientSchema, patient, caller);
        auditService.record(AuditEventKind.RECORD_VIEWED, ACTOR_PREFIX + caller.getPrincipalId(), Map.of(
            "entityKind", Patient.ENTITY_KIND,
            "recordId", String.valueOf(patient.getId()),
            "roles", String.join(",", caller.getRoles()),
            "fields", String.valueOf(view.fieldNames().size())));
        return view;
    }
}
