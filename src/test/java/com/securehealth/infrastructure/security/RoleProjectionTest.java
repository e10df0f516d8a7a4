package com.securehealth.infrastructure.security;

import com.securehealth.domain.model.FieldValue;
import com.securehealth.domain.model.Patient;
import com.securehealth.domain.schema.PatientSchema;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RoleProjectionTest {

    private static final List<String> ROLES = List.of(
        "ROLE_DOCTOR", "ROLE_NURSE", "ROLE_RECEPTIONIST", "ROLE_PATIENT", "ROLE_ADMIN", "ROLE_AUDITOR");

    private final RoleProjection projection = new RoleProjection(ViewPolicy.defaults());
    private final PatientSchema schema = new PatientSchema();

    private final Patient patient = Patient.builder()
        .id(new ObjectId().toHexString())
        .firstName("Jane")
        .lastName("Doe")
        .email("jane@example.com")
        .phoneNumber("555-0100")
        .birthDate(Instant.parse("1980-05-01T00:00:00Z"))
        .ssn("123-45-6789")
        .addDiagnosis("Hypertension")
        .medication("Lisinopril")
        .insuranceDetails(Map.of("provider", "Acme"))
        .notes("Follow up in 3 months")
        .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
        .primaryDoctorId(new ObjectId().toHexString())
        .build();

    @Test
    void doctorSeesClinicalFields() {
        ProjectedView view = projection.project(schema, patient, List.of("ROLE_DOCTOR"));

        assertTrue(view.fieldNames().containsAll(Set.of("id", "lastName", "ssn", "diagnosis", "medications")));
        assertEquals(new FieldValue.Text("123-45-6789"), view.get("ssn"));
    }

    @Test
    void receptionistSeesBaseFieldsAndInsuranceOnly() {
        ViewPolicy policy = ViewPolicy.defaults().get("patient");
        Set<String> expected = new LinkedHashSet<>(policy.baseFields());
        expected.add("insuranceDetails");

        ProjectedView view = projection.project(schema, patient, List.of("ROLE_RECEPTIONIST"));

        assertEquals(expected, view.fieldNames());
    }

    @Test
    void patientSeesOwnMedicationsButNotSsnOrDiagnosis() {
        ProjectedView view = projection.project(schema, patient, List.of("patient"));

        assertTrue(view.contains("medications"));
        assertTrue(view.contains("insuranceDetails"));
        assertFalse(view.contains("ssn"));
        assertFalse(view.contains("diagnosis"));
    }

    @Test
    void unknownRoleSeesBaseFields() {
        ProjectedView view = projection.project(schema, patient, List.of("ROLE_AUDITOR"));

        assertEquals(ViewPolicy.defaults().get("patient").baseFields(), view.fieldNames());
        assertEquals("Jane", view.toPlainMap().get("firstName"));
    }

    @Test
    void absentFieldsAreOmittedFromView() {
        Patient sparse = Patient.builder().lastName("Doe").build();

        ProjectedView view = projection.project(schema, sparse, List.of("ROLE_DOCTOR"));

        assertEquals(Set.of("lastName"), view.fieldNames());
    }

    @Test
    void projectionNeverLeaksFieldsOutsideTheAllowList() {
        ViewPolicy policy = ViewPolicy.defaults().get("patient");
        Random random = new Random(42);
        for (int i = 0; i < 200; i++) {
            Map<String, FieldValue> record = new LinkedHashMap<>();
            for (int f = 0; f < 20; f++) {
                String field = random.nextBoolean() ? "extra" + random.nextInt(10) : pickField(random);
                record.put(field, new FieldValue.Text("v" + f));
            }
            List<String> roles = new ArrayList<>();
            for (String role : ROLES) {
                if (random.nextInt(3) == 0) {
                    roles.add(random.nextBoolean() ? role : role.substring(5).toLowerCase());
                }
            }

            ProjectedView view = projection.project("patient", record, roles);

            Set<String> allowed = policy.visibleFields(roles);
            for (String field : view.fieldNames()) {
                assertTrue(allowed.contains(field), () -> field + " leaked to " + roles);
                assertEquals(record.get(field), view.get(field));
            }
            for (String field : allowed) {
                assertEquals(record.containsKey(field), view.contains(field));
            }
        }
    }

    @Test
    void authenticationAuthoritiesAreTheRoles() {
        UsernamePasswordAuthenticationToken nurse = new UsernamePasswordAuthenticationToken("nina", "n/a",
            AuthorityUtils.createAuthorityList("ROLE_NURSE"));

        ProjectedView view = projection.project(schema, patient, nurse);

        assertTrue(view.contains("diagnosis"));
        assertFalse(view.contains("ssn"));
        assertEquals(List.of(), RoleProjection.rolesOf(null));
    }

    @Test
    void callerContextRolesAreTheRoles() {
        CallerContext caller = CallerContext.builder().principalId("dr-house").role("doctor").build();

        assertTrue(caller.hasRole("ROLE_DOCTOR"));
        assertTrue(projection.project(schema, patient, caller).contains("ssn"));
    }

    @Test
    void unknownEntityKindIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> projection.project("invoice", Map.of(), List.of("ROLE_ADMIN")));
    }

    private static String pickField(Random random) {
        List<String> fields = List.of("id", "firstName", "lastName", "email", "ssn", "diagnosis", "medications",
            "insuranceDetails", "notes", "notesHistory", "primaryDoctorId", "createdAt");
        return fields.get(random.nextInt(fields.size()));
    }
}
