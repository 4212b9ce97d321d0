package com.medical.records.security;

import lombok.Value;

/**
 * Authenticated identity performing a request, as established by the upstream gateway.
 */
@Value
public class Actor {
    String id;
    Role role;

    public static Actor patient(String id) {
        return new Actor(id, Role.PATIENT);
    }

    public static Actor doctor(String id) {
        return new Actor(id, Role.DOCTOR);
    }

    public boolean isPatient() {
        return role == Role.PATIENT;
    }

    public boolean isDoctor() {
        return role == Role.DOCTOR;
    }

    public enum Role {
        PATIENT, DOCTOR
    }
}
