package com.medical.records.security;

import com.medical.records.exception.ForbiddenException;
import com.medical.records.service.ConsultationRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Decides whether an actor may perform an operation on a patient's record.
 * <p>
 * A patient may run the self-service reads on their own record. A doctor may run every
 * operation on the patients in their consulted set. Everything else is denied.
 * The registry is consulted on each call, so a revoked link takes effect on the next request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthorizationGuard {

    private final ConsultationRegistry consultationRegistry;

    public AuthorizationDecision authorize(Actor actor, String patientId, Operation operation) {
        if (actor == null || patientId == null) {
            return AuthorizationDecision.deny(AuthorizationDecision.DenyReason.NOT_AUTHORIZED);
        }
        if (actor.isPatient() && actor.getId().equals(patientId) && operation.isSelfService()) {
            return AuthorizationDecision.allow();
        }
        if (actor.isDoctor() && consultationRegistry.isConsulting(actor.getId(), patientId)) {
            return AuthorizationDecision.allow();
        }
        return AuthorizationDecision.deny(AuthorizationDecision.DenyReason.NOT_AUTHORIZED);
    }

    /**
     * Same as {@link #authorize} but throws {@link ForbiddenException} on deny.
     */
    public void require(Actor actor, String patientId, Operation operation) {
        AuthorizationDecision decision = authorize(actor, patientId, operation);
        if (!decision.isAllowed()) {
            log.warn("[Authorization] denied {} on patient {} for {} {}",
                    operation, patientId,
                    actor != null ? actor.getRole() : null,
                    actor != null ? actor.getId() : null);
            throw new ForbiddenException(decision.getReason().name(), Map.of("operation", operation.name()));
        }
    }
}
