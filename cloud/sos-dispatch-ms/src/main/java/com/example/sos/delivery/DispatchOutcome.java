package com.example.sos.delivery;

import com.example.sos.error.ErrorCategory;
import com.example.sos.model.AlertKind;
import java.util.List;

public record DispatchOutcome(
    String envelopeId,
    AlertKind kind,
    DispatchStatus status,
    ChannelId channel,
    int accepted,
    int targeted,
    String queuedAlertId,
    List<DeliveryAttempt> attempts,
    ErrorCategory errorCategory
) {
    public static DispatchOutcome noContacts(String envelopeId, AlertKind kind) {
        return new DispatchOutcome(
            envelopeId,
            kind,
            DispatchStatus.NO_CONTACTS,
            null,
            0,
            0,
            null,
            List.of(),
            ErrorCategory.VALIDATION
        );
    }

    public static DispatchOutcome sent(
        String envelopeId,
        AlertKind kind,
        DeliveryReport report
    ) {
        return new DispatchOutcome(
            envelopeId,
            kind,
            DispatchStatus.SENT,
            report.channel(),
            report.accepted(),
            report.targeted(),
            null,
            report.attempts(),
            null
        );
    }

    public static DispatchOutcome queued(
        String envelopeId,
        AlertKind kind,
        DeliveryReport report,
        String queuedAlertId
    ) {
        return new DispatchOutcome(
            envelopeId,
            kind,
            DispatchStatus.QUEUED,
            null,
            0,
            report.targeted(),
            queuedAlertId,
            report.attempts(),
            ErrorCategory.TRANSIENT_DELIVERY
        );
    }

    public static DispatchOutcome failed(
        String envelopeId,
        AlertKind kind,
        DeliveryReport report
    ) {
        return new DispatchOutcome(
            envelopeId,
            kind,
            DispatchStatus.FAILED,
            null,
            0,
            report.targeted(),
            null,
            report.attempts(),
            ErrorCategory.TERMINAL_DELIVERY
        );
    }
}
