package uk.gegc.quizbot.features.delivery.application;

import lombok.Builder;
import lombok.Data;
import org.slf4j.MDC;

/**
 * MDC fields set while one webhook event is handled.
 */
@Data
@Builder
public class DeliveryLoggingContext {

    static final String EVENT_TYPE = "event_type";
    static final String PERSON_ID = "person_id";
    static final String MESSAGE_HANDLE = "message_handle";

    private String eventType;
    private String personId;
    private String messageHandle;

    public void setMDC() {
        if (eventType != null) MDC.put(EVENT_TYPE, eventType);
        if (personId != null) MDC.put(PERSON_ID, personId);
        if (messageHandle != null) MDC.put(MESSAGE_HANDLE, messageHandle);
    }

    public static void clearMDC() {
        MDC.remove(EVENT_TYPE);
        MDC.remove(PERSON_ID);
        MDC.remove(MESSAGE_HANDLE);
    }
}
