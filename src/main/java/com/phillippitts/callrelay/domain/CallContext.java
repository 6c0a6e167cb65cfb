package com.phillippitts.callrelay.domain;

/**
 * Call facts handed to external capabilities alongside the text or audio they process.
 *
 * @param callId          call identifier
 * @param phoneNumber     remote party number
 * @param incoming        call direction
 * @param inProgress      {@code false} once the call has ended
 * @param durationSeconds call duration when known, otherwise {@code 0}
 */
public record CallContext(
        String callId,
        String phoneNumber,
        boolean incoming,
        boolean inProgress,
        long durationSeconds
) {

    public static CallContext of(CallSession session) {
        return new CallContext(
                session.callId(),
                session.phoneNumber(),
                session.incoming(),
                !session.isEnded(),
                session.durationSeconds() == null ? 0L : session.durationSeconds()
        );
    }
}
