package com.phillippitts.callrelay.service.capability;

import com.phillippitts.callrelay.domain.CallContext;

/**
 * External assistant producing what the device should say next.
 *
 * <p>The reply is free text. A reply starting with {@code END_CALL} asks the device to hang
 * up, see {@link AssistantDirective}.
 */
public interface ResponseCapability {

    String generateResponse(String transcriptDelta, CallContext context);
}
