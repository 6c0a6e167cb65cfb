package com.phillippitts.callrelay.service.command;

import com.phillippitts.callrelay.domain.AiResponseType;

/**
 * Operator instruction for the device handling a call.
 *
 * @param command instruction kind
 * @param text    text for the device to speak, may be empty
 */
public record CallCommand(AiResponseType command, String text) {
}
