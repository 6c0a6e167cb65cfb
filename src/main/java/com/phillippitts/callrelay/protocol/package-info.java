/**
 * Socket wire protocol: one record per inbound {@code type} (validated at the router boundary)
 * and one record per outbound message kind.
 *
 * <p>Inbound messages are JSON objects carrying a {@code type} discriminator, see
 * {@link com.phillippitts.callrelay.protocol.inbound.InboundMessageType}. Outbound records
 * carry their own {@code type} as the first serialized field.
 */
package com.phillippitts.callrelay.protocol;
