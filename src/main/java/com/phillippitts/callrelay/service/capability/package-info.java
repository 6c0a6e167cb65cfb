/**
 * External capabilities (transcription, response, summary, channel notification) and the
 * invoker that runs them with a timeout.
 *
 * <p>No real backend ships with the service. {@link com.phillippitts.callrelay.config.CapabilityConfig}
 * registers {@link com.phillippitts.callrelay.service.capability.DisabledCallAssistant} and
 * {@link com.phillippitts.callrelay.service.capability.LoggingChannelNotifier} unless the
 * application context already provides an implementation.
 */
package com.phillippitts.callrelay.service.capability;
