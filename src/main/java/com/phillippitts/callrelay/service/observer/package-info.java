/**
 * Observer fan-out: which connections watch which call, and delivery of session, transcript,
 * response and summary messages to them.
 */
package com.phillippitts.callrelay.service.observer;
