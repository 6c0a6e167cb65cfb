/**
 * Transcript/response pipeline: ordered per-call response generation and end-of-call summaries.
 */
package com.phillippitts.callrelay.service.response;
