/**
 * Call session store: per-call state machine, audio buffers, transcripts and summaries.
 */
package com.phillippitts.callrelay.service.call;
