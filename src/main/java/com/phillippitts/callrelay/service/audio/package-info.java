/**
 * Audio ingest: per-call buffering, the batching policy and transcription attempts.
 */
package com.phillippitts.callrelay.service.audio;
