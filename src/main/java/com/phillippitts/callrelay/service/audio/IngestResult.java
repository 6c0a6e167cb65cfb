package com.phillippitts.callrelay.service.audio;

/**
 * Outcome of one {@code ingestAudio} call.
 *
 * @param fragmentCount          fragments received for the call so far
 * @param transcriptionTriggered {@code true} if this fragment started a transcription attempt
 */
public record IngestResult(int fragmentCount, boolean transcriptionTriggered) {
}
