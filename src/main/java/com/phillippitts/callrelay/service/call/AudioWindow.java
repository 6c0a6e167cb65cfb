package com.phillippitts.callrelay.service.call;

/**
 * Buffered audio not yet covered by a transcription.
 *
 * @param fromFragment index of the first fragment included (inclusive)
 * @param toFragment   index after the last fragment included (exclusive)
 * @param audio        concatenated fragment bytes in arrival order
 */
public record AudioWindow(int fromFragment, int toFragment, byte[] audio) {

    public int fragmentCount() {
        return toFragment - fromFragment;
    }
}
