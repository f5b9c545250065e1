package com.wpanther.greengoods.port;

/**
 * Fetches a platform voice clip and turns it into text. Optional: without one, voice messages are declined.
 */
public interface VoiceProcessor {

    String downloadAndTranscribe(String audioRef, String mimeType);
}
