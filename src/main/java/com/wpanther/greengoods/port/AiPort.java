package com.wpanther.greengoods.port;

import com.wpanther.greengoods.dto.ai.ParsedWorkData;

public interface AiPort {

    /**
     * Speech to text for an already downloaded audio clip.
     */
    String transcribe(byte[] audio, String mimeType);

    ParsedWorkData parseWorkText(String text, String locale);

    boolean isModelLoaded();
}
