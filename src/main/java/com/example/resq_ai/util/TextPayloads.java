package com.example.resq_ai.util;

import com.example.resq_ai.dto.RawMedia;
import com.example.resq_ai.exception.PipelineException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

public final class TextPayloads {

    private TextPayloads() {}

    /**
     * Strict UTF-8 decode of a stored text document. Malformed bytes and documents with no
     * visible text are {@link ErrorKind#INVALID_INPUT} at {@link PipelineStage#DECODING}.
     */
    public static String decodeUtf8(RawMedia media) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(media.bytes()))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new PipelineException(ErrorKind.INVALID_INPUT, PipelineStage.DECODING,
                    "Text object is not valid UTF-8: " + media.source(), e);
        }
        // BOM written by some editors
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        if (text.isBlank()) {
            throw new PipelineException(ErrorKind.INVALID_INPUT, PipelineStage.DECODING,
                    "Text object is empty: " + media.source());
        }
        return text;
    }
}
