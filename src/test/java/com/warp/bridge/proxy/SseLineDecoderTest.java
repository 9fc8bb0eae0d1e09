package com.warp.bridge.proxy;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SseLineDecoderTest {

    @Test
    void feed_blankLineCompletesEvent() {
        SseLineDecoder decoder = new SseLineDecoder();

        assertTrue(decoder.feed("event: message").isEmpty());
        assertTrue(decoder.feed("data: {\"a\":").isEmpty());
        assertTrue(decoder.feed("data: 1}").isEmpty());
        assertEquals(List.of("{\"a\":1}"), decoder.feed(""));
    }

    @Test
    void feed_doneEndsStreamAndFlushesPending() {
        SseLineDecoder decoder = new SseLineDecoder();
        decoder.feed("data: {\"x\":1}");

        assertEquals(List.of("{\"x\":1}"), decoder.feed("data: [DONE]"));
        assertTrue(decoder.isDone());
        assertTrue(decoder.feed("data: {\"late\":true}").isEmpty());
    }

    @Test
    void flush_returnsUnterminatedEvent() {
        SseLineDecoder decoder = new SseLineDecoder();
        decoder.feed("data: {\"tail\":true}");

        assertEquals(List.of("{\"tail\":true}"), decoder.flush());
        assertTrue(decoder.flush().isEmpty());
    }
}
