package com.warp.bridge.proxy;

import com.warp.bridge.stream.FinishReason;
import com.warp.bridge.stream.StreamEvent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WarpEventDecoderTest {

    private final WarpEventDecoder decoder = new WarpEventDecoder(Map.of("mcp_read", "mcp.read"));

    @Test
    void decode_init_yieldsSessionIdentifiers() {
        List<StreamEvent> events = decoder.decode("""
                {"parsed_data":{"init":{"conversation_id":"conv-1","task_id":"task-1"}}}
                """);

        assertEquals(List.of(new StreamEvent.SessionInit("conv-1", "task-1")), events);
    }

    @Test
    void decode_appendToMessageContent_yieldsTextDelta() {
        List<StreamEvent> events = decoder.decode("""
                {"parsed_data":{"client_actions":{"actions":[
                  {"append_to_message_content":{"message":{"id":"m1","agent_output":{"text":"Hel"}}}}]}}}
                """);

        assertEquals(List.of(new StreamEvent.TextDelta("Hel")), events);
    }

    @Test
    void decode_camelCaseKeysAreAccepted() {
        List<StreamEvent> events = decoder.decode("""
                {"parsedData":{"clientActions":{"actions":[
                  {"appendToMessageContent":{"message":{"agentOutput":{"text":"hi"}}}}]}}}
                """);

        assertEquals(List.of(new StreamEvent.TextDelta("hi")), events);
    }

    @Test
    void decode_toolCalls_assignIncreasingIndicesAndRestoreNames() {
        String payload = """
                {"parsed_data":{"client_actions":{"actions":[
                  {"add_messages_to_task":{"task_id":"task-2","messages":[
                    {"tool_call":{"tool_call_id":"call_a","call_mcp_tool":{"name":"mcp_read","args":{"path":"/x"}}}},
                    {"tool_call":{"tool_call_id":"call_b","call_mcp_tool":{"name":"other","args":{}}}}]}}]}}}
                """;

        List<StreamEvent> events = decoder.decode(payload);

        assertEquals(3, events.size());
        assertEquals(new StreamEvent.SessionInit(null, "task-2"), events.get(0));
        StreamEvent.ToolCallDelta first = assertInstanceOf(StreamEvent.ToolCallDelta.class, events.get(1));
        assertEquals(0, first.index());
        assertEquals("call_a", first.id());
        assertEquals("mcp.read", first.name());
        assertEquals("{\"path\":\"/x\"}", first.argumentsFragment());
        StreamEvent.ToolCallDelta second = assertInstanceOf(StreamEvent.ToolCallDelta.class, events.get(2));
        assertEquals(1, second.index());
        assertEquals("other", second.name());
    }

    @Test
    void decode_createTask_yieldsTaskId() {
        List<StreamEvent> events = decoder.decode("""
                {"parsed_data":{"client_actions":{"actions":[{"create_task":{"task":{"id":"task-9"}}}]}}}
                """);

        assertEquals(List.of(new StreamEvent.SessionInit(null, "task-9")), events);
    }

    @Test
    void decode_finishedVariants() {
        assertEquals(List.of(new StreamEvent.Finish(FinishReason.CONTENT_COMPLETE)),
                decoder.decode("{\"parsed_data\":{\"finished\":{\"done\":{}}}}"));
        assertEquals(List.of(new StreamEvent.Finish(FinishReason.LENGTH_LIMIT)),
                decoder.decode("{\"parsed_data\":{\"finished\":{\"max_token_limit\":{}}}}"));
        assertEquals(List.of(new StreamEvent.Finish(FinishReason.TOOL_INVOCATION)),
                decoder.decode("{\"finished\":{\"toolCallRequested\":{}}}"));
        assertInstanceOf(StreamEvent.Error.class,
                decoder.decode("{\"parsed_data\":{\"finished\":{\"quota_limit\":{}}}}").get(0));
        StreamEvent.Error internal = assertInstanceOf(StreamEvent.Error.class,
                decoder.decode("{\"parsed_data\":{\"finished\":{\"internal_error\":{\"message\":\"boom\"}}}}").get(0));
        assertTrue(internal.message().contains("boom"));
    }

    @Test
    void decode_bridgeError_yieldsErrorEvent() {
        List<StreamEvent> events = decoder.decode("{\"error\":{\"message\":\"upstream 500\"}}");

        assertEquals(List.of(new StreamEvent.Error("upstream 500")), events);
    }

    @Test
    void decode_malformedOrIrrelevantPayload_yieldsNothing() {
        assertTrue(decoder.decode("not json").isEmpty());
        assertTrue(decoder.decode("{\"parsed_data\":{\"heartbeat\":{}}}").isEmpty());
    }
}
