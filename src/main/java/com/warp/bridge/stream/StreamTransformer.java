package com.warp.bridge.stream;

import com.warp.bridge.exception.BridgeException;
import com.warp.bridge.exception.UpstreamErrorException;
import com.warp.bridge.stream.OutputChunk.ContentDelta;
import com.warp.bridge.stream.OutputChunk.ErrorChunk;
import com.warp.bridge.stream.OutputChunk.FinishChunk;
import com.warp.bridge.stream.OutputChunk.RoleMarker;
import com.warp.bridge.stream.OutputChunk.ToolCallChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 上游事件流 → OpenAI 增量块
 * <p>
 * 每次订阅持有独立的状态机。终止块（finish 或 error）发出后取消上游订阅；
 * 上游失败转换为错误块，不向下游抛出
 */
@Component
public class StreamTransformer {

    private static final Logger log = LoggerFactory.getLogger(StreamTransformer.class);

    public Flux<OutputChunk> transform(Flux<StreamEvent> events) {
        return Flux.defer(() -> {
            Machine machine = new Machine();
            return events
                    .concatMapIterable(machine::onEvent)
                    .onErrorResume(e -> Flux.fromIterable(machine.onFailure(e)))
                    .concatWith(Flux.defer(() -> Flux.fromIterable(machine.onComplete())))
                    .takeUntil(OutputChunk::terminal);
        });
    }

    /**
     * 非流式模式：对同一组块做累积
     * <p>
     * 错误块转为异常：传输层的 {@link BridgeException} 原样抛出，其余为 {@link UpstreamErrorException}
     */
    public Mono<AggregateResponse> aggregate(Flux<StreamEvent> events) {
        return transform(events)
                .reduceWith(Accumulator::new, Accumulator::add)
                .flatMap(Accumulator::toResponse);
    }

    /**
     * 单次响应的状态机
     */
    static final class Machine {

        private StreamState state = StreamState.IDLE;
        private boolean roleSent;
        private boolean toolCallsEmitted;

        StreamState state() {
            return state;
        }

        List<OutputChunk> onEvent(StreamEvent event) {
            if (state.isTerminal()) {
                return List.of();
            }
            List<OutputChunk> out = new ArrayList<>(2);
            if (event instanceof StreamEvent.TextDelta text) {
                if (text.text() == null || text.text().isEmpty()) {
                    return out;
                }
                ensureRole(out);
                state = StreamState.STREAMING;
                out.add(new ContentDelta(text.text()));
            } else if (event instanceof StreamEvent.ToolCallDelta delta) {
                ensureRole(out);
                state = StreamState.TOOL_CALLING;
                toolCallsEmitted = true;
                out.add(new ToolCallChunk(delta.index(), delta.id(), delta.name(), delta.argumentsFragment()));
            } else if (event instanceof StreamEvent.Finish finish) {
                ensureRole(out);
                state = StreamState.FINISHED;
                out.add(new FinishChunk(finish.reason().toOpenAi(toolCallsEmitted)));
            } else if (event instanceof StreamEvent.Error error) {
                ensureRole(out);
                state = StreamState.ERRORED;
                log.warn("上游返回错误事件: {}", error.message());
                out.add(new ErrorChunk(error.message(), null));
            } else if (event instanceof StreamEvent.Citation citation) {
                log.debug("忽略引用事件: {}", citation.source());
            }
            return out;
        }

        List<OutputChunk> onFailure(Throwable e) {
            if (state.isTerminal()) {
                return List.of();
            }
            log.error("事件流失败: state={}, error={}", state, e.getMessage());
            List<OutputChunk> out = new ArrayList<>(2);
            ensureRole(out);
            state = StreamState.ERRORED;
            out.add(new ErrorChunk(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e));
            return out;
        }

        /**
         * 上游在没有结束事件的情况下关闭
         */
        List<OutputChunk> onComplete() {
            if (state.isTerminal()) {
                return List.of();
            }
            log.warn("上游事件流未发送结束事件即关闭: state={}", state);
            List<OutputChunk> out = new ArrayList<>(2);
            ensureRole(out);
            state = StreamState.ERRORED;
            out.add(new ErrorChunk("上游事件流意外结束", null));
            return out;
        }

        private void ensureRole(List<OutputChunk> out) {
            if (!roleSent) {
                roleSent = true;
                out.add(new RoleMarker("assistant"));
            }
        }
    }

    /**
     * 块累积器，结果与按顺序拼接流式块一致
     */
    static final class Accumulator {

        private final StringBuilder content = new StringBuilder();
        private final Map<Integer, ToolCallBuilder> toolCalls = new TreeMap<>();
        private String finishReason;
        private ErrorChunk error;

        Accumulator add(OutputChunk chunk) {
            if (chunk instanceof ContentDelta delta) {
                content.append(delta.text());
            } else if (chunk instanceof ToolCallChunk call) {
                ToolCallBuilder builder = toolCalls.computeIfAbsent(call.index(), ToolCallBuilder::new);
                if (call.id() != null) builder.id = call.id();
                if (call.name() != null) builder.name = call.name();
                if (call.arguments() != null) builder.arguments.append(call.arguments());
            } else if (chunk instanceof FinishChunk finish) {
                finishReason = finish.finishReason();
            } else if (chunk instanceof ErrorChunk errorChunk) {
                error = errorChunk;
            }
            return this;
        }

        Mono<AggregateResponse> toResponse() {
            if (error != null) {
                if (error.cause() instanceof BridgeException bridgeException) {
                    return Mono.error(bridgeException);
                }
                return Mono.error(new UpstreamErrorException("上游错误: " + error.message(), error.cause()));
            }
            List<AggregateResponse.ToolCall> calls = new ArrayList<>(toolCalls.size());
            for (ToolCallBuilder builder : toolCalls.values()) {
                calls.add(new AggregateResponse.ToolCall(builder.index, builder.id, builder.name, builder.arguments.toString()));
            }
            return Mono.just(new AggregateResponse(content.toString(), calls, finishReason));
        }
    }

    private static final class ToolCallBuilder {
        private final int index;
        private String id;
        private String name;
        private final StringBuilder arguments = new StringBuilder();

        ToolCallBuilder(int index) {
            this.index = index;
        }
    }
}
