package com.warp.bridge.conversation;

import com.warp.bridge.exception.NormalizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 会话规范化
 * <p>
 * 处理顺序：
 * <ol>
 *     <li>抽出全部 system 消息，按空行拼接为 leadingSystemText</li>
 *     <li>tool 消息挂到紧邻的前一个 assistant 上；前面没有 assistant 的作为 user 内容保留</li>
 *     <li>相邻同角色消息合并片段</li>
 *     <li>首条不是 user 时补一个空的 user</li>
 *     <li>校验严格交替</li>
 * </ol>
 */
@Component
public class ConversationNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ConversationNormalizer.class);

    public NormalizedConversation normalize(List<ChatTurn> input) {
        if (input == null || input.isEmpty()) {
            return new NormalizedConversation(null, List.of(ChatTurn.emptyUser()));
        }

        List<String> systemTexts = new ArrayList<>();
        List<ChatTurn> turns = new ArrayList<>();

        for (ChatTurn turn : input) {
            if (turn == null || turn.role() == null) {
                throw new NormalizationException("消息缺少 role");
            }
            switch (turn.role()) {
                case SYSTEM -> {
                    String text = turn.text();
                    if (!text.isEmpty()) {
                        systemTexts.add(text);
                    }
                }
                case TOOL -> attachToolTurn(turns, turn);
                case USER, ASSISTANT -> mergeOrAppend(turns, turn);
            }
        }

        String systemText = systemTexts.isEmpty() ? null : String.join("\n\n", systemTexts);
        if (turns.isEmpty()) {
            return new NormalizedConversation(systemText, List.of());
        }

        if (turns.get(0).role() != Role.USER) {
            turns.add(0, ChatTurn.emptyUser());
        }

        assertAlternation(turns);
        if (log.isDebugEnabled()) {
            log.debug("会话规范化完成: 输入 {} 条, 输出 {} 条, system={}", input.size(), turns.size(), systemText != null);
        }
        return new NormalizedConversation(systemText, turns);
    }

    private void attachToolTurn(List<ChatTurn> turns, ChatTurn toolTurn) {
        int last = turns.size() - 1;
        if (last >= 0 && turns.get(last).role() == Role.ASSISTANT) {
            turns.set(last, turns.get(last).append(toolTurn.parts()));
            return;
        }
        log.debug("孤立的工具结果，作为用户内容保留");
        mergeOrAppend(turns, toolTurn.withRole(Role.USER));
    }

    private void mergeOrAppend(List<ChatTurn> turns, ChatTurn turn) {
        int last = turns.size() - 1;
        if (last >= 0 && turns.get(last).role() == turn.role()) {
            turns.set(last, turns.get(last).append(turn.parts()));
        } else {
            turns.add(turn);
        }
    }

    private void assertAlternation(List<ChatTurn> turns) {
        Role expected = Role.USER;
        for (int i = 0; i < turns.size(); i++) {
            Role actual = turns.get(i).role();
            if (actual != expected) {
                throw new IllegalStateException("规范化结果未严格交替: index=" + i + ", role=" + actual);
            }
            expected = expected == Role.USER ? Role.ASSISTANT : Role.USER;
        }
    }
}
