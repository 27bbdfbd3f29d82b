package ch.so.arp.finrag.orchestration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import ch.so.arp.finrag.llm.Message;
import ch.so.arp.finrag.llm.Role;
import ch.so.arp.finrag.llm.ToolResultBlock;
import ch.so.arp.finrag.llm.ToolUse;

class ConversationStateTest {

    @Test
    void startsWithHistoryFollowedByQuestion() {
        ConversationState state = new ConversationState(
                List.of(Message.user("What is AMD?"), Message.assistant("A chip maker.")), "And its revenue?");

        assertThat(state.messages()).extracting(Message::text)
                .containsExactly("What is AMD?", "A chip maker.", "And its revenue?");
        assertThat(state.state()).isEqualTo(LoopState.PLANNING);
    }

    @Test
    void instructionIsMergedIntoPendingToolResults() {
        ConversationState state = new ConversationState(List.of(), "Question");
        state.addAssistantTurn("", List.of(new ToolUse("toolu_1", "list_available_data", null)));
        state.addToolResults(List.of(new ToolResultBlock("toolu_1", "AMD: {2024=[Q3]}", false)));

        state.appendUserInstruction(SystemPrompts.FORCE_ANSWER);

        List<Message> messages = state.messages();
        assertThat(messages).hasSize(3);
        assertThat(messages.get(2).role()).isEqualTo(Role.USER);
        assertThat(messages.get(2).text()).isEqualTo(SystemPrompts.FORCE_ANSWER);
        assertThat(messages.get(2).toolResults()).extracting(ToolResultBlock::toolUseId).containsExactly("toolu_1");
    }

    @Test
    void instructionAfterAssistantTurnIsANewUserMessage() {
        ConversationState state = new ConversationState(List.of(), "Question");
        state.addAssistantTurn("Thinking", List.of());

        state.appendUserInstruction("Answer now.");

        assertThat(state.messages()).extracting(Message::role).containsExactly(Role.USER, Role.ASSISTANT, Role.USER);
    }

    @Test
    void terminatedStateIsFinal() {
        ConversationState state = new ConversationState(List.of(), "Question");
        state.terminate();

        assertThatThrownBy(() -> state.transitionTo(LoopState.PLANNING)).isInstanceOf(IllegalStateException.class);
    }
}
