package ch.so.arp.finrag.orchestration;

import java.util.ArrayList;
import java.util.List;

import ch.so.arp.finrag.llm.Message;
import ch.so.arp.finrag.llm.Role;
import ch.so.arp.finrag.llm.ToolResultBlock;
import ch.so.arp.finrag.llm.ToolUse;

/**
 * Message history and loop counters of a single request. Owned by one loop
 * run and never shared.
 */
public class ConversationState {

    private final List<Message> messages = new ArrayList<>();
    private LoopState state = LoopState.PLANNING;
    private int loopCount;
    private int totalToolCalls;

    public ConversationState(List<Message> history, String question) {
        messages.addAll(history);
        messages.add(Message.user(question));
    }

    public List<Message> messages() {
        return List.copyOf(messages);
    }

    public LoopState state() {
        return state;
    }

    public int loopCount() {
        return loopCount;
    }

    public int totalToolCalls() {
        return totalToolCalls;
    }

    void transitionTo(LoopState next) {
        if (state == LoopState.TERMINATED) {
            throw new IllegalStateException("Loop already terminated");
        }
        state = next;
    }

    void terminate() {
        state = LoopState.TERMINATED;
    }

    void addAssistantTurn(String text, List<ToolUse> toolUses) {
        messages.add(Message.assistant(text, toolUses));
    }

    void addToolResults(List<ToolResultBlock> results) {
        messages.add(Message.toolResults(results));
    }

    void iterationCompleted() {
        loopCount++;
    }

    void toolCalled() {
        totalToolCalls++;
    }

    /**
     * Append an instruction as user text. When the last turn is a pure
     * tool-result turn the text joins it so roles keep alternating.
     */
    void appendUserInstruction(String text) {
        int last = messages.size() - 1;
        Message previous = messages.get(last);
        if (previous.role() == Role.USER) {
            String merged = previous.text().isBlank() ? text : previous.text() + "\n\n" + text;
            messages.set(last, new Message(Role.USER, merged, List.of(), previous.toolResults()));
        } else {
            messages.add(Message.user(text));
        }
    }
}
