package me.toolpilot.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationStateTest {

    @Test
    void shouldStartWithSystemMessage() {
        ConversationState state = new ConversationState("be helpful");

        assertEquals(1, state.size());
        assertTrue(state.getMessages().get(0).isSystemMessage());
        assertEquals("be helpful", state.getMessages().get(0).getContent());
    }

    @Test
    void shouldStartEmptyWithoutSystemPrompt() {
        ConversationState state = new ConversationState(" ");

        assertEquals(0, state.size());
        assertNull(state.getLastMessage());
    }

    @Test
    void shouldResetToSystemMessage() {
        ConversationState state = new ConversationState("sys");
        state.append(Message.user("hi"));
        state.append(Message.user("again"));

        state.reset();

        assertEquals(1, state.size());
        assertTrue(state.getLastMessage().isSystemMessage());
    }

    @Test
    void shouldExposeReadOnlyHistory() {
        ConversationState state = new ConversationState("sys");

        assertThrows(UnsupportedOperationException.class, () -> state.getMessages().add(Message.user("x")));
    }
}
