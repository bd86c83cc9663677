package me.golemcore.router.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConversationMemoryTest {

    @Test
    void shouldKeepTurnsInAppendOrder() {
        ConversationMemory memory = new ConversationMemory(5, true);

        memory.append(Turn.user("hello"));
        memory.append(Turn.assistant("hi there"));

        List<Turn> turns = memory.recent();
        assertEquals(2, turns.size());
        assertEquals(TurnRole.USER, turns.get(0).role());
        assertEquals("hi there", turns.get(1).text());
    }

    @Test
    void shouldEvictOldestTurnWhenOverCapacity() {
        ConversationMemory memory = new ConversationMemory(3, true);

        for (int i = 1; i <= 4; i++) {
            memory.append(Turn.user("message " + i));
        }

        List<Turn> turns = memory.recent();
        assertEquals(3, turns.size());
        assertEquals("message 2", turns.get(0).text());
        assertEquals("message 4", turns.get(2).text());
    }

    @Test
    void shouldNeverExceedCapacity() {
        ConversationMemory memory = new ConversationMemory(10, true);

        for (int i = 0; i < 100; i++) {
            memory.append(i % 2 == 0 ? Turn.user("q" + i) : Turn.assistant("a" + i));
            assertTrue(memory.recent().size() <= 10);
        }
        assertEquals(10, memory.size());
        assertEquals("a99", memory.recent().get(9).text());
    }

    @Test
    void shouldDropSystemTurnsWhenExcluded() {
        ConversationMemory memory = new ConversationMemory(5, false);

        memory.append(Turn.system("context"));
        memory.append(Turn.user("question"));

        assertEquals(1, memory.size());
        assertEquals(TurnRole.USER, memory.recent().get(0).role());
    }

    @Test
    void shouldReturnMostRecentTurnsWithLimit() {
        ConversationMemory memory = new ConversationMemory(5, true);
        memory.append(Turn.user("one"));
        memory.append(Turn.user("two"));
        memory.append(Turn.user("three"));

        List<Turn> lastTwo = memory.recent(2);

        assertEquals(List.of("two", "three"), lastTwo.stream().map(Turn::text).toList());
    }

    @Test
    void shouldClearAllTurns() {
        ConversationMemory memory = new ConversationMemory();
        memory.append(Turn.user("hello"));

        memory.clear();

        assertEquals(0, memory.size());
        assertTrue(memory.recent().isEmpty());
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ConversationMemory(0, true));
    }

    @Test
    void shouldReturnSnapshotNotLiveView() {
        ConversationMemory memory = new ConversationMemory(5, true);
        memory.append(Turn.user("first"));

        List<Turn> snapshot = memory.recent();
        memory.append(Turn.user("second"));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(Turn.user("x")));
    }
}
