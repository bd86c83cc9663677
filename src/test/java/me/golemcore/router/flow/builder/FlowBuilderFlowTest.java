package me.golemcore.router.flow.builder;

import me.golemcore.router.domain.model.ConversationMemory;
import me.golemcore.router.domain.model.FlowState;
import me.golemcore.router.domain.model.FlowTurnResult;
import me.golemcore.router.domain.service.OracleService;
import me.golemcore.router.flow.FlowEngine;
import me.golemcore.router.flow.FlowRegistry;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.routing.ConversationPromptRenderer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class FlowBuilderFlowTest {

    private OracleService oracle;
    private FlowEngine engine;
    private ConversationMemory memory;

    @BeforeEach
    void setUp() {
        RouterProperties properties = new RouterProperties();
        oracle = mock(OracleService.class);
        FlowBuilderFlow flow = new FlowBuilderFlow(oracle, new ConversationPromptRenderer(properties));
        engine = new FlowEngine(new FlowRegistry(List.of(flow)), new ObjectMapper(), properties);
        memory = new ConversationMemory();
    }

    @Test
    void shouldMoveFromIntroToRequirements() {
        when(oracle.generate(anyString())).thenReturn("What should the flow do?");

        FlowTurnResult result = engine.run(FlowState.initial("flow_builder", Map.of("flowType", "survey")),
                "I want a survey flow", memory);

        assertEquals("What should the flow do?", result.response());
        assertEquals("requirements", result.nextState().stage());
        assertEquals(List.of("I want a survey flow"), result.nextState().params().get("notes"));
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(oracle).generate(prompt.capture());
        assertTrue(prompt.getValue().contains("Requested flow type: survey"));
    }

    @Test
    void shouldAccumulateRequirementsTurnByTurn() {
        when(oracle.generate(anyString())).thenReturn("Noted.");
        FlowState state = new FlowState("flow_builder", "requirements", Map.of("notes", List.of("a survey")));

        FlowTurnResult first = engine.run(state, "three questions", memory);
        FlowTurnResult second = engine.run(first.nextState(), "then a summary", memory);

        assertEquals("requirements", second.nextState().stage());
        assertTrue(second.terminal());
        assertEquals(List.of("a survey", "three questions", "then a summary"),
                second.nextState().params().get("notes"));
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(oracle, times(2)).generate(prompt.capture());
        assertTrue(prompt.getValue().contains("- three questions\n- then a summary"));
    }

    @Test
    void shouldKeepOnlyRecentNotes() {
        when(oracle.generate(anyString())).thenReturn("Noted.");
        FlowState state = new FlowState("flow_builder", "requirements", Map.of());

        for (int i = 0; i < 25; i++) {
            state = engine.run(state, "note " + i, memory).nextState();
        }

        @SuppressWarnings("unchecked")
        List<String> notes = (List<String>) state.params().get("notes");
        assertEquals(20, notes.size());
        assertEquals("note 5", notes.get(0));
        assertEquals("note 24", notes.get(19));
    }

    @Test
    void shouldNeverGoBackToIntro() {
        assertFalse(FlowBuilderStage.REQUIREMENTS.canTransitionTo(FlowBuilderStage.INTRO));
        assertTrue(FlowBuilderStage.INTRO.canTransitionTo(FlowBuilderStage.REQUIREMENTS));
    }
}
