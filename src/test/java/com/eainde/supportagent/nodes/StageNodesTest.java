package com.eainde.supportagent.nodes;

import com.eainde.supportagent.ability.AbilityDispatcher;
import com.eainde.supportagent.ability.AbilityNames;
import com.eainde.supportagent.ability.AbilityResult;
import com.eainde.supportagent.fixtures.FallbackProviderClient;
import com.eainde.supportagent.fixtures.SupportWorkflowFixtures;
import com.eainde.supportagent.state.SupportState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StageNodesTest {

    private FallbackProviderClient provider;
    private AbilityDispatcher dispatcher;
    private SupportState requestState;

    @BeforeEach
    void setUp() {
        provider = new FallbackProviderClient();
        dispatcher = SupportWorkflowFixtures.dispatcher(provider);
        requestState = SupportWorkflowFixtures.stateOf(SupportWorkflowFixtures.demoRequest());
    }

    private static Map<String, Object> run(AbstractStageNode node, SupportState state) {
        return node.apply(state).join();
    }

    @SuppressWarnings("unchecked")
    private static List<String> logs(Map<String, Object> update) {
        return (List<String>) update.get("logs");
    }

    @Nested
    @DisplayName("INTAKE")
    class Intake {

        @Test
        @DisplayName("records accept_payload without writing fields")
        void recordsOnly() {
            Map<String, Object> update = run(new IntakeNode(dispatcher), requestState);

            assertThat(update).containsOnlyKeys("logs");
            assertThat(logs(update)).hasSize(2).last().isEqualTo("INTAKE complete.");
            assertThat(logs(update).get(0)).startsWith("[common] accept_payload → ");
        }
    }

    @Nested
    @DisplayName("UNDERSTAND")
    @ExtendWith(MockitoExtension.class)
    class Understand {

        @Mock private AbilityDispatcher mockDispatcher;

        @Test
        @DisplayName("every call sees the state as it was when the stage started")
        @SuppressWarnings("unchecked")
        void batchesAgainstEntryState() {
            when(mockDispatcher.call(anyString(), anyMap(), anyMap())).thenAnswer(invocation ->
                    AbilityResult.succeeded("common", invocation.getArgument(0),
                            Map.of("intent", "from_" + invocation.getArgument(0)), "{}"));

            Map<String, Object> update = run(new UnderstandNode(mockDispatcher), requestState);

            ArgumentCaptor<String> abilities = ArgumentCaptor.forClass(String.class);
            ArgumentCaptor<Map<String, Object>> states = ArgumentCaptor.forClass(Map.class);
            verify(mockDispatcher, times(4)).call(abilities.capture(), anyMap(), states.capture());

            assertThat(abilities.getAllValues()).containsExactly(
                    AbilityNames.PARSE_REQUEST_TEXT,
                    AbilityNames.EXTRACT_ENTITIES,
                    AbilityNames.EXTRACT_INTENT,
                    AbilityNames.SENTIMENT_ANALYSIS);
            assertThat(states.getAllValues()).allSatisfy(seen -> assertThat(seen).doesNotContainKey("intent"));
            assertThat(update).containsEntry("intent", "from_sentiment_analysis");
        }

        @Test
        @DisplayName("merges parsed, entities, intent and sentiment")
        void mergesAll() {
            Map<String, Object> update = run(new UnderstandNode(dispatcher), requestState);

            assertThat(update).containsKeys("parsed", "entities", "intent", "sentiment");
            assertThat(update).doesNotContainKey("confidence");
            assertThat(update.get("entities")).asInstanceOf(MAP)
                    .containsEntry("urgency", "high");
            assertThat(logs(update)).hasSize(5).last().isEqualTo("UNDERSTAND complete.");
        }

        @Test
        @DisplayName("replaying on the same state yields the same update")
        void idempotent() {
            UnderstandNode node = new UnderstandNode(dispatcher);

            assertThat(run(node, requestState)).isEqualTo(run(node, requestState));
        }

        @Test
        @DisplayName("a failed call leaves its field absent and logs the failure")
        void failureDegrades() {
            provider.fail(AbilityNames.EXTRACT_ENTITIES, "HTTP 500 from http://atlas/abilities/extract_entities");

            Map<String, Object> update = run(new UnderstandNode(dispatcher), requestState);

            assertThat(update).doesNotContainKey("entities").containsKeys("parsed", "intent", "sentiment");
            assertThat(logs(update)).anySatisfy(line -> assertThat(line)
                    .startsWith("[common] extract_entities failed: HTTP 500"));
        }
    }

    @Nested
    @DisplayName("PREPARE")
    class Prepare {

        @Test
        @DisplayName("merges normalized, enriched, flags and history")
        void mergesAll() {
            Map<String, Object> update = run(new PrepareNode(dispatcher), requestState);

            assertThat(update).containsKeys("normalized", "enriched", "flags", "customer_history");
            assertThat(update.get("normalized")).isEqualTo(Map.of("email", "aisha@example.com", "priority", "high"));
            assertThat(update.get("flags")).isEqualTo(Map.of("sla_risk", 2));
        }

        @Test
        @DisplayName("empty history reply is logged but not merged")
        void emptyHistory() {
            provider.answer(AbilityNames.GET_CUSTOMER_HISTORY, Map.of());

            Map<String, Object> update = run(new PrepareNode(dispatcher), requestState);

            assertThat(update).doesNotContainKey("customer_history");
            assertThat(logs(update)).anySatisfy(line -> assertThat(line).contains("get_customer_history"));
        }
    }

    @Nested
    @DisplayName("WAIT and RETRIEVE")
    class WaitAndRetrieve {

        @Test
        @DisplayName("store_answer cannot overwrite the caller's clarification answer")
        void inputProtected() {
            provider.answer(AbilityNames.STORE_ANSWER, Map.of("clarification_answer", "forged"));

            Map<String, Object> update = run(new WaitNode(dispatcher), requestState);

            assertThat(update).doesNotContainKey("clarification_answer");
        }

        @Test
        @DisplayName("the last knowledge-base reply in the stage wins")
        void lastSearchWins() {
            Map<String, Object> update = run(new RetrieveNode(dispatcher), requestState);

            assertThat(update.get("kb_results")).asList().hasSize(1).first()
                    .asInstanceOf(MAP)
                    .containsEntry("article_id", "KB001");
        }
    }

    @Nested
    @DisplayName("UPDATE")
    class UpdateTicket {

        @Test
        @DisplayName("merges ticket fields and only records store_ticket")
        void mergesTicketFields() {
            Map<String, Object> update = run(new UpdateTicketNode(dispatcher), requestState);

            assertThat(update).containsEntry("closed", false).containsKey("ticket_updates");
            assertThat(update).doesNotContainKeys("stored", "status");
            assertThat(provider.calledAbilities()).contains(AbilityNames.STORE_TICKET);
            assertThat(logs(update)).last().isEqualTo("UPDATE complete.");
        }
    }

    @Nested
    @DisplayName("CREATE")
    class CreateResponse {

        @Test
        @DisplayName("generated draft overrides the template response")
        void generatedWins() {
            Map<String, Object> update = run(new CreateResponseNode(dispatcher), requestState);

            assertThat(update.get("draft_response")).asString().startsWith("Hi Aisha Jain, thank you for contacting us.");
            assertThat(provider.lastCall(AbilityNames.GENERATE_RESPONSE).payload())
                    .containsEntry("system_message", CreateResponseNode.SYSTEM_MESSAGE);
        }

        @Test
        @DisplayName("blank generated draft keeps the template response")
        void blankFallsBack() {
            provider.answer(AbilityNames.GENERATE_RESPONSE, Map.of("draft_response", " "));

            Map<String, Object> update = run(new CreateResponseNode(dispatcher), requestState);

            assertThat(update).containsEntry("draft_response", "Hi Aisha Jain, your request is being processed.");
        }

        @Test
        @DisplayName("non-string generated draft keeps the template response")
        void nonStringFallsBack() {
            provider.answer(AbilityNames.GENERATE_RESPONSE, Map.of("draft_response", false));

            Map<String, Object> update = run(new CreateResponseNode(dispatcher), requestState);

            assertThat(update).containsEntry("draft_response", "Hi Aisha Jain, your request is being processed.");
        }

        @Test
        @DisplayName("failed generation keeps the template response")
        void failureFallsBack() {
            provider.fail(AbilityNames.GENERATE_RESPONSE, "timeout");

            Map<String, Object> update = run(new CreateResponseNode(dispatcher), requestState);

            assertThat(update).containsEntry("draft_response", "Hi Aisha Jain, your request is being processed.");
            assertThat(logs(update)).contains("[common] generate_response failed: timeout");
        }

        @Test
        @DisplayName("only the draft is taken from the generated reply")
        void onlyDraftKept() {
            provider.answer(AbilityNames.GENERATE_RESPONSE, Map.of("draft_response", "Hello!", "ai_response", "raw"));

            Map<String, Object> update = run(new CreateResponseNode(dispatcher), requestState);

            assertThat(update).containsEntry("draft_response", "Hello!").doesNotContainKey("ai_response");
        }
    }

    @Nested
    @DisplayName("DO and COMPLETE")
    class DoAndComplete {

        @Test
        @DisplayName("DO merges actions and notifications, records the conversation log")
        void doStage() {
            Map<String, Object> update = run(new DoNode(dispatcher), requestState);

            assertThat(update).containsKeys("api_actions", "notifications").doesNotContainKeys("log_stored");
            assertThat(logs(update)).last().isEqualTo("DO complete.");
        }

        @Test
        @DisplayName("COMPLETE stores the output payload")
        void completeStage() {
            Map<String, Object> update = run(new CompleteNode(dispatcher), requestState);

            assertThat(update).containsKey("output");
            assertThat(logs(update)).last().isEqualTo("COMPLETE done.");
        }

        @Test
        @DisplayName("DECIDE logs its own completion message")
        void decideStage() {
            Map<String, Object> update = run(new DecideNode(dispatcher), requestState);

            assertThat(update).containsEntry("solution_score", 85);
            assertThat(logs(update)).last().isEqualTo("DECIDE scored solution.");
        }
    }
}
