package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.agent.ValidatorAgent;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineControllerTest {

    private final List<String> runs = new ArrayList<>();
    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(0), ZoneOffset.UTC);

    @Test
    void run_validationPasses_runsEachStageOnce() {
        PipelineController controller = new PipelineController(
                agent(Stage.PLANNER, s -> s.toBuilder().subtasks(List.of("Explain")).build()),
                agent(Stage.EXECUTOR, s -> s.withFindingsAppended(List.of(Finding.completed("Explain topic")), List.of())),
                agent(Stage.VALIDATOR, s -> s.toBuilder().validationPassed(true).build()),
                agent(Stage.COMPOSER, s -> s.toBuilder().finalAnswer("done").build()));

        RequestState out = controller.run(initial("Explain topic"), StageObserver.NONE);

        assertThat(runs).containsExactly("planner", "executor", "validator", "composer");
        assertThat(out.getFinalAnswer()).isEqualTo("done");
        assertThat(out.getRetryCount()).isZero();
    }

    @Test
    void run_zeroFindings_retriesExecutorOnceThenComposes() {
        PipelineController controller = new PipelineController(
                agent(Stage.PLANNER, UnaryOperator.identity()),
                agent(Stage.EXECUTOR, UnaryOperator.identity()),
                tracked(new ValidatorAgent(clock)),
                agent(Stage.COMPOSER, UnaryOperator.identity()));

        RequestState out = controller.run(initial("anything"), StageObserver.NONE);

        assertThat(runs).containsExactly("planner", "executor", "validator", "executor", "validator", "composer");
        assertThat(out.getRetryCount()).isEqualTo(1);
        assertThat(out.isValidationPassed()).isFalse();
    }

    @Test
    void run_retrySucceeds_composesAfterSecondValidation() {
        PipelineController controller = new PipelineController(
                agent(Stage.PLANNER, UnaryOperator.identity()),
                agent(Stage.EXECUTOR, s -> s.getRetryCount() == 0 ? s
                        : s.withFindingsAppended(List.of(Finding.completed("anything goes")), List.of())),
                tracked(new ValidatorAgent(clock)),
                agent(Stage.COMPOSER, UnaryOperator.identity()));

        RequestState out = controller.run(initial("anything"), StageObserver.NONE);

        assertThat(runs).containsExactly("planner", "executor", "validator", "executor", "validator", "composer");
        assertThat(out.isValidationPassed()).isTrue();
        assertThat(out.getRetryCount()).isEqualTo(1);
    }

    @Test
    void run_retryCountObservedAtEveryStage_staysWithinZeroAndOne() {
        List<Integer> seen = new ArrayList<>();
        PipelineController controller = new PipelineController(
                agent(Stage.PLANNER, UnaryOperator.identity()),
                agent(Stage.EXECUTOR, UnaryOperator.identity()),
                tracked(new ValidatorAgent(clock)),
                agent(Stage.COMPOSER, UnaryOperator.identity()));

        controller.run(initial("x"), (stage, previous, current) -> seen.add(current.getRetryCount()));

        assertThat(seen).containsExactly(0, 0, 1, 1, 1, 1);
    }

    @Test
    void run_observerSeesPreviousAndCurrentState() {
        List<String> transitions = new ArrayList<>();
        PipelineController controller = new PipelineController(
                agent(Stage.PLANNER, s -> s.toBuilder().subtasks(List.of("a step")).build()),
                agent(Stage.EXECUTOR, s -> s.withFindingsAppended(List.of(Finding.completed("x")), List.of())),
                agent(Stage.VALIDATOR, s -> s.toBuilder().validationPassed(true).build()),
                agent(Stage.COMPOSER, UnaryOperator.identity()));

        controller.run(initial("x"), (stage, previous, current) ->
                transitions.add(stage.wireName() + ":" + previous.getFindings().size() + "->" + current.getFindings().size()));

        assertThat(transitions).containsExactly("planner:0->0", "executor:0->1", "validator:1->1", "composer:1->1");
    }

    @Test
    void run_observerThrows_abortsRemainingStages() {
        PipelineController controller = new PipelineController(
                agent(Stage.PLANNER, UnaryOperator.identity()),
                agent(Stage.EXECUTOR, UnaryOperator.identity()),
                agent(Stage.VALIDATOR, s -> s.toBuilder().validationPassed(true).build()),
                agent(Stage.COMPOSER, UnaryOperator.identity()));

        assertThatThrownBy(() -> controller.run(initial("x"), (stage, previous, current) -> {
            if (stage == Stage.EXECUTOR) {
                throw new IllegalStateException("client gone");
            }
        })).hasMessage("client gone");

        assertThat(runs).containsExactly("planner", "executor");
    }

    @Test
    void constructor_agentForWrongStage_rejected() {
        StageAgent planner = agent(Stage.PLANNER, UnaryOperator.identity());

        assertThatThrownBy(() -> new PipelineController(planner, planner, planner, planner))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("executor");
    }

    private RequestState initial(String prompt) {
        return RequestState.builder().sessionId("s1").userId("u1").userPrompt(prompt).build();
    }

    private StageAgent agent(Stage stage, UnaryOperator<RequestState> body) {
        return new StageAgent() {
            @Override
            public Stage stage() {
                return stage;
            }

            @Override
            public RequestState apply(RequestState state) {
                runs.add(stage.wireName());
                return body.apply(state).withStageTiming(stage, 1);
            }
        };
    }

    private StageAgent tracked(StageAgent delegate) {
        return agent(delegate.stage(), delegate::apply);
    }
}
