package com.heist.backend.service.execution;

import com.heist.backend.model.Position;
import com.heist.backend.model.TradeStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TradeStateMachineTest {

    private final TradeStateMachine stateMachine = new TradeStateMachine();

    @Test
    void walksTheHappyPath() {
        Position position = Position.builder().id("p1").build();

        assertThat(stateMachine.transition(position, TradeStatus.EXECUTING, "submit")).isTrue();
        assertThat(stateMachine.transition(position, TradeStatus.OPEN, "filled")).isTrue();
        assertThat(stateMachine.transition(position, TradeStatus.CLOSED, "exit")).isTrue();
        assertThat(position.getStatus()).isEqualTo(TradeStatus.CLOSED);
    }

    @Test
    void sameStateIsANoOp() {
        Position position = Position.builder().id("p1").status(TradeStatus.OPEN).build();

        assertThat(stateMachine.transition(position, TradeStatus.OPEN, "again")).isFalse();
    }

    @Test
    void openPositionCannotFail() {
        Position position = Position.builder().id("p1").status(TradeStatus.OPEN).build();

        assertThatThrownBy(() -> stateMachine.transition(position, TradeStatus.FAILED, "late failure"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("OPEN -> FAILED");
        assertThat(position.getStatus()).isEqualTo(TradeStatus.OPEN);
    }

    @Test
    void terminalStatesAreFinal() {
        for (TradeStatus terminal : new TradeStatus[]{TradeStatus.CLOSED, TradeStatus.FAILED, TradeStatus.CANCELLED}) {
            assertThat(terminal.isTerminal()).isTrue();
            for (TradeStatus target : TradeStatus.values()) {
                assertThat(terminal.canTransitionTo(target)).isFalse();
            }
        }
    }
}
