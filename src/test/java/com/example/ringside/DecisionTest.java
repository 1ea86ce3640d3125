package com.example.ringside;

import com.example.ringside.engine.Action;
import com.example.ringside.engine.ActionType;
import com.example.ringside.engine.Decision;
import com.example.ringside.engine.MoveDirection;
import com.example.ringside.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Decision Tests")
class DecisionTest {

    @Test
    @DisplayName("Punches need a punch type and moves a direction")
    void actionValidation() {
        assertThrows(IllegalArgumentException.class, () -> new Action(ActionType.PUNCH, null, null));
        assertThrows(IllegalArgumentException.class, () -> new Action(ActionType.MOVE, null, null));
        assertTrue(Action.punch(PunchType.JAB).isPunch());
        assertEquals(MoveDirection.LATERAL, Action.move(MoveDirection.LATERAL).direction());
        assertEquals(ActionType.NONE, new Action(null, null, null).type());
    }

    @Test
    @DisplayName("Only voluntary states can be chosen")
    void voluntaryStatesOnly() {
        assertThrows(IllegalArgumentException.class,
            () -> Decision.of(FighterState.HURT, null, Action.NONE));
        assertThrows(IllegalArgumentException.class,
            () -> Decision.of(FighterState.KNOCKED_DOWN, null, Action.NONE));
        assertEquals(FighterState.CLINCH, Decision.of(FighterState.CLINCH, null, Action.clinch()).state());
    }

    @Test
    @DisplayName("A sub-state must belong to the chosen state")
    void subStateMustFit() {
        assertThrows(IllegalArgumentException.class,
            () -> Decision.of(FighterState.DEFENSIVE, OffensiveSubState.JABBING, Action.NONE));
        Decision d = Decision.of(FighterState.OFFENSIVE, OffensiveSubState.POWER_SHOT, Action.punch(PunchType.CROSS));
        assertEquals(OffensiveSubState.POWER_SHOT, d.subState());
    }

    @Test
    @DisplayName("Missing pieces default to a neutral hold")
    void defaults() {
        Decision d = new Decision(null, null, null);
        assertEquals(FighterState.NEUTRAL, d.state());
        assertSame(Action.NONE, d.action());
        assertEquals(FighterState.NEUTRAL, Decision.hold(FighterState.BUZZED).state());
        assertEquals(FighterState.MOVING, Decision.hold(FighterState.MOVING).state());
    }
}
