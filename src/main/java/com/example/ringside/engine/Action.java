package com.example.ringside.engine;

import com.example.ringside.model.PunchType;

/**
 * What a fighter tries to do this tick. Punch actions carry a punch type, moves a direction.
 */
public record Action(ActionType type, PunchType punchType, MoveDirection direction) {

    public static final Action NONE = new Action(ActionType.NONE, null, null);

    public Action {
        if (type == null) type = ActionType.NONE;
        if (type == ActionType.PUNCH && punchType == null) {
            throw new IllegalArgumentException("A punch action needs a punch type");
        }
        if (type == ActionType.MOVE && direction == null) {
            throw new IllegalArgumentException("A move action needs a direction");
        }
    }

    public static Action punch(PunchType type) {
        return new Action(ActionType.PUNCH, type, null);
    }

    public static Action move(MoveDirection direction) {
        return new Action(ActionType.MOVE, null, direction);
    }

    public static Action clinch() {
        return new Action(ActionType.CLINCH, null, null);
    }

    public static Action defend() {
        return new Action(ActionType.DEFEND, null, null);
    }

    public boolean isPunch() {
        return type == ActionType.PUNCH;
    }
}
