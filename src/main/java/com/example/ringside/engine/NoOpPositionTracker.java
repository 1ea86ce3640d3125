package com.example.ringside.engine;

import com.example.ringside.model.Corner;
import com.example.ringside.model.Fighter;
import com.example.ringside.model.Position;

/**
 * Fighters stand still at a fixed distance; nobody is ever on the ropes or in a corner.
 */
public class NoOpPositionTracker implements PositionTracker {

    static final double FIXED_DISTANCE = 8.0;

    @Override
    public void initializePositions(Fighter fighterA, Fighter fighterB) {
        fighterA.setPosition(new Position(-FIXED_DISTANCE / 2, 0));
        fighterB.setPosition(new Position(FIXED_DISTANCE / 2, 0));
    }

    @Override
    public void update(Fighter fighterA, Fighter fighterB, Decision decisionA, Decision decisionB, double tickRate) {
    }

    @Override
    public double getDistance() {
        return FIXED_DISTANCE;
    }

    @Override
    public boolean isOnRopes(Fighter fighter) {
        return false;
    }

    @Override
    public boolean isInCorner(Fighter fighter) {
        return false;
    }

    @Override
    public Corner getCenterControl() {
        return null;
    }

    @Override
    public void separateFighters(double distance) {
    }
}
