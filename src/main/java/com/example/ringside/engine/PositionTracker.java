package com.example.ringside.engine;

import com.example.ringside.model.Corner;
import com.example.ringside.model.Fighter;

/**
 * Ring geometry: where the fighters are and who controls the centre.
 */
public interface PositionTracker {

    void initializePositions(Fighter fighterA, Fighter fighterB);

    void update(Fighter fighterA, Fighter fighterB, Decision decisionA, Decision decisionB, double tickRate);

    double getDistance();

    boolean isOnRopes(Fighter fighter);

    boolean isInCorner(Fighter fighter);

    /** The corner holding the centre of the ring, or null if neither does. */
    Corner getCenterControl();

    void separateFighters(double distance);
}
