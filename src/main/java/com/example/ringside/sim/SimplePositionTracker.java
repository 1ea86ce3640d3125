package com.example.ringside.sim;

import com.example.ringside.engine.Decision;
import com.example.ringside.engine.MoveDirection;
import com.example.ringside.engine.PositionTracker;
import com.example.ringside.model.Attribute;
import com.example.ringside.model.Corner;
import com.example.ringside.model.Fighter;
import com.example.ringside.model.FighterState;
import com.example.ringside.model.Position;

/**
 * A square ring measured in feet from the centre. Fighters walk toward or away
 * from each other, circle sideways, and are pinned by the ropes at the edge.
 */
public class SimplePositionTracker implements PositionTracker {

    static final double HALF_RING = 10.0;
    static final double ROPES = 9.0;
    static final double CORNER = 8.0;
    static final double MIN_DISTANCE = 1.0;
    static final double START_DISTANCE = 10.0;
    static final double CENTER_MARGIN = 1.0;

    static final double FORWARD_SPEED = 2.0;
    static final double BACKWARD_SPEED = 1.5;
    static final double LATERAL_SPEED = 1.5;

    private Fighter fighterA;
    private Fighter fighterB;

    @Override
    public void initializePositions(Fighter fighterA, Fighter fighterB) {
        this.fighterA = fighterA;
        this.fighterB = fighterB;
        fighterA.setPosition(new Position(-START_DISTANCE / 2, 0));
        fighterB.setPosition(new Position(START_DISTANCE / 2, 0));
    }

    @Override
    public void update(Fighter fighterA, Fighter fighterB, Decision decisionA, Decision decisionB, double tickRate) {
        if (this.fighterA == null) {
            initializePositions(fighterA, fighterB);
        }
        if (fighterA.getState() == FighterState.CLINCH || fighterB.getState() == FighterState.CLINCH) {
            collapse(fighterA, fighterB);
            return;
        }
        Position nextA = move(fighterA, fighterB, decisionA, tickRate);
        Position nextB = move(fighterB, fighterA, decisionB, tickRate);
        fighterA.setPosition(nextA);
        fighterB.setPosition(nextB);
        if (nextA.distanceTo(nextB) < MIN_DISTANCE) {
            spread(MIN_DISTANCE);
        }
    }

    private Position move(Fighter self, Fighter other, Decision decision, double tickRate) {
        Position from = self.getPosition();
        if (decision == null || self.isDown() || decision.action().direction() == null) return from;

        Position to = other.getPosition();
        double dx = to.x() - from.x();
        double dy = to.y() - from.y();
        double length = Math.sqrt(dx * dx + dy * dy);
        if (length < 1e-9) {
            dx = 1;
            dy = 0;
        } else {
            dx /= length;
            dy /= length;
        }
        double footSpeed = 0.7 + self.getModifiedAttribute(Attribute.FOOT_SPEED) / 200.0;

        double stepX;
        double stepY;
        MoveDirection direction = decision.action().direction();
        if (direction == MoveDirection.FORWARD) {
            double step = Math.min(FORWARD_SPEED * footSpeed * tickRate, Math.max(0, length - MIN_DISTANCE));
            stepX = dx * step;
            stepY = dy * step;
        } else if (direction == MoveDirection.BACKWARD) {
            stepX = -dx * BACKWARD_SPEED * footSpeed * tickRate;
            stepY = -dy * BACKWARD_SPEED * footSpeed * tickRate;
        } else {
            // circle away from the nearer rope
            double px = -dy;
            double py = dx;
            if (Math.abs(from.x() + px) + Math.abs(from.y() + py) > Math.abs(from.x() - px) + Math.abs(from.y() - py)) {
                px = -px;
                py = -py;
            }
            stepX = px * LATERAL_SPEED * footSpeed * tickRate;
            stepY = py * LATERAL_SPEED * footSpeed * tickRate;
        }
        return clamp(new Position(from.x() + stepX, from.y() + stepY));
    }

    private static Position clamp(Position p) {
        return new Position(
            Math.max(-HALF_RING, Math.min(HALF_RING, p.x())),
            Math.max(-HALF_RING, Math.min(HALF_RING, p.y())));
    }

    private void collapse(Fighter a, Fighter b) {
        Position pa = a.getPosition();
        Position pb = b.getPosition();
        double mx = (pa.x() + pb.x()) / 2;
        double my = (pa.y() + pb.y()) / 2;
        double dx = pb.x() - pa.x();
        double dy = pb.y() - pa.y();
        double length = Math.sqrt(dx * dx + dy * dy);
        if (length < 1e-9) {
            dx = 1;
            dy = 0;
            length = 1;
        }
        double half = MIN_DISTANCE / 2;
        a.setPosition(clamp(new Position(mx - dx / length * half, my - dy / length * half)));
        b.setPosition(clamp(new Position(mx + dx / length * half, my + dy / length * half)));
    }

    @Override
    public double getDistance() {
        if (fighterA == null) return START_DISTANCE;
        return fighterA.getPosition().distanceTo(fighterB.getPosition());
    }

    @Override
    public boolean isOnRopes(Fighter fighter) {
        Position p = fighter.getPosition();
        return Math.max(Math.abs(p.x()), Math.abs(p.y())) >= ROPES;
    }

    @Override
    public boolean isInCorner(Fighter fighter) {
        Position p = fighter.getPosition();
        return Math.abs(p.x()) >= CORNER && Math.abs(p.y()) >= CORNER;
    }

    @Override
    public Corner getCenterControl() {
        if (fighterA == null) return null;
        double a = fighterA.getPosition().distanceTo(Position.CENTER);
        double b = fighterB.getPosition().distanceTo(Position.CENTER);
        if (a + CENTER_MARGIN < b) return Corner.A;
        if (b + CENTER_MARGIN < a) return Corner.B;
        return null;
    }

    @Override
    public void separateFighters(double distance) {
        if (fighterA == null) return;
        spread(distance);
    }

    /** Push the pair apart along the line between them, about their midpoint. */
    private void spread(double distance) {
        Position pa = fighterA.getPosition();
        Position pb = fighterB.getPosition();
        double dx = pb.x() - pa.x();
        double dy = pb.y() - pa.y();
        double length = Math.sqrt(dx * dx + dy * dy);
        if (length < 1e-9) {
            dx = pa.x() <= 0 ? 1 : -1;
            dy = 0;
            length = 1;
        }
        dx /= length;
        dy /= length;
        double mx = (pa.x() + pb.x()) / 2;
        double my = (pa.y() + pb.y()) / 2;
        double half = distance / 2;
        // keep the midpoint inside so the pair does not end up pressed through the ropes
        mx = Math.max(-HALF_RING + half * Math.abs(dx), Math.min(HALF_RING - half * Math.abs(dx), mx));
        my = Math.max(-HALF_RING + half * Math.abs(dy), Math.min(HALF_RING - half * Math.abs(dy), my));
        fighterA.setPosition(clamp(new Position(mx - dx * half, my - dy * half)));
        fighterB.setPosition(clamp(new Position(mx + dx * half, my + dy * half)));
    }
}
