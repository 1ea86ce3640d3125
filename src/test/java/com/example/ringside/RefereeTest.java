package com.example.ringside;

import com.example.ringside.model.Attribute;
import com.example.ringside.model.Fighter;
import com.example.ringside.model.HitLocation;
import com.example.ringside.official.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Referee Tests")
class RefereeTest {

    private static final FightSituation EVEN = new FightSituation(5, 0, 4);

    private static Fighter battered() {
        Fighter f = new Fighter("Battered", Map.of(Attribute.CHIN, 70));
        f.takeDamage(f.getMaxHeadDamage() * 0.9, HitLocation.HEAD);
        f.setHurt(12);
        return f;
    }

    // ==================== Presets ====================

    @Test
    @DisplayName("Presets are looked up by name, falling back to standard")
    void presets() {
        assertEquals("Strict Referee", Referee.preset("STRICT").getName());
        assertEquals("Lenient Referee", Referee.preset(" lenient ").getName());
        assertEquals("Protective Referee", Referee.preset("protective").getName());
        assertEquals("Referee", Referee.preset("unknown").getName());
        assertEquals("Referee", Referee.preset(null).getName());
    }

    @Test
    @DisplayName("Skill is the mean of experience, attentiveness, positioning and presence")
    void skill() {
        assertEquals(86.25, Referee.strict().getSkill(), 1e-9);
    }

    @Test
    @DisplayName("Commands come from the command's variations")
    void commands() {
        Referee ref = Referee.standard();
        String text = ref.issueCommand(RefereeCommand.BREAK, new Random(1));
        assertTrue(RefereeCommand.BREAK.getVariations().contains(text));
    }

    // ==================== Stoppage ====================

    @Test
    @DisplayName("A battered, hurt fighter is stopped for accumulated damage")
    void stopsBatteredFighter() {
        StoppageCall call = Referee.standard().checkStoppage(battered(), new Fighter("Other", null), EVEN);
        assertTrue(call.stop());
        assertEquals(StoppageCall.ACCUMULATED_DAMAGE, call.reason());
    }

    @Test
    @DisplayName("A fighter well ahead on the cards is let go on")
    void aheadOnCardsIsNotStopped() {
        StoppageCall call = Referee.standard().checkStoppage(battered(), new Fighter("Other", null),
            new FightSituation(9, 4, 4));
        assertFalse(call.stop());
    }

    @Test
    @DisplayName("A fresh fighter scores nothing")
    void freshFighterIsNotStopped() {
        StoppageCall call = Referee.standard().checkStoppage(new Fighter("Fresh", null), new Fighter("Other", null), EVEN);
        assertFalse(call.stop());
        assertEquals(0, call.score(), 1e-9);
    }

    @Test
    @DisplayName("A protective referee stops earlier than a standard one")
    void protectiveStopsEarlier() {
        Fighter wobbly = new Fighter("Wobbly", null);
        wobbly.setHurt(6);
        for (int i = 0; i < 11; i++) wobbly.updateStun(0.5);
        Fighter other = new Fighter("Other", null);

        assertFalse(Referee.standard().checkStoppage(wobbly, other, EVEN).stop());
        assertTrue(Referee.protective().checkStoppage(wobbly, other, EVEN).stop());
    }

    @Test
    @DisplayName("The longer a fighter stays hurt, the closer the referee is to stopping it")
    void sustainedHurtRaisesScore() {
        Fighter other = new Fighter("Other", null);
        Fighter fresh = new Fighter("Just Hurt", null);
        fresh.setHurt(6);
        double justHurt = Referee.standard().checkStoppage(fresh, other, EVEN).score();

        Fighter stuck = new Fighter("Still Hurt", null);
        stuck.setHurt(6);
        for (int i = 0; i < 24; i++) {
            if (i % 8 == 0) stuck.setHurt(6);
            stuck.updateStun(0.5);
        }
        assertTrue(stuck.isHurt());
        assertEquals(12.0, stuck.getHurtElapsed(), 1e-9);

        StoppageCall call = Referee.standard().checkStoppage(stuck, other, EVEN);
        assertEquals(0.3, justHurt, 1e-9);
        assertEquals(0.6, call.score(), 1e-9);
        assertTrue(call.stop());
    }

    // ==================== Clinch ====================

    @Test
    @DisplayName("The referee warns once before breaking a clinch")
    void warnsThenBreaks() {
        Referee ref = Referee.standard();
        Fighter a = new Fighter("A", null);
        Fighter b = new Fighter("B", null);
        Random rng = new Random(5);

        int warnings = 0;
        ClinchCall call = ClinchCall.NONE;
        for (double t = 0; t <= 6 && !call.isBreak(); t += 0.5) {
            call = ref.checkClinchBreak(t, a, b, 6, rng);
            if (call.action() == ClinchCall.Action.WARN) warnings++;
        }
        assertTrue(call.isBreak());
        assertEquals(1, warnings);
        assertTrue(call.delay() > 0);
    }

    @Test
    @DisplayName("No clinch lasts past the maximum duration")
    void maxDurationCapsClinch() {
        Referee ref = Referee.lenient();
        ClinchCall call = ref.checkClinchBreak(1.0, new Fighter("A", null), new Fighter("B", null), 1.0, new Random(9));
        assertTrue(call.isBreak());
    }

    @Test
    @DisplayName("Resetting forgets the previous clinch")
    void resetClinch() {
        Referee ref = Referee.standard();
        Fighter a = new Fighter("A", null);
        Fighter b = new Fighter("B", null);
        ref.checkClinchBreak(10, a, b, 6, new Random(2));
        ref.resetClinch();
        assertFalse(ref.isClinchWarningIssued());
        assertEquals(ClinchCall.NONE, ref.checkClinchBreak(0, a, b, 6, new Random(2)));
    }
}
