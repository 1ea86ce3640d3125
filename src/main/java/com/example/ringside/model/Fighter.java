package com.example.ringside.model;


import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * A competitor: fixed attributes plus the runtime condition the engine mutates each tick.
 *
 * Every mutator clamps what it writes, so stamina and damage always stay within
 * their derived bounds and never go NaN. Hurt supersedes buzzed: the two flags are
 * never set together.
 */
public class Fighter {

    public static final String BUZZED_SOURCE = "buzzed";
    public static final String HURT_SOURCE = "hurt";
    public static final String POST_KNOCKDOWN_SOURCE = "post_knockdown";

    private static final int MAX_BUZZED_TICKS = 40;
    private static final int MIN_BUZZED_TICKS = 10;
    private static final int MAX_STUN_TICKS = 5;

    // Identity
    private final String id;
    private final String name;
    private final String nickname;
    private final PhysicalProfile physical;
    private final FoulTactics tactics;

    // Attributes
    private final Map<Attribute, Integer> baseAttributes = new EnumMap<>(Attribute.class);
    private final Map<Attribute, Double> modifiedAttributes = new EnumMap<>(Attribute.class);

    // State
    private FighterState state = FighterState.NEUTRAL;
    private FighterSubState subState;

    // Stamina
    private final double maxStamina;
    private double stamina;
    private StaminaTier staminaTier = StaminaTier.FRESH;

    // Damage
    private final double maxHeadDamage;
    private final double maxBodyDamage;
    private double headDamage;
    private double bodyDamage;
    private final List<Cut> cuts = new ArrayList<>();

    // Buzzed
    private boolean buzzed;
    private int buzzedSeverity;
    private double buzzedDuration;
    private double buzzedRecoveryRate;

    // Stun
    private int stunLevel;
    private int stunDuration;

    // Hurt
    private boolean hurt;
    private double hurtDuration;
    private double hurtElapsed;

    // Knockdowns
    private int knockdownsThisRound;
    private int knockdownsTotal;

    // Modifiers
    private final List<Modifier> modifiers = new ArrayList<>();
    private final Map<ModifierTarget, Double> effectModifiers = new EnumMap<>(ModifierTarget.class);
    private long conditionClock;

    // Statistics
    private FighterStats roundStats = new FighterStats();
    private final FighterStats fightStats = new FighterStats();
    private final List<FighterStats> roundHistory = new ArrayList<>();

    private Position position = Position.CENTER;

    public Fighter(String id, String name, String nickname, PhysicalProfile physical,
                   Map<Attribute, Integer> attributes, FoulTactics tactics) {
        if (name == null || name.isBlank()) {
            throw new InvalidFightConfigurationException("Fighter name is required");
        }
        this.name = name.trim();
        this.id = (id == null || id.isBlank()) ? deriveId(this.name) : id.trim();
        this.nickname = nickname;
        this.physical = physical == null ? PhysicalProfile.defaults() : physical;
        this.tactics = tactics == null ? FoulTactics.clean() : tactics;

        for (Attribute a : Attribute.values()) {
            Integer v = attributes == null ? null : attributes.get(a);
            baseAttributes.put(a, Attribute.clamp(v == null ? a.getDefaultValue() : v));
        }

        this.maxStamina = computeMaxStamina();
        this.stamina = maxStamina;
        double[] maxDamage = computeMaxDamage();
        this.maxHeadDamage = maxDamage[0];
        this.maxBodyDamage = maxDamage[1];
        updateModifiedAttributes();
    }

    public Fighter(String name, Map<Attribute, Integer> attributes) {
        this(null, name, null, null, attributes, null);
    }

    /**
     * Lower-case the name and collapse every run of non-alphanumerics into '-'.
     */
    public static String deriveId(String name) {
        String id = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        id = id.replaceAll("^-+|-+$", "");
        return id.isEmpty() ? "fighter" : id;
    }

    // ===== Derived maxima =====

    private double computeMaxStamina() {
        double base = 80 + getAttribute(Attribute.CARDIO) * 0.4;
        double weightMod = 1 - (physical.weight() - 70) * 0.002;
        int age = physical.age();
        double ageMod;
        if (age <= 28) ageMod = 1.0;
        else if (age <= 32) ageMod = 0.97;
        else if (age <= 35) ageMod = 0.92;
        else if (age <= 38) ageMod = 0.85;
        else ageMod = 0.78;
        return Math.max(1, base * weightMod * ageMod * physical.bodyType().getStaminaModifier());
    }

    private double[] computeMaxDamage() {
        double w = physical.weight();
        double head;
        double body;
        if (w >= 90.7) { head = 350; body = 300; }
        else if (w >= 79.4) { head = 320; body = 280; }
        else if (w >= 76.2) { head = 300; body = 260; }
        else if (w >= 72.6) { head = 280; body = 240; }
        else if (w >= 66.7) { head = 260; body = 220; }
        else if (w >= 61.2) { head = 240; body = 200; }
        else if (w >= 57.2) { head = 220; body = 180; }
        else if (w >= 53.5) { head = 200; body = 170; }
        else { head = 180; body = 150; }
        double chinMod = 0.9 + getAttribute(Attribute.CHIN) / 400.0;
        return new double[] { Math.round(head * chinMod), body };
    }

    // ===== Attributes =====

    public int getAttribute(Attribute attribute) {
        return baseAttributes.get(attribute);
    }

    /** Value after fatigue, condition and effect modifiers. Combat logic reads this. */
    public double getModifiedAttribute(Attribute attribute) {
        Double v = modifiedAttributes.get(attribute);
        return v == null ? getAttribute(attribute) : v;
    }

    public Map<Attribute, Double> getModifiedAttributes() {
        return Collections.unmodifiableMap(modifiedAttributes);
    }

    /**
     * Rebuild the modified-attribute snapshot from base values, the stamina-tier
     * fatigue penalty (softened by heart), the near-empty-tank chin penalty, the
     * fighter's own buffs and debuffs, and the effects-engine modifiers.
     */
    public void updateModifiedAttributes() {
        Map<Attribute, Double> factor = new EnumMap<>(Attribute.class);
        for (Attribute a : Attribute.values()) factor.put(a, 1.0);

        double heartFactor = Math.max(0.2, 1 - (getAttribute(Attribute.HEART) - 70) / 75.0);
        for (Map.Entry<ModifierTarget, Double> e : staminaTier.getPenalties().entrySet()) {
            applyPercent(factor, e.getKey(), Math.round(e.getValue() * heartFactor));
        }

        double staminaPct = getStaminaPercent();
        if (staminaPct <= 0.10) {
            applyPercent(factor, ModifierTarget.CHIN, -30 * (1 - staminaPct / 0.10));
        }

        for (Modifier m : modifiers) {
            for (Map.Entry<ModifierTarget, Double> e : m.effects().entrySet()) {
                applyPercent(factor, e.getKey(), e.getValue());
            }
        }
        for (Map.Entry<ModifierTarget, Double> e : effectModifiers.entrySet()) {
            applyPercent(factor, e.getKey(), e.getValue() * 100);
        }

        for (Attribute a : Attribute.values()) {
            double v = getAttribute(a) * factor.get(a);
            modifiedAttributes.put(a, Math.max(Attribute.MIN_VALUE, Math.min(Attribute.MAX_VALUE, v)));
        }
    }

    private static void applyPercent(Map<Attribute, Double> factor, ModifierTarget target, double percent) {
        if (Double.isNaN(percent) || percent == 0) return;
        double mult = Math.max(0, 1 + percent / 100.0);
        for (Attribute a : target.getAttributes()) {
            factor.put(a, factor.get(a) * mult);
        }
    }

    /**
     * Replace the modifiers contributed by the effects engine (fractions, 0.1 = +10%).
     */
    public void setEffectModifiers(Map<ModifierTarget, Double> modifiers) {
        effectModifiers.clear();
        if (modifiers != null) effectModifiers.putAll(modifiers);
    }

    // ===== State =====

    public FighterState getState() { return state; }
    public FighterSubState getSubState() { return subState; }

    /**
     * Move to a new primary state, checked against the transition table.
     * @throws IllegalStateException if the table forbids it or the sub-state does not fit
     */
    public void transitionTo(FighterState next, FighterSubState nextSub) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(name + " cannot go from " + state + " to " + next);
        }
        if (nextSub != null && !nextSub.isValidFor(next)) {
            throw new IllegalStateException("Sub-state " + nextSub + " does not belong to " + next);
        }
        state = next;
        subState = nextSub;
    }

    public void transitionTo(FighterState next) {
        transitionTo(next, null);
    }

    public boolean isDown() {
        return state.isDown();
    }

    // ===== Stamina =====

    public double getStamina() { return stamina; }
    public double getMaxStamina() { return maxStamina; }
    public StaminaTier getStaminaTier() { return staminaTier; }

    public double getStaminaPercent() {
        return stamina / maxStamina;
    }

    public void setStamina(double value) {
        if (Double.isNaN(value)) return;
        stamina = Math.max(0, Math.min(maxStamina, value));
        staminaTier = StaminaTier.forPercent(getStaminaPercent());
    }

    public void spendStamina(double amount) {
        if (Double.isNaN(amount) || amount <= 0) return;
        setStamina(stamina - amount);
    }

    public void recoverStamina(double amount) {
        if (Double.isNaN(amount) || amount <= 0) return;
        setStamina(stamina + amount);
    }

    // ===== Damage =====

    /**
     * Add head or body damage, clamped to the maximum. Body damage also drains
     * stamina at half the amount.
     */
    public void takeDamage(double amount, HitLocation location) {
        if (Double.isNaN(amount) || amount <= 0) return;
        if (location == HitLocation.BODY) {
            bodyDamage = Math.min(maxBodyDamage, bodyDamage + amount);
            spendStamina(amount * 0.5);
        } else {
            headDamage = Math.min(maxHeadDamage, headDamage + amount);
        }
    }

    public double getHeadDamage() { return headDamage; }
    public double getBodyDamage() { return bodyDamage; }
    public double getMaxHeadDamage() { return maxHeadDamage; }
    public double getMaxBodyDamage() { return maxBodyDamage; }

    public double getHeadDamagePercent() {
        return headDamage / maxHeadDamage;
    }

    public double getBodyDamagePercent() {
        return bodyDamage / maxBodyDamage;
    }

    /** Head damage ratio; the one knockout and stoppage formulas read. */
    public double getDamagePercent() {
        return getHeadDamagePercent();
    }

    // ===== Cuts =====

    /**
     * Open a cut, or deepen the one already at that location.
     * Eye-area cuts carry a permanent vision debuff.
     * @return the cut as it now stands
     */
    public Cut addCut(CutLocation location, int roundNumber) {
        for (int i = 0; i < cuts.size(); i++) {
            Cut existing = cuts.get(i);
            if (existing.location() == location && !existing.swelling()) {
                Cut deeper = existing.deepen();
                cuts.set(i, deeper);
                refreshVisionDebuff(deeper);
                return deeper;
            }
        }
        Cut cut = new Cut(location, 1, false, roundNumber);
        cuts.add(cut);
        refreshVisionDebuff(cut);
        return cut;
    }

    public Cut addSwelling(CutLocation location, int severity, int roundNumber) {
        Cut swelling = new Cut(location, severity, true, roundNumber);
        cuts.add(swelling);
        if (location.isEyeArea()) {
            addModifier(new Modifier("swelling_" + location.name().toLowerCase(Locale.ROOT), true,
                Modifier.effects(ModifierTarget.VISION, -swelling.severity() * 8), 0));
        }
        return swelling;
    }

    private void refreshVisionDebuff(Cut cut) {
        if (!cut.location().isEyeArea()) return;
        String source = "cut_" + cut.location().name().toLowerCase(Locale.ROOT);
        removeModifiers(source);
        addModifier(new Modifier(source, true, Modifier.effects(ModifierTarget.VISION, -cut.severity() * 5), 0));
    }

    public List<Cut> getCuts() {
        return Collections.unmodifiableList(cuts);
    }

    public int getWorstCutSeverity() {
        int worst = 0;
        for (Cut c : cuts) {
            if (!c.swelling()) worst = Math.max(worst, c.severity());
        }
        return worst;
    }

    // ===== Buzzed =====

    /**
     * Daze the fighter. A second call while still buzzed compounds: the spell is
     * extended, severity can climb and recovery slows further.
     * @return whether the buzz was applied (it is not while hurt or down)
     */
    public boolean setBuzzed(double damage, PunchType punchType) {
        if (hurt || isDown()) return false;

        int severity = damage >= 5 ? 3 : damage >= 3.5 ? 2 : 1;
        double chinMod = 1 - getAttribute(Attribute.CHIN) / 200.0;
        double duration = (10 + severity * 8) * (0.6 + chinMod * 0.6);
        if (punchType != null && punchType.extendsBuzz()) duration *= 1.4;
        double dmgPct = getDamagePercent();
        if (dmgPct > 0.6) duration *= 1.3 + (dmgPct - 0.6);
        else if (dmgPct > 0.3) duration *= 1 + (dmgPct - 0.3) * 0.5;
        int ticks = (int) Math.max(MIN_BUZZED_TICKS, Math.min(MAX_BUZZED_TICKS, Math.round(duration)));

        double recovery = 0.7 + getAttribute(Attribute.CHIN) / 300.0 + getAttribute(Attribute.CARDIO) / 600.0;
        double staminaPct = getStaminaPercent();
        if (staminaPct < 0.3) recovery *= 0.5;
        else if (staminaPct < 0.5) recovery *= 0.7;

        if (buzzed) {
            buzzedDuration = Math.min(MAX_BUZZED_TICKS, buzzedDuration + Math.round(0.75 * ticks));
            if (severity >= buzzedSeverity) buzzedSeverity = Math.min(3, severity + 1);
            buzzedRecoveryRate *= 0.85;
        } else {
            buzzed = true;
            buzzedSeverity = severity;
            buzzedDuration = ticks;
            buzzedRecoveryRate = recovery;
            forceState(FighterState.BUZZED, DefensiveSubState.HIGH_GUARD);
        }
        removeModifiers(BUZZED_SOURCE);
        int s = buzzedSeverity;
        addModifier(new Modifier(BUZZED_SOURCE, true, Modifier.effects(
            ModifierTarget.SPEED, -10 * s,
            ModifierTarget.POWER, -5 * s,
            ModifierTarget.DEFENSE, -12 * s,
            ModifierTarget.ACCURACY, -10 * s), 0));
        return true;
    }

    /**
     * Run down the buzzed timer; a good chin and composure can shake it off early.
     */
    public void updateBuzzed(Random rng) {
        if (!buzzed) return;
        buzzedDuration -= buzzedRecoveryRate;
        if (buzzedDuration > 2) {
            double shakeOff = (getAttribute(Attribute.CHIN) + getAttribute(Attribute.COMPOSURE)) / 800.0;
            if (rng.nextDouble() < shakeOff) buzzedDuration = Math.max(1, buzzedDuration - 2);
        }
        if (buzzedDuration <= 0) clearBuzzed();
    }

    public void clearBuzzed() {
        if (!buzzed) return;
        buzzed = false;
        buzzedSeverity = 0;
        buzzedDuration = 0;
        buzzedRecoveryRate = 0;
        removeModifiers(BUZZED_SOURCE);
        if (state == FighterState.BUZZED) forceState(FighterState.NEUTRAL, null);
    }

    public boolean isBuzzed() { return buzzed; }
    public int getBuzzedSeverity() { return buzzedSeverity; }
    public double getBuzzedDuration() { return buzzedDuration; }
    public double getBuzzedRecoveryRate() { return buzzedRecoveryRate; }

    public double getBuzzedVulnerability() {
        return buzzed ? 1 + buzzedSeverity * 0.25 : 1.0;
    }

    // ===== Stun =====

    public void applyStun(double damage, PunchType punchType) {
        if (Double.isNaN(damage) || damage <= 0) return;
        double duration = Math.ceil(damage / 2.5) * (1 - getAttribute(Attribute.CHIN) / 200.0);
        if (punchType != null && punchType.extendsStun()) duration *= 1.3;
        int ticks = (int) Math.max(1, Math.min(MAX_STUN_TICKS, Math.round(duration)));
        int level = damage >= 5 ? 2 : 1;
        if (stunLevel == 0 || level > stunLevel || ticks > stunDuration) {
            stunLevel = Math.max(level, stunLevel);
            stunDuration = Math.max(ticks, stunDuration);
        }
    }

    /**
     * Decrement the stun by a tick and the hurt timer by {@code tickRate} seconds.
     * Time spent hurt keeps accumulating until the spell ends.
     */
    public void updateStun(double tickRate) {
        if (stunDuration > 0) {
            stunDuration--;
            if (stunDuration == 0) stunLevel = 0;
        }
        if (hurt) {
            hurtElapsed += tickRate;
            hurtDuration -= tickRate;
            if (hurtDuration <= 0) clearHurt();
        }
    }

    /**
     * A heavily stunned fighter cannot throw; a lightly stunned one gets a punch off 30% of the time.
     */
    public boolean canThrowPunch(Random rng) {
        if (stunLevel >= 2) return false;
        if (stunLevel == 1) return rng.nextDouble() < 0.3;
        return true;
    }

    public int getStunLevel() { return stunLevel; }
    public int getStunDuration() { return stunDuration; }

    public double getStunVulnerability() {
        if (stunLevel >= 2) return 1.30;
        if (stunLevel == 1) return 1.15;
        return 1.0;
    }

    // ===== Hurt =====

    /**
     * Hurt the fighter for {@code durationSeconds}. Hurting a fighter who is already
     * hurt extends the current spell rather than starting a new one.
     */
    public void setHurt(double durationSeconds) {
        clearBuzzed();
        if (hurt) {
            hurtDuration = Math.max(hurtDuration, durationSeconds);
        } else {
            hurt = true;
            hurtDuration = Math.max(0, durationSeconds);
            hurtElapsed = 0;
        }
        if (!isDown()) forceState(FighterState.HURT, null);
        removeModifiers(HURT_SOURCE);
        addModifier(new Modifier(HURT_SOURCE, true, Modifier.effects(
            ModifierTarget.SPEED, -25,
            ModifierTarget.POWER, -15,
            ModifierTarget.DEFENSE, -30), 0));
    }

    public void clearHurt() {
        if (!hurt) return;
        hurt = false;
        hurtDuration = 0;
        hurtElapsed = 0;
        removeModifiers(HURT_SOURCE);
        if (state == FighterState.HURT) forceState(FighterState.NEUTRAL, null);
    }

    public boolean isHurt() { return hurt; }
    public double getHurtDuration() { return hurtDuration; }
    public double getHurtElapsed() { return hurtElapsed; }

    public double getTotalVulnerability() {
        double v = getBuzzedVulnerability() * getStunVulnerability();
        if (hurt) v *= 1.4;
        return v;
    }

    // ===== Knockdowns =====

    /**
     * Put the fighter down. Both knockdown counters go up; hurt and buzzed clear.
     */
    public void knockDown(boolean flash) {
        knockdownsThisRound++;
        knockdownsTotal++;
        buzzed = false;
        buzzedSeverity = 0;
        buzzedDuration = 0;
        removeModifiers(BUZZED_SOURCE);
        hurt = false;
        hurtDuration = 0;
        hurtElapsed = 0;
        removeModifiers(HURT_SOURCE);
        stunLevel = 0;
        stunDuration = 0;
        transitionTo(flash ? FighterState.FLASH_DOWN : FighterState.KNOCKED_DOWN);
    }

    public void getUp() {
        transitionTo(FighterState.RECOVERED);
    }

    public int getKnockdownsThisRound() { return knockdownsThisRound; }
    public int getKnockdownsTotal() { return knockdownsTotal; }

    // ===== Modifiers =====

    public void addModifier(Modifier modifier) {
        if (modifier != null) modifiers.add(modifier);
    }

    /**
     * Attach a modifier that lasts {@code durationTicks} ticks of the condition clock.
     */
    public Modifier addTimedModifier(String source, boolean debuff, Map<ModifierTarget, Double> effects, int durationTicks) {
        Modifier m = new Modifier(source, debuff, effects, conditionClock + Math.max(1, durationTicks));
        modifiers.add(m);
        return m;
    }

    public boolean removeModifiers(String source) {
        return modifiers.removeIf(m -> m.source().equals(source));
    }

    public boolean hasModifier(String source) {
        for (Modifier m : modifiers) {
            if (m.source().equals(source)) return true;
        }
        return false;
    }

    public List<Modifier> getModifiers() {
        return Collections.unmodifiableList(modifiers);
    }

    public List<Modifier> getBuffs() {
        List<Modifier> out = new ArrayList<>();
        for (Modifier m : modifiers) if (!m.debuff()) out.add(m);
        return out;
    }

    public List<Modifier> getDebuffs() {
        List<Modifier> out = new ArrayList<>();
        for (Modifier m : modifiers) if (m.debuff()) out.add(m);
        return out;
    }

    /** Advance the condition clock one tick and drop expired modifiers. */
    public void tickConditions() {
        conditionClock++;
        Iterator<Modifier> it = modifiers.iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(conditionClock)) it.remove();
        }
    }

    public long getConditionClock() { return conditionClock; }

    // ===== Rounds =====

    /**
     * Fresh round: neutral state, round knockdown counter zeroed, dazes cleared,
     * and a new ledger attached.
     */
    public void resetForRound(FighterStats newRoundStats) {
        roundStats = newRoundStats == null ? new FighterStats() : newRoundStats;
        knockdownsThisRound = 0;
        clearHurt();
        clearBuzzed();
        stunLevel = 0;
        stunDuration = 0;
        forceState(FighterState.NEUTRAL, null);
    }

    /**
     * Corner work between rounds. Recovery scales with the recovery-rate attribute
     * and corner skill, is reduced by body damage and age, and tops out at half the
     * tank. Head damage then heals 10% and body damage 5%.
     */
    public double applyBetweenRoundRecovery(int cornerSkill) {
        double rate = getAttribute(Attribute.RECOVERY_RATE) / 100.0;
        double cornerBonus = 1 + cornerSkill / 100.0 * 0.1;
        double bodyPenalty = Math.max(0, 1 - getBodyDamagePercent() * 100 / 200.0);
        int age = physical.age();
        double ageMod = age <= 25 ? 1.0 : age <= 30 ? 0.95 : age <= 35 ? 0.85 : 0.75;
        double recovery = maxStamina * rate * 0.4 * cornerBonus * bodyPenalty * ageMod;
        recovery = Math.min(recovery, maxStamina * 0.5);
        double before = stamina;
        recoverStamina(recovery);
        headDamage = Math.max(0, headDamage * 0.9);
        bodyDamage = Math.max(0, bodyDamage * 0.95);
        updateModifiedAttributes();
        return stamina - before;
    }

    // ===== Statistics =====

    /** The live ledger of the current round (owned by the round). */
    public FighterStats getRoundStats() { return roundStats; }
    public FighterStats getFightStats() { return fightStats; }

    public List<FighterStats> getRoundHistory() {
        return Collections.unmodifiableList(roundHistory);
    }

    /** Fold a finished round's ledger into the fight totals. */
    public void archiveRound(FighterStats finished) {
        roundHistory.add(finished.copy());
        fightStats.accumulate(finished);
    }

    // ===== Identity & position =====

    public String getId() { return id; }
    public String getName() { return name; }
    public String getNickname() { return nickname; }
    public PhysicalProfile getPhysical() { return physical; }
    public FoulTactics getTactics() { return tactics; }

    public Position getPosition() { return position; }

    public void setPosition(Position position) {
        if (position != null) this.position = position;
    }

    private void forceState(FighterState next, FighterSubState nextSub) {
        state = next;
        subState = nextSub;
    }

    @Override
    public String toString() {
        return name + " [" + state.getDisplayName() + "]";
    }
}
