package pokeai.engine.calc;

import pokeai.data.Capability;
import pokeai.data.Dex;
import pokeai.data.Effect;
import pokeai.data.EffectKind;
import pokeai.data.EffectTarget;
import pokeai.data.FormatRules;
import pokeai.data.Move;
import pokeai.data.MoveEffect;
import pokeai.data.MoveEffectKind;
import pokeai.data.Species;
import pokeai.data.StatusCondition;
import pokeai.data.TriggerPhase;
import pokeai.engine.action.ActionVisitor;
import pokeai.engine.action.BattleAction;
import pokeai.engine.action.DynamaxAction;
import pokeai.engine.action.MegaAction;
import pokeai.engine.action.MoveAction;
import pokeai.engine.action.PassAction;
import pokeai.engine.action.SwitchAction;
import pokeai.engine.action.TeraAction;
import pokeai.engine.action.ZMoveAction;
import pokeai.engine.effect.EffectContext;
import pokeai.engine.effect.EffectLookup;
import pokeai.engine.effect.FormeChanges;
import pokeai.engine.effect.StatusRules;
import pokeai.engine.error.InvalidActionException;
import pokeai.engine.error.MissingEntityException;
import pokeai.model.BattleState;
import pokeai.model.MoveSlot;
import pokeai.model.Pokemon;
import pokeai.model.Side;
import pokeai.model.SideId;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates candidate actions without changing anything. Invalid actions and missing Pokemon
 * produce an error result instead of an exception, so a whole batch can be evaluated at once.
 */
public final class OutcomeCalculator {
    private final Dex dex;
    private final EffectLookup effects;
    private final DamageCalculator damage;
    private final AccuracyCalculator accuracy;
    private final HazardCalculator hazards;
    private final StatCalculator stats;
    private final PriorityRules priorities;
    private final StatusRules statusRules;

    public OutcomeCalculator(Dex dex, EffectLookup effects) {
        this.dex = dex;
        this.effects = effects;
        this.damage = new DamageCalculator(effects);
        this.accuracy = new AccuracyCalculator(effects);
        this.hazards = new HazardCalculator(effects);
        this.stats = new StatCalculator(effects);
        this.priorities = new PriorityRules(effects);
        this.statusRules = new StatusRules(effects);
    }

    public DamageCalculator getDamageCalculator() {
        return damage;
    }

    public AccuracyCalculator getAccuracyCalculator() {
        return accuracy;
    }

    public HazardCalculator getHazardCalculator() {
        return hazards;
    }

    public StatCalculator getStatCalculator() {
        return stats;
    }

    public PriorityRules getPriorityRules() {
        return priorities;
    }

    public CalcResult evaluate(BattleState state, SideId side, BattleAction action, FormatRules format,
                               OpponentBelief belief) {
        try {
            return action.accept(new Evaluation(state, side, format, belief == null ? OpponentBelief.NONE : belief));
        } catch (InvalidActionException | MissingEntityException e) {
            return CalcResult.error(action.notation(), format.getId(), e.getKind(), e.getMessage());
        }
    }

    public List<CalcResult> evaluateAll(BattleState state, SideId side, List<BattleAction> actions,
                                        FormatRules format, OpponentBelief belief) {
        List<CalcResult> results = new ArrayList<>(actions.size());
        for (BattleAction action : actions) {
            results.add(evaluate(state, side, action, format, belief));
        }
        return results;
    }

    /** Speed comparison of the two actives from {@code side}'s point of view. */
    public SpeedCheck speedCheck(BattleState state, SideId side) {
        Side mine = state.getSide(side);
        Side theirs = state.getSide(side.opponent());
        if (mine.getActive() == null || theirs.getActive() == null) {
            throw new MissingEntityException("Both sides need an active Pokemon for a speed check");
        }
        return SpeedCheck.compare(stats.speed(state, mine, mine.getActive()),
                stats.speed(state, theirs, theirs.getActive()), state.isTrickRoom());
    }

    /** Best average damage one Pokemon can deal to another with its remaining moves. */
    private static final class BestAttack {
        private final DamageRoll roll;
        private final double accuracy;
        private final int priority;

        BestAttack(DamageRoll roll, double accuracy, int priority) {
            this.roll = roll;
            this.accuracy = accuracy;
            this.priority = priority;
        }

        double koChance() {
            return roll == null ? 0 : roll.ohkoProbability() * accuracy;
        }

        double expectedPercent() {
            if (roll == null) {
                return 0;
            }
            double capped = Math.min(roll.average(), roll.getDefenderHp());
            return roll.percentOfMax(capped) * accuracy;
        }
    }

    private final class Evaluation implements ActionVisitor<CalcResult> {
        private final BattleState state;
        private final SideId sideId;
        private final Side side;
        private final Side foeSide;
        private final FormatRules format;
        private final OpponentBelief belief;

        Evaluation(BattleState state, SideId sideId, FormatRules format, OpponentBelief belief) {
            this.state = state;
            this.sideId = sideId;
            this.side = state.getSide(sideId);
            this.foeSide = state.getSide(sideId.opponent());
            this.format = format;
            this.belief = belief;
        }

        @Override
        public CalcResult visitMove(MoveAction action) {
            Pokemon attacker = ownActive();
            Move move = resolveMove(attacker, action.getMoveId());
            MoveMode mode = attacker.isDynamaxed() ? MoveMode.MAX_MOVE : MoveMode.NORMAL;
            return evaluateAttack(action, attacker, AttackProfile.of(move, mode));
        }

        @Override
        public CalcResult visitTera(TeraAction action) {
            Pokemon attacker = ownActive();
            Move move = resolveMove(attacker, action.getMoveId());
            if (!format.allowsTera()) {
                throw new InvalidActionException("Format " + format.getId() + " has no terastallization");
            }
            if (side.isTeraUsed() || attacker.isTerastallized() || !attacker.getTera().isAvailable()) {
                throw new InvalidActionException(attacker.getName() + " cannot terastallize");
            }
            Pokemon tera = attacker.copy();
            tera.terastallize();
            CalcResult result = evaluateAttack(action, tera, AttackProfile.of(move));
            return result.tera(teraImpact(attacker, tera));
        }

        @Override
        public CalcResult visitMega(MegaAction action) {
            Pokemon attacker = ownActive();
            Move move = resolveMove(attacker, action.getMoveId());
            Species mega = dex.megaForme(attacker.getSpecies(), attacker.getItem());
            if (!format.allowsMega() || mega == null || side.isMegaUsed() || attacker.isMegaEvolved()) {
                throw new InvalidActionException(attacker.getName() + " cannot mega evolve");
            }
            Pokemon evolved = attacker.copy();
            FormeChanges.megaEvolve(evolved, mega);
            return evaluateAttack(action, evolved, AttackProfile.of(move));
        }

        @Override
        public CalcResult visitZMove(ZMoveAction action) {
            Pokemon attacker = ownActive();
            Move move = resolveMove(attacker, action.getMoveId());
            Effect crystal = effects.capability(attacker, Capability.Z_CRYSTAL,
                    EffectContext.of(state, attacker, foeSide.getActive()));
            if (!format.allowsZMove() || side.isZMoveUsed() || crystal == null || crystal.getType() != move.getType()) {
                throw new InvalidActionException(attacker.getName() + " cannot use a z-move with " + move.getName());
            }
            return evaluateAttack(action, attacker, AttackProfile.of(move, MoveMode.Z_MOVE));
        }

        @Override
        public CalcResult visitDynamax(DynamaxAction action) {
            Pokemon attacker = ownActive();
            Move move = resolveMove(attacker, action.getMoveId());
            if (!format.allowsDynamax() || side.isDynamaxUsed() || attacker.isDynamaxed()) {
                throw new InvalidActionException(attacker.getName() + " cannot dynamax");
            }
            Pokemon giant = attacker.copy();
            FormeChanges.dynamax(giant);
            return evaluateAttack(action, giant, AttackProfile.of(move, MoveMode.MAX_MOVE));
        }

        @Override
        public CalcResult visitSwitch(SwitchAction action) {
            int slot = action.getSlot();
            if (slot < 0 || slot >= side.getTeam().size()) {
                throw new InvalidActionException("No team member in slot " + slot);
            }
            if (slot == side.getActiveIndex()) {
                throw new InvalidActionException("Slot " + slot + " is already active");
            }
            Pokemon incoming = side.getTeam().get(slot);
            if (incoming.isFainted()) {
                throw new InvalidActionException(incoming.getName() + " has fainted");
            }
            Pokemon outgoing = side.getActive();
            HazardOutcome hazard = hazards.onEntry(state, side, incoming);

            Pokemon afterHazards = incoming.copy();
            afterHazards.setHp(Math.max(0, incoming.getHp() - hazard.damageHp(incoming.getMaxHp())));
            if (hazard.getStatus() != StatusCondition.NONE) {
                afterHazards.setStatus(hazard.getStatus());
            }

            CalcResult result = new CalcResult(action.notation(), format.getId())
                    .accuracy(1.0)
                    .priority(PriorityRules.SWITCH_PRIORITY)
                    .hazardDamage(hazard.getDamagePercent())
                    .statusChance(hazard.getStatus() != StatusCondition.NONE ? 1.0 : 0.0);

            Pokemon foe = foeActiveOrNull();
            double regenerated = outgoing == null || outgoing.isFainted() ? 0 : switchOutHealPercent(outgoing);
            if (foe == null || foe.isFainted()) {
                return result.expected(afterHazards.isFainted() ? 0 : 1, regenerated - hazard.getDamagePercent());
            }
            result.speedCheck(SpeedCheck.compare(stats.speed(state, side, afterHazards),
                    stats.speed(state, foeSide, foe), state.isTrickRoom()));
            BestAttack incomingHit = bestAttack(foe, foeSide, afterHazards, side);
            double survival = afterHazards.isFainted() ? 0 : 1 - incomingHit.koChance();
            double gain = regenerated - hazard.getDamagePercent() - incomingHit.expectedPercent();
            return result.expected(clamp(survival), gain);
        }

        @Override
        public CalcResult visitPass(PassAction action) {
            CalcResult result = new CalcResult(action.notation(), format.getId());
            Pokemon mine = side.getActive();
            Pokemon foe = foeActiveOrNull();
            if (mine == null || mine.isFainted() || foe == null || foe.isFainted()) {
                return result.expected(mine == null || mine.isFainted() ? 0 : 1, 0);
            }
            BestAttack incoming = bestAttack(foe, foeSide, mine, side);
            return result.speedCheck(speedCheck(state, sideId))
                    .expected(clamp(1 - incoming.koChance()), -incoming.expectedPercent());
        }

        private CalcResult evaluateAttack(BattleAction action, Pokemon attacker, AttackProfile attack) {
            Pokemon defender = foeActive();
            CalcResult result = new CalcResult(action.notation(), format.getId());

            DamageRoll roll = damage.calculate(state, attacker, side, defender, foeSide, attack, false);
            double hitChance = accuracy.accuracy(state, attacker, defender, attack);
            int priority = priorities.priority(state, attacker, defender, attack);
            SpeedCheck speed = SpeedCheck.compare(stats.speed(state, side, attacker),
                    stats.speed(state, foeSide, defender), state.isTrickRoom());
            boolean immune = attack.getMove().getTarget().targetsFoe()
                    && (roll.isImmune() || damage.isImmune(state, defender, attacker, attack));

            result.damage(DamageSummary.of(roll), roll.ohkoProbability(), roll.twoHkoProbability())
                    .accuracy(hitChance)
                    .priority(priority)
                    .speedCheck(speed)
                    .effectiveness(immune ? 0 : roll.getEffectiveness())
                    .hazardDamage(hazards.onEntry(state, side, attacker).getDamagePercent())
                    .statusChance(immune ? 0 : statusChance(attacker, defender, attack, hitChance));

            BestAttack ours = new BestAttack(attack.isDamaging() ? roll : null, hitChance, priority);
            BestAttack theirs = bestAttack(defender, foeSide, attacker, side);
            double firstChance = actsFirstChance(priority, theirs.priority, speed);
            double ourKo = ours.koChance();
            double survival = 1 - theirs.koChance() * (firstChance * (1 - ourKo) + (1 - firstChance));
            double theirActs = firstChance * (1 - ourKo) + (1 - firstChance);
            double gain = ours.expectedPercent() - theirs.expectedPercent() * theirActs;
            return result.expected(clamp(survival), gain);
        }

        private double statusChance(Pokemon attacker, Pokemon defender, AttackProfile attack, double hitChance) {
            double best = 0;
            for (MoveEffect effect : attack.effects()) {
                if (effect.getKind() != MoveEffectKind.INFLICT_STATUS || effect.getTarget() != EffectTarget.FOE) {
                    continue;
                }
                if (!statusRules.canInflict(state, defender, effect.getStatus(), attacker)) {
                    continue;
                }
                if (effect.getStatus() == StatusCondition.SLEEP && format.hasSleepClause()
                        && statusRules.sleepClauseBlocks(foeSide)) {
                    continue;
                }
                best = Math.max(best, effect.getChance() * hitChance);
            }
            return clamp(best);
        }

        private TeraImpact teraImpact(Pokemon before, Pokemon after) {
            Pokemon defender = foeActive();
            List<String> gained = new ArrayList<>();
            List<String> lost = new ArrayList<>();
            double bestBefore = 0;
            double bestAfter = 0;
            for (MoveSlot slot : before.getMoves()) {
                Move move = dex.move(slot.getMoveId());
                if (move == null || !move.isDamaging()) {
                    continue;
                }
                EffectContext beforeCtx = EffectContext.of(state, before, defender);
                EffectContext afterCtx = EffectContext.of(state, after, defender);
                double stabBefore = damage.stab(before, move.getType(), beforeCtx);
                double stabAfter = damage.stab(after, move.getType(), afterCtx);
                if (stabAfter > 1.0 && stabBefore == 1.0) {
                    gained.add(move.getId());
                } else if (stabAfter == 1.0 && stabBefore > 1.0) {
                    lost.add(move.getId());
                }
                AttackProfile attack = AttackProfile.of(move);
                bestBefore = Math.max(bestBefore, expectedPercent(before, defender, attack));
                bestAfter = Math.max(bestAfter, expectedPercent(after, defender, attack));
            }
            double incomingBefore = bestAttack(defender, foeSide, before, side).expectedPercent();
            double incomingAfter = bestAttack(defender, foeSide, after, side).expectedPercent();
            return new TeraImpact(after.getTera().getType(), gained, lost, bestBefore, bestAfter,
                    incomingBefore, incomingAfter);
        }

        private double expectedPercent(Pokemon attacker, Pokemon defender, AttackProfile attack) {
            DamageRoll roll = damage.calculate(state, attacker, side, defender, foeSide, attack, false);
            return roll.percentOfMax(roll.average()) * accuracy.accuracy(state, attacker, defender, attack);
        }

        private BestAttack bestAttack(Pokemon attacker, Side attackerSide, Pokemon defender, Side defenderSide) {
            BestAttack best = new BestAttack(null, 0, 0);
            double bestExpected = -1;
            MoveMode mode = attacker.isDynamaxed() ? MoveMode.MAX_MOVE : MoveMode.NORMAL;
            for (MoveSlot slot : attacker.getMoves()) {
                Move move = dex.move(slot.getMoveId());
                if (move == null || !slot.hasPp() || !move.isDamaging()) {
                    continue;
                }
                AttackProfile attack = AttackProfile.of(move, mode);
                DamageRoll roll = damage.calculate(state, attacker, attackerSide, defender, defenderSide, attack, false);
                double hit = accuracy.accuracy(state, attacker, defender, attack);
                double expected = roll.average() * hit;
                if (expected > bestExpected) {
                    bestExpected = expected;
                    best = new BestAttack(roll, hit, priorities.priority(state, attacker, defender, attack));
                }
            }
            return best;
        }

        private double switchOutHealPercent(Pokemon outgoing) {
            EffectContext ctx = EffectContext.of(state, outgoing, foeActiveOrNull());
            double healed = 0;
            for (Effect effect : effects.active(TriggerPhase.SWITCH_OUT, outgoing, ctx)) {
                if (effect.getKind() == EffectKind.HEAL) {
                    healed += effect.getValue();
                }
            }
            double missing = 1.0 - outgoing.getHpFraction();
            return 100.0 * Math.min(healed, missing);
        }

        private Pokemon ownActive() {
            Pokemon active = side.getActive();
            if (active == null) {
                throw new MissingEntityException(side.getName() + " has no active Pokemon");
            }
            if (active.isFainted()) {
                throw new InvalidActionException(active.getName() + " has fainted and must be replaced");
            }
            return active;
        }

        private Pokemon foeActiveOrNull() {
            Pokemon foe = foeSide.getActive();
            if (foe == null) {
                return null;
            }
            String believed = foe.getItem() == null ? belief.likelyItem(foe.getSpecies()) : null;
            if (believed == null) {
                return foe;
            }
            Pokemon assumed = foe.copy();
            assumed.setItem(believed);
            return assumed;
        }

        private Pokemon foeActive() {
            Pokemon foe = foeActiveOrNull();
            if (foe == null) {
                throw new MissingEntityException(foeSide.getName() + " has no active Pokemon");
            }
            if (foe.isFainted()) {
                throw new InvalidActionException("No target: " + foe.getName() + " has fainted");
            }
            return foe;
        }

        private Move resolveMove(Pokemon attacker, String moveId) {
            Move move = dex.move(moveId);
            if (move == null) {
                throw new InvalidActionException("Unknown move " + moveId);
            }
            if (move.isStruggle()) {
                if (attacker.hasUsableMove()) {
                    throw new InvalidActionException("Struggle is only available when no move has PP");
                }
                return move;
            }
            if (attacker.findMove(move.getId()) == null) {
                throw new InvalidActionException(attacker.getName() + " does not know " + move.getName());
            }
            return move;
        }
    }

    /** Probability that an action with priority {@code mine} goes before one with {@code theirs}. */
    static double actsFirstChance(int mine, int theirs, SpeedCheck speed) {
        if (mine != theirs) {
            return mine > theirs ? 1 : 0;
        }
        if (speed.isSpeedTie()) {
            return 0.5;
        }
        return speed.isFaster() ? 1 : 0;
    }

    private static double clamp(double p) {
        return AccuracyCalculator.clamp(p);
    }
}
