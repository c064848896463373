package org.soulwars.runtime.systems;

import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.soulwars.runtime.World;
import org.soulwars.runtime.config.GameConfig;
import org.soulwars.runtime.event.GameEvent;
import org.soulwars.runtime.model.Buff;
import org.soulwars.runtime.model.BuffEffect;
import org.soulwars.runtime.model.BuffId;
import org.soulwars.runtime.model.BuffSource;
import org.soulwars.runtime.model.DayPhase;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.model.Soul;

/**
 * Computes the time-of-day phase from the world's start time and grants the favoured faction its buffs.
 * <p>
 * The cycle runs DAY, DUSK, NIGHT, DAWN with the configured fractions. DAY favours Light, NIGHT favours Dark.
 * On every phase change all day/night buffs are cleared and the favoured faction of the new phase, if any,
 * receives a speed/cast-time blessing and an energy buff.
 * </p>
 */
public final class DayNightSystem {

    private static final Logger LOG = LoggerFactory.getLogger(DayNightSystem.class);

    private final GameConfig.DayNightSettings settings;
    private final BuffManager buffs;
    private final World world;
    private final long cycleStart;

    private DayPhase phase = DayPhase.DAY;
    private double phaseProgress;
    private double cycleProgress;
    private double ambientLight;

    public DayNightSystem(World world, BuffManager buffs, long cycleStart) {
        this.settings = world.config().dayNight();
        this.buffs = buffs;
        this.world = world;
        this.cycleStart = cycleStart;
        this.ambientLight = settings.dayAmbientLight();
        if (settings.enabled()) {
            applyPhaseBuffs(cycleStart);
        }
    }

    /**
     * Advances the cycle to {@code now}. Emits {@code day_night_phase_change} when the phase changed.
     *
     * @return true if the phase changed
     */
    public boolean tick(long now) {
        if (!settings.enabled()) {
            return false;
        }
        long elapsed = Math.max(0, now - cycleStart);
        cycleProgress = (elapsed % settings.cycleDurationMs()) / (double) settings.cycleDurationMs();

        DayPhase previous = phase;
        computePhase(cycleProgress);
        updateAmbientLight();

        if (previous == phase) {
            return false;
        }
        applyPhaseBuffs(now);
        resetSleepAllowance();
        world.events().emit(new GameEvent.DayNightPhaseChanged(phase, ambientLight, cycleProgress));
        LOG.debug("Day/night phase changed {} -> {} (ambient light {})", previous, phase, ambientLight);
        return true;
    }

    private void computePhase(double progress) {
        double day = settings.dayFraction();
        double transition = settings.transitionFraction();
        double night = settings.nightFraction();
        if (progress < day) {
            phase = DayPhase.DAY;
            phaseProgress = progress / day;
        } else if (progress < day + transition) {
            phase = DayPhase.DUSK;
            phaseProgress = (progress - day) / transition;
        } else if (progress < day + transition + night) {
            phase = DayPhase.NIGHT;
            phaseProgress = (progress - day - transition) / night;
        } else {
            phase = DayPhase.DAWN;
            phaseProgress = transition <= 0 ? 1.0 : (progress - day - transition - night) / transition;
        }
    }

    private void updateAmbientLight() {
        double dayLight = settings.dayAmbientLight();
        double nightLight = settings.nightAmbientLight();
        ambientLight = switch (phase) {
            case DAY -> dayLight;
            case NIGHT -> nightLight;
            case DUSK -> dayLight - (dayLight - nightLight) * phaseProgress;
            case DAWN -> nightLight + (dayLight - nightLight) * phaseProgress;
        };
    }

    private void applyPhaseBuffs(long now) {
        buffs.clearSource(BuffSource.DAY_NIGHT);
        for (Faction faction : Faction.values()) {
            if (!phase.favours(faction)) {
                continue;
            }
            String prefix = phase == DayPhase.DAY ? "day" : "night";

            Map<BuffEffect, Double> blessing = new EnumMap<>(BuffEffect.class);
            blessing.put(BuffEffect.SPEED, settings.speedMultiplier());
            blessing.put(BuffEffect.CAST_TIME, settings.castTimeMultiplier());
            buffs.apply(new Buff(new BuffId(BuffSource.DAY_NIGHT, faction, prefix + "_blessing"),
                percent(settings.speedMultiplier()) + " speed, " + percent(2 - settings.castTimeMultiplier()) + " cast speed",
                blessing, now, Buff.PERMANENT));

            Map<BuffEffect, Double> energy = new EnumMap<>(BuffEffect.class);
            energy.put(BuffEffect.ENERGY, settings.energyMultiplier());
            buffs.apply(new Buff(new BuffId(BuffSource.DAY_NIGHT, faction, prefix + "_energy"),
                percent(settings.energyMultiplier()) + " energy collection", energy, now, Buff.PERMANENT));
        }
    }

    private static String percent(double multiplier) {
        long value = Math.round((multiplier - 1) * 100);
        return (value >= 0 ? "+" : "") + value + "%";
    }

    private void resetSleepAllowance() {
        for (Soul soul : world.souls()) {
            if (phase.favours(soul.faction())) {
                soul.resetSleepCycle();
            }
        }
    }

    public DayPhase phase() {
        return phase;
    }

    public double ambientLight() {
        return ambientLight;
    }

    public double cycleProgress() {
        return cycleProgress;
    }

    /**
     * @return true if souls of {@code faction} may go to sleep now
     */
    public boolean isRestPhaseFor(Faction faction) {
        return settings.enabled() && phase.isRestPhaseFor(faction);
    }
}
