package org.soulwars.runtime.disaster;

import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.soulwars.runtime.model.Buff;
import org.soulwars.runtime.model.BuffEffect;
import org.soulwars.runtime.model.BuffId;
import org.soulwars.runtime.model.BuffSource;
import org.soulwars.runtime.model.Faction;
import org.soulwars.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;

/**
 * Freezing snow slows both factions and kills souls gradually: at any time during the occurrence,
 * {@code floor(populationAtStart * deathPercentage * progress)} souls have died, with at most one kill
 * round per {@code killIntervalMs}. The tick that reaches the end of the occurrence always kills up to the full
 * target, regardless of the interval.
 * <p>
 * Additional options: <b>killIntervalMs</b> (default 2000) and <b>speedMultiplier</b> (default 0.7).
 * </p>
 */
public class FreezingSnow extends AbstractDisaster {

    private static final Logger LOG = LoggerFactory.getLogger(FreezingSnow.class);

    public static final String NAME = "freezing_snow";
    private static final String BUFF_NAME = "frozen";

    private final long killIntervalMillis;
    private final double speedMultiplier;
    private long lastKillAt;

    public FreezingSnow(IRandomProvider random, Config options) {
        super(random, options);
        this.killIntervalMillis = options.hasPath("killIntervalMs") ? options.getLong("killIntervalMs") : 2000L;
        this.speedMultiplier = options.hasPath("speedMultiplier") ? options.getDouble("speedMultiplier") : 0.7;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> begin(DisasterContext context) {
        resetOccurrence(context);
        lastKillAt = context.now();
        for (Faction faction : Faction.values()) {
            Map<BuffEffect, Double> multipliers = new EnumMap<>(BuffEffect.class);
            multipliers.put(BuffEffect.SPEED, speedMultiplier);
            context.buffs().apply(new Buff(new BuffId(BuffSource.DISASTER, faction, BUFF_NAME),
                "Slowed by freezing snow", multipliers, context.now(), context.endsAt()));
        }
        LOG.debug("Freezing snow puts {} souls at risk", populationAtStart);
        return Map.of("deathPercentage", deathPercentage, "speedMultiplier", speedMultiplier);
    }

    @Override
    public void tick(DisasterContext context) {
        int targetDeaths = (int) Math.floor(populationAtStart * deathPercentage * context.progress());
        boolean finalRound = context.progress() >= 1.0;
        if (targetDeaths <= killed || (!finalRound && context.now() - lastKillAt < killIntervalMillis)) {
            return;
        }
        int victims = killUpTo(context, targetDeaths);
        lastKillAt = context.now();
        if (victims > 0) {
            LOG.debug("Freezing snow killed {} souls ({} so far)", victims, killed);
        }
    }

    @Override
    public void end(DisasterContext context) {
        for (Faction faction : Faction.values()) {
            context.buffs().remove(new BuffId(BuffSource.DISASTER, faction, BUFF_NAME));
        }
    }
}
