package com.secondhand.condition;

import com.secondhand.config.MarketConfig;
import com.secondhand.util.Randomization;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.Arrays;
import java.util.List;

/**
 * Produces internally consistent used-item records from a quality tier and an agent tier.
 *
 * <p>Draw order for one item:
 * <ol>
 *   <li>generation class, weighted by agent tier (unless forced)</li>
 *   <li>age within the class range, then yearly hours within the class range</li>
 *   <li>damage and wear within the quality tier range, scaled by the agent tier multiplier
 *       and clamped to [0.01, 0.95]</li>
 *   <li>price multiplier within the quality tier range, then the age discount</li>
 *   <li>hidden quality around {@code 1 - damage}</li>
 *   <li>reliability scores from damage</li>
 * </ol>
 * Given a seeded {@link Randomization} the output is fully deterministic.
 */
@Slf4j
@Singleton
public class ConditionGenerator {

    public static final double MIN_DEGRADATION = 0.01;
    public static final double MAX_DEGRADATION = 0.95;

    /**
     * Price lost per year of age.
     */
    public static final double AGE_DISCOUNT_PER_YEAR = 0.03;

    public static final double MAX_AGE_DISCOUNT = 0.25;

    /**
     * Price never drops below this fraction of the base price.
     */
    public static final double PRICE_FLOOR = 0.05;

    private static final List<Generation> GENERATIONS = Arrays.asList(Generation.values());

    private final Randomization randomization;
    private final MarketConfig config;

    @Inject
    public ConditionGenerator(Randomization randomization, MarketConfig config) {
        this.randomization = randomization;
        this.config = config;
    }

    /**
     * Generate from raw tier indices. Unknown indices fall back to
     * {@link QualityTier#FALLBACK} and {@link AgentTier#FALLBACK}.
     */
    public GeneratedCondition generate(long basePrice, int qualityIndex, int agentIndex) {
        return generate(basePrice, QualityTier.fromIndexOrFallback(qualityIndex),
                AgentTier.fromIndexOrFallback(agentIndex), null);
    }

    /**
     * Generate one used-item record.
     *
     * @param basePrice        new price of the category
     * @param quality          requested quality tier
     * @param agent            agent tier doing the finding
     * @param forcedGeneration generation class to use instead of a weighted draw, or null
     * @return the generated record
     */
    public GeneratedCondition generate(long basePrice, QualityTier quality, AgentTier agent,
                                       @Nullable Generation forcedGeneration) {
        Generation generation = forcedGeneration != null
                ? forcedGeneration
                : randomization.weightedChoiceItem(GENERATIONS, agent.getGenerationWeights());

        int age = randomization.uniformRandomInt(generation.getMinAge(), generation.getMaxAge());
        int hoursPerYear = randomization.uniformRandomInt(
                generation.getMinHoursPerYear(), generation.getMaxHoursPerYear());
        int operatingHours = age * hoursPerYear;

        double damage = scaleDegradation(
                randomization.uniformRandom(quality.getDamageMin(), quality.getDamageMax()), agent);
        double wear = scaleDegradation(
                randomization.uniformRandom(quality.getWearMin(), quality.getWearMax()), agent);

        double priceMultiplier = randomization.uniformRandom(
                quality.getPriceMultiplierMin(), quality.getPriceMultiplierMax());
        long price = price(basePrice, priceMultiplier, age);

        double hiddenQuality = drawHiddenQuality(damage);
        ReliabilityScores reliability = drawReliability(damage);

        log.debug("Generated {} item: age={} hours={} damage={} wear={} price={} (base {}, {} via {})",
                generation, age, operatingHours,
                String.format("%.3f", damage), String.format("%.3f", wear),
                price, basePrice, quality, agent);

        return GeneratedCondition.builder()
                .generation(generation)
                .age(age)
                .operatingHours(operatingHours)
                .damage(damage)
                .wear(wear)
                .priceMultiplier(priceMultiplier)
                .price(price)
                .hiddenQuality(hiddenQuality)
                .reliability(reliability)
                .build();
    }

    /**
     * Price after quality multiplier and age discount, floored at {@link #PRICE_FLOOR} of base.
     */
    public static long price(long basePrice, double priceMultiplier, int age) {
        double ageDiscount = Math.min(MAX_AGE_DISCOUNT, age * AGE_DISCOUNT_PER_YEAR);
        long raw = (long) Math.floor(basePrice * priceMultiplier * (1 - ageDiscount));
        long floor = (long) Math.ceil(basePrice * PRICE_FLOOR);
        return Math.max(raw, floor);
    }

    /**
     * Draw a hidden quality scalar biased toward {@code 1 - damage}.
     */
    public double drawHiddenQuality(double damage) {
        return randomization.gaussianRandom(1.0 - damage, config.hiddenQualityStdDev(), 0.0, 1.0);
    }

    /**
     * Draw per-system reliability from damage.
     */
    public ReliabilityScores drawReliability(double damage) {
        double base = 1.0 - damage;
        double engine = Randomization.clamp(base + randomization.uniformRandom(-0.20, 0.20), 0.1, 1.0);
        double hydraulic = Randomization.clamp(base + randomization.uniformRandom(-0.25, 0.25), 0.1, 1.0);
        double electrical = Randomization.clamp(base + randomization.uniformRandom(-0.15, 0.15), 0.1, 1.0);
        return new ReliabilityScores(engine, hydraulic, electrical);
    }

    private static double scaleDegradation(double value, AgentTier agent) {
        return Randomization.clamp(value * agent.getConditionMultiplier(), MIN_DEGRADATION, MAX_DEGRADATION);
    }
}
