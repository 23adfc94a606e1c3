package com.aiinpocket.mystica.service.combat;

import org.springframework.stereotype.Component;

import java.util.SplittableRandom;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

/**
 * 戰鬥用亂數來源。
 * 正式環境每次呼叫都取 {@link ThreadLocalRandom#current()}；測試可用固定種子重現結果。
 */
@Component
public class RandomSource {

    private final RandomGenerator fixedGenerator;

    public RandomSource() {
        this.fixedGenerator = null;
    }

    private RandomSource(RandomGenerator fixedGenerator) {
        this.fixedGenerator = fixedGenerator;
    }

    public static RandomSource seeded(long seed) {
        return new RandomSource(new SplittableRandom(seed));
    }

    /** [0, 1) 均勻分布 */
    public double nextDouble() {
        return generator().nextDouble();
    }

    /** [min, max] 均勻分布的整數（含兩端） */
    public int nextIntInclusive(int min, int max) {
        return generator().nextInt(min, max + 1);
    }

    private RandomGenerator generator() {
        return fixedGenerator != null ? fixedGenerator : ThreadLocalRandom.current();
    }
}
