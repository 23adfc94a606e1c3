package com.aiinpocket.mystica.service.combat;

import com.aiinpocket.mystica.exception.GameDataException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * 加權隨機抽選（可重複抽中）。
 * 用於：遭遇池選怪（抽 1 次）、掉落表選材料/裝備、等級加權的稀有度抽選、敵人風格。
 *
 * <p>每次抽選取 r ∈ [0, 總權重)，依序累加權重，回傳第一個累計權重 ≥ r 的項目。
 * 權重為 0 或負數屬於資料錯誤，直接拋出例外，不會默默略過該項目。
 */
@Component
@RequiredArgsConstructor
public class WeightedRandomSelector {

    private final RandomSource random;

    public <T> T selectOne(List<T> entries, ToDoubleFunction<T> weightOf) {
        return select(entries, weightOf, 1).get(0);
    }

    public <T> List<T> select(List<T> entries, ToDoubleFunction<T> weightOf, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Draw count must not be negative: " + count);
        }
        double totalWeight = totalWeight(entries, weightOf);

        List<T> picked = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double r = random.nextDouble() * totalWeight;
            picked.add(pick(entries, weightOf, r));
        }
        return picked;
    }

    private <T> double totalWeight(List<T> entries, ToDoubleFunction<T> weightOf) {
        if (entries == null || entries.isEmpty()) {
            throw new GameDataException("Cannot select from an empty weighted list");
        }
        double total = 0;
        for (T entry : entries) {
            double weight = weightOf.applyAsDouble(entry);
            if (!(weight > 0) || Double.isInfinite(weight)) {
                throw new GameDataException("Invalid selection weight " + weight + " for " + entry);
            }
            total += weight;
        }
        return total;
    }

    private <T> T pick(List<T> entries, ToDoubleFunction<T> weightOf, double r) {
        double cumulative = 0;
        for (T entry : entries) {
            cumulative += weightOf.applyAsDouble(entry);
            if (cumulative >= r) {
                return entry;
            }
        }
        // 浮點累加誤差時歸給最後一項
        return entries.get(entries.size() - 1);
    }
}
