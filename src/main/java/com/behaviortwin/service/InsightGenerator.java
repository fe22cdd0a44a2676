package com.behaviortwin.service;

import com.behaviortwin.dto.SimulationParameters;
import com.behaviortwin.model.BrandShares;
import com.behaviortwin.model.EventType;
import com.behaviortwin.model.SegmentKey;
import com.behaviortwin.model.SegmentResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns the mean per-brand delta of a simulation into narrative statements. The general
 * statement for the event comes first, brand call-outs follow.
 */
public class InsightGenerator {

    public static final String FALLBACK_INSIGHT =
        "建議進行 A/B test 驗證模型預測";

    public List<String> generate(
            String eventType, Map<SegmentKey, SegmentResult> results, SimulationParameters params) {
        if (results.isEmpty()) {
            return List.of(FALLBACK_INSIGHT);
        }
        BrandShares mean = meanDelta(results.values());

        List<String> insights = new ArrayList<>();
        EventType.fromId(eventType).ifPresent(type -> {
            switch (type) {
                case PRICE_CHANGE -> priceChange(insights, mean, params);
                case PROMOTION -> promotion(insights, mean, params);
                case COMPETITION -> competition(insights, mean);
                case EXTERNAL -> insights.add("天氣/節慶因素帶動季節性消費調整");
            }
        });

        if (insights.isEmpty()) {
            insights.add(FALLBACK_INSIGHT);
        }
        return List.copyOf(insights);
    }

    /** Arithmetic mean of each brand's rounded delta across all results. */
    public BrandShares meanDelta(Collection<SegmentResult> results) {
        if (results.isEmpty()) {
            return new BrandShares(0.0, 0.0, 0.0);
        }
        double sevenEleven = 0.0;
        double familyMart = 0.0;
        double other = 0.0;
        for (SegmentResult result : results) {
            sevenEleven += result.delta().sevenEleven();
            familyMart += result.delta().familyMart();
            other += result.delta().other();
        }
        int n = results.size();
        return new BrandShares(sevenEleven / n, familyMart / n, other / n);
    }

    private void priceChange(List<String> insights, BrandShares mean, SimulationParameters params) {
        double price = params.getElectricityPrice();
        if (price <= SimulationParameters.NEUTRAL) {
            insights.add("電價維持不變，消費行為無顯著變化");
            return;
        }
        long increasePercent = Math.round((price - SimulationParameters.NEUTRAL) * 100.0);
        insights.add("電價調漲 " + increasePercent + "% 將導致外食預算緊縮");
        if (mean.other() > 0) {
            insights.add("平價品牌 Other 預估成長 " + format(mean.other()) + " 百分點");
        }
        if (mean.sevenEleven() < 0) {
            insights.add("7-11 預估下降 " + format(Math.abs(mean.sevenEleven())) + " 百分點 (價格敏感客群流失)");
        }
    }

    private void promotion(List<String> insights, BrandShares mean, SimulationParameters params) {
        if (params.getPromotionIntensity() > SimulationParameters.NEUTRAL) {
            insights.add("促銷強度 " + params.getPromotionIntensity() + "x 將有效吸引價格敏感客群");
            if (params.getPointMultiplier() > SimulationParameters.NEUTRAL) {
                insights.add("點數 " + params.getPointMultiplier() + "x 加成提升會員黏著度");
            }
        }
        if (mean.familyMart() > 0) {
            insights.add("全家便利商店預估獲益最大 (+" + format(mean.familyMart()) + " 百分點)");
        }
    }

    private void competition(List<String> insights, BrandShares mean) {
        insights.add("監測競合品牌促銷動態，及時調整策略");
        if (mean.familyMart() > 0) {
            insights.add("全家冰淇淋促銷對新鮮人族群吸引力最強");
        }
    }

    private String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
