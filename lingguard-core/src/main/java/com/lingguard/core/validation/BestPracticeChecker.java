package com.lingguard.core.validation;

import com.lingguard.api.manifest.PluginManifest;

import java.util.ArrayList;
import java.util.List;

/**
 * 插件清单最佳实践评分
 * 从 100 分起扣，仅供审核参考，不参与准入判断。
 */
public class BestPracticeChecker {

    private static final int MIN_DESCRIPTION_LENGTH = 50;

    public BestPracticeReport check(PluginManifest manifest) {
        List<String> recommendations = new ArrayList<>();
        int score = 100;

        String description = manifest.getDescription();
        if (description == null || description.length() < MIN_DESCRIPTION_LENGTH) {
            score -= 10;
            recommendations.add("Add a detailed description (at least 50 characters)");
        }

        if (manifest.getFeatures().isEmpty()) {
            score -= 5;
            recommendations.add("Document plugin features");
        }

        if (manifest.getFileTypes().contains("*") || manifest.getFileTypes().size() > 5) {
            score -= 15;
            recommendations.add("Be specific about supported file types");
        }

        if (manifest.getCapabilities().size() > 4) {
            score -= 10;
            recommendations.add("Minimize plugin capabilities - follow principle of least privilege");
        }

        if (manifest.getEndpoints().size() > 4) {
            score -= 5;
            recommendations.add("Consider reducing number of endpoints for simpler API surface");
        }

        return new BestPracticeReport(Math.max(0, score), List.copyOf(recommendations));
    }
}
