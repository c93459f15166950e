package com.lingguard.core.validation;

import java.util.List;

/**
 * 最佳实践评分
 *
 * @param score           0..100
 * @param recommendations 改进建议
 */
public record BestPracticeReport(int score, List<String> recommendations) {
}
