package com.lingguard.core.pipeline;

import com.lingguard.api.integrity.IntegrityCheckResult;
import com.lingguard.api.manifest.PluginManifest;
import com.lingguard.api.validation.ValidationResult;
import com.lingguard.core.validation.BestPracticeReport;

/**
 * 注册成功的结论
 *
 * @param manifest     已登记的清单
 * @param validation   静态校验结果（可能含警告）
 * @param integrity    完整性验证结果
 * @param provenance   来源元数据检查，仅记录不阻断
 * @param bestPractice 最佳实践评分，仅供参考
 * @param replaced     是否替换了同 id 的已注册清单
 */
public record RegistrationOutcome(PluginManifest manifest,
                                  ValidationResult validation,
                                  IntegrityCheckResult integrity,
                                  ValidationResult provenance,
                                  BestPracticeReport bestPractice,
                                  boolean replaced) {
}
