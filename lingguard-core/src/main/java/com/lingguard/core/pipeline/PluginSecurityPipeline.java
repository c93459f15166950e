package com.lingguard.core.pipeline;

import com.lingguard.api.exception.InvalidArgumentException;
import com.lingguard.api.exception.PermissionDeniedException;
import com.lingguard.api.http.FetchRequest;
import com.lingguard.api.http.FetchResponse;
import com.lingguard.api.integrity.IntegrityCheckResult;
import com.lingguard.api.manifest.PluginManifest;
import com.lingguard.api.permission.ConstrainedContext;
import com.lingguard.api.permission.Permission;
import com.lingguard.api.permission.PermissionCheckResult;
import com.lingguard.api.permission.PluginOperation;
import com.lingguard.api.sandbox.SandboxOptions;
import com.lingguard.api.security.RiskLevel;
import com.lingguard.api.security.SecurityLevel;
import com.lingguard.api.validation.ValidationResult;
import com.lingguard.core.audit.LoggingErrorReporter;
import com.lingguard.core.config.SecurityConfig;
import com.lingguard.core.event.EventBus;
import com.lingguard.core.event.monitor.SecurityEvents.PluginDetectedEvent;
import com.lingguard.core.event.monitor.SecurityEvents.PluginRegisteredEvent;
import com.lingguard.core.event.monitor.SecurityEvents.PluginRejectedEvent;
import com.lingguard.core.exception.CallNotPermittedException;
import com.lingguard.core.exception.PluginRegistrationException;
import com.lingguard.core.integrity.ContentHasher;
import com.lingguard.core.integrity.IntegrityVerifier;
import com.lingguard.core.permission.PermissionManager;
import com.lingguard.core.sandbox.SandboxExecutor;
import com.lingguard.core.spi.HostBridge;
import com.lingguard.core.spi.SecurityErrorReporter;
import com.lingguard.core.util.FileTypes;
import com.lingguard.core.validation.BestPracticeChecker;
import com.lingguard.core.validation.BestPracticeReport;
import com.lingguard.core.validation.ConfigValidator;
import com.lingguard.core.validation.ProvenanceChecker;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 插件安全流水线
 * 职责：按 校验 → 完整性 → 授权 → 沙箱 的顺序把四个阶段串起来，并维护已注册插件表
 * <p>
 * 任一阶段拒绝都会短路后续阶段，已注册插件的所有调用都经由 {@link #execute} 进入沙箱。
 * </p>
 */
@Slf4j
public class PluginSecurityPipeline {

    @Getter
    private final SecurityConfig config;
    @Getter
    private final ConfigValidator validator;
    @Getter
    private final IntegrityVerifier verifier;
    @Getter
    private final PermissionManager permissionManager;
    @Getter
    private final SandboxExecutor sandbox;
    @Getter
    private final EventBus eventBus;
    private final BestPracticeChecker bestPracticeChecker;
    private final ProvenanceChecker provenanceChecker;
    private final PluginScorer scorer;
    private final SecurityErrorReporter errorReporter;

    // Map<PluginId, PluginManifest>
    private final Map<String, PluginManifest> registered = new ConcurrentHashMap<>();

    // 容量检查、授权与登记必须原子完成
    private final ReentrantLock registryLock = new ReentrantLock();

    /**
     * 使用默认组件构造：日志错误上报、进程内事件总线
     */
    public PluginSecurityPipeline(SecurityConfig config, HostBridge hostBridge) {
        this(config, hostBridge, new LoggingErrorReporter(), new EventBus());
    }

    public PluginSecurityPipeline(SecurityConfig config, HostBridge hostBridge,
                                  SecurityErrorReporter errorReporter, EventBus eventBus) {
        this(config,
                new ConfigValidator(config),
                new IntegrityVerifier(config, new ContentHasher(), errorReporter, eventBus),
                new PermissionManager(config, hostBridge),
                new SandboxExecutor(config, errorReporter, eventBus, hostBridge.getHttpTransport()),
                errorReporter,
                eventBus);
    }

    public PluginSecurityPipeline(SecurityConfig config,
                                  ConfigValidator validator,
                                  IntegrityVerifier verifier,
                                  PermissionManager permissionManager,
                                  SandboxExecutor sandbox,
                                  SecurityErrorReporter errorReporter,
                                  EventBus eventBus) {
        this(config, validator, verifier, permissionManager, sandbox, errorReporter, eventBus,
                new DefaultPluginScorer());
    }

    public PluginSecurityPipeline(SecurityConfig config,
                                  ConfigValidator validator,
                                  IntegrityVerifier verifier,
                                  PermissionManager permissionManager,
                                  SandboxExecutor sandbox,
                                  SecurityErrorReporter errorReporter,
                                  EventBus eventBus,
                                  PluginScorer scorer) {
        this.config = config;
        this.validator = validator;
        this.verifier = verifier;
        this.permissionManager = permissionManager;
        this.sandbox = sandbox;
        this.errorReporter = errorReporter;
        this.eventBus = eventBus;
        this.bestPracticeChecker = new BestPracticeChecker();
        this.provenanceChecker = new ProvenanceChecker(config);
        this.scorer = scorer;
    }

    // ==================== 注册 ====================

    /**
     * 注册插件
     *
     * @throws PluginRegistrationException 校验或完整性验证未通过，或已达注册上限
     */
    public RegistrationOutcome register(PluginManifest manifest) {
        String pluginId = manifest == null ? null : manifest.getId();

        // 1. 静态校验
        ValidationResult validation = validator.validate(manifest);
        if (!validation.isValid() || validation.getSecurityLevel() == SecurityLevel.CRITICAL) {
            throw reject(pluginId, "Plugin configuration validation failed: "
                    + String.join(", ", validation.getErrors()), validation, null);
        }

        // 2. 完整性
        IntegrityCheckResult integrity = verifier.verify(manifest);
        if (!integrity.isValid()) {
            throw reject(pluginId, String.format("Plugin integrity verification failed (trust score %.1f%%)",
                    integrity.getTrustScore()), validation, integrity);
        }
        if (integrity.getRiskLevel() == RiskLevel.MEDIUM || integrity.getRiskLevel() == RiskLevel.HIGH) {
            log.warn("[Pipeline] Plugin {} has {} security risk: {}",
                    pluginId, integrity.getRiskLevel(), integrity.getRecommendations());
        }

        // 3. 警告，来源元数据检查只记录
        if (!validation.getWarnings().isEmpty()) {
            log.warn("[Pipeline] Plugin {} configuration warnings: {}", pluginId, validation.getWarnings());
        }
        ValidationResult provenance = provenanceChecker.check(manifest);
        if (!provenance.getErrors().isEmpty() || !provenance.getWarnings().isEmpty()) {
            log.warn("[Pipeline] Plugin {} provenance findings: errors={}, warnings={}",
                    pluginId, provenance.getErrors(), provenance.getWarnings());
        }

        // 4. 容量与重复 → 5. 授权 → 6. 登记
        boolean replaced;
        boolean full = false;
        registryLock.lock();
        try {
            replaced = registered.containsKey(pluginId);
            if (!replaced && registered.size() >= config.getMaxPlugins()) {
                full = true;
            } else {
                permissionManager.autoGrant(pluginId, manifest.getCapabilities());
                registered.put(pluginId, manifest);
            }
        } finally {
            registryLock.unlock();
        }
        if (full) {
            throw reject(pluginId, "Maximum number of plugins (" + config.getMaxPlugins() + ") reached",
                    validation, integrity);
        }
        if (replaced) {
            log.warn("[Pipeline] Plugin {} was already registered and has been replaced", pluginId);
        }

        BestPracticeReport bestPractice = bestPracticeChecker.check(manifest);
        eventBus.publish(new PluginRegisteredEvent(pluginId, validation.getSecurityLevel(),
                integrity.getTrustScore(), integrity.getRiskLevel()));
        log.info("[Pipeline] Plugin {} registered (security={}, trust={}%, bestPractice={})",
                pluginId, validation.getSecurityLevel(), integrity.getTrustScore(), bestPractice.score());

        return new RegistrationOutcome(manifest, validation, integrity, provenance, bestPractice, replaced);
    }

    private PluginRegistrationException reject(String pluginId, String reason,
                                               ValidationResult validation, IntegrityCheckResult integrity) {
        log.error("[Pipeline] Plugin {} rejected: {}", pluginId, reason);
        PluginRegistrationException exception =
                new PluginRegistrationException(pluginId, reason, validation, integrity);

        Map<String, Object> context = new HashMap<>();
        context.put("pluginId", pluginId);
        if (validation != null) {
            context.put("errors", validation.getErrors());
        }
        if (integrity != null) {
            context.put("trustScore", integrity.getTrustScore());
        }
        errorReporter.report(exception, "Plugin Registration Rejected", context);
        eventBus.publish(new PluginRejectedEvent(pluginId, reason));
        return exception;
    }

    /**
     * 注销插件：移除清单、撤销授权、移除其监听器
     *
     * @return 插件此前是否已注册
     */
    public boolean unregister(String pluginId) {
        PluginManifest removed;
        registryLock.lock();
        try {
            removed = registered.remove(pluginId);
            permissionManager.revokeAll(pluginId);
        } finally {
            registryLock.unlock();
        }
        eventBus.unsubscribeAll(pluginId);
        if (removed != null) {
            log.info("[Pipeline] Plugin {} unregistered", pluginId);
        }
        return removed != null;
    }

    public Optional<PluginManifest> find(String pluginId) {
        return Optional.ofNullable(registered.get(pluginId));
    }

    public List<PluginManifest> list() {
        return new ArrayList<>(registered.values());
    }

    /**
     * 查找支持指定扩展名的插件，扩展名按校验器的规则归一化
     */
    public List<PluginManifest> findByFileType(String extension) {
        String normalized = FileTypes.normalize(extension);
        return registered.values().stream()
                .filter(manifest -> manifest.getFileTypes().stream()
                        .map(FileTypes::normalize)
                        .anyMatch(type -> type.equals(normalized) || type.equals("*")))
                .toList();
    }

    /**
     * 为文件挑选最合适的已注册插件
     * <p>
     * 扩展名取最后一个点之后的部分；候选按打分降序，同分按 id 排序。无候选或打分出错时返回空。
     * </p>
     */
    public Optional<PluginManifest> detectBestPlugin(String filename) {
        String extension = extensionOf(filename);
        try {
            List<PluginManifest> candidates = findByFileType(extension).stream()
                    .sorted(Comparator.comparing(PluginManifest::getId))
                    .toList();
            PluginManifest best = null;
            int bestScore = Integer.MIN_VALUE;
            for (PluginManifest candidate : candidates) {
                int score = scorer.score(candidate, filename);
                if (score > bestScore) {
                    best = candidate;
                    bestScore = score;
                }
            }

            if (best == null) {
                log.debug("[Pipeline] No compatible plugin for file {} ({})", filename, extension);
                eventBus.publish(new PluginDetectedEvent(filename, null, 0));
                return Optional.empty();
            }
            log.debug("[Pipeline] Best plugin for {} is {} (score {})", filename, best.getId(), bestScore);
            eventBus.publish(new PluginDetectedEvent(filename, best.getId(), bestScore));
            return Optional.of(best);
        } catch (RuntimeException e) {
            Map<String, Object> context = new HashMap<>();
            context.put("filename", filename);
            context.put("fileExtension", extension);
            errorReporter.report(e, "Plugin Detection", context);
            return Optional.empty();
        }
    }

    private static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * 重新校验并验证已注册插件，汇总其安全状态
     *
     * @throws InvalidArgumentException 插件未注册
     */
    public PluginIntegrityInfo integrityInfo(String pluginId) {
        PluginManifest manifest = registered.get(pluginId);
        if (manifest == null) {
            throw new InvalidArgumentException("pluginId", pluginId, "Plugin not found: " + pluginId);
        }
        ValidationResult validation = validator.validate(manifest);
        IntegrityCheckResult integrity = verifier.verify(manifest);
        PluginIntegrityInfo.OverallStatus status = validation.isValid() && integrity.isValid()
                ? PluginIntegrityInfo.OverallStatus.SECURE
                : PluginIntegrityInfo.OverallStatus.RISKY;
        return new PluginIntegrityInfo(
                pluginId,
                validation,
                integrity,
                verifier.report(integrity, pluginId),
                permissionManager.getPermissions(pluginId),
                status);
    }

    // ==================== 执行 ====================

    public <T> T execute(String pluginId, PluginTask<T> task) {
        return execute(pluginId, task, SandboxOptions.defaults());
    }

    /**
     * 为已注册插件构建受限上下文，并在沙箱中执行任务
     *
     * @throws CallNotPermittedException 插件未注册
     */
    public <T> T execute(String pluginId, PluginTask<T> task, SandboxOptions options) {
        requireRegistered(pluginId);
        ConstrainedContext context = permissionManager.buildConstrainedContext(pluginId);
        return sandbox.execute(pluginId, signal -> task.run(context, signal), options);
    }

    /**
     * 先做操作级权限检查再执行
     *
     * @throws PermissionDeniedException 缺少操作所需能力，任务不会进入沙箱
     */
    public <T> T execute(String pluginId, PluginOperation operation, PluginTask<T> task) {
        requireRegistered(pluginId);
        PermissionCheckResult check = permissionManager.checkOperation(pluginId, operation);
        if (!check.allowed()) {
            Permission missing = Permission.fromKey(check.missingCapabilities().get(0))
                    .orElseThrow(IllegalStateException::new);
            throw new PermissionDeniedException(pluginId, missing);
        }
        return execute(pluginId, task);
    }

    /**
     * 代插件发出网络请求：请求内容检查 → 权限检查 → 沙箱执行
     */
    public FetchResponse send(String pluginId, FetchRequest request) {
        requireRegistered(pluginId);
        sandbox.requireSecureRequest(pluginId, request);
        return execute(pluginId, PluginOperation.NETWORK_REQUEST, (context, signal) -> context.fetch(request));
    }

    private void requireRegistered(String pluginId) {
        if (!registered.containsKey(pluginId)) {
            throw new CallNotPermittedException(pluginId, "plugin is not registered");
        }
    }

    /**
     * 注销全部插件并关闭沙箱线程池
     */
    public void shutdown() {
        new ArrayList<>(registered.keySet()).forEach(this::unregister);
        sandbox.shutdown();
    }
}
