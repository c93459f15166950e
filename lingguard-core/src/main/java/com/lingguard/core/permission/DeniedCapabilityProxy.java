package com.lingguard.core.permission;

import com.lingguard.api.exception.PermissionDeniedException;
import com.lingguard.api.permission.Permission;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Proxy;

/**
 * 拒绝桩
 * <p>
 * 为宿主能力接口生成代理，任何业务方法调用都抛出 {@link PermissionDeniedException}。
 * </p>
 */
@Slf4j
final class DeniedCapabilityProxy {

    private DeniedCapabilityProxy() {
    }

    static <T> T create(Class<T> capabilityType, String pluginId, Permission permission) {
        Object proxy = Proxy.newProxyInstance(
                capabilityType.getClassLoader(),
                new Class<?>[] { capabilityType },
                (self, method, args) -> {
                    // Object 方法不属于能力调用
                    switch (method.getName()) {
                        case "toString":
                            return "Denied[" + capabilityType.getSimpleName() + ", " + permission.key() + "]";
                        case "hashCode":
                            return System.identityHashCode(self);
                        case "equals":
                            return self == args[0];
                        default:
                            log.warn("[Permission] Access Denied - Plugin: {}, Capability: {}, Operation: {}",
                                    pluginId, permission.key(), method.getName());
                            throw new PermissionDeniedException(pluginId, permission);
                    }
                });
        return capabilityType.cast(proxy);
    }
}
