package com.lingguard.core.spi;

import com.lingguard.api.permission.DeviceInfo;

/**
 * 宿主设备信息
 */
public interface DeviceInfoProvider {

    DeviceInfo snapshot();
}
