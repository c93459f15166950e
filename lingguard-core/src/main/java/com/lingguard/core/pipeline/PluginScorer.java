package com.lingguard.core.pipeline;

import com.lingguard.api.manifest.PluginManifest;

/**
 * 文件检测时为候选插件打分，分高者胜出
 */
@FunctionalInterface
public interface PluginScorer {

    int score(PluginManifest manifest, String filename);
}
