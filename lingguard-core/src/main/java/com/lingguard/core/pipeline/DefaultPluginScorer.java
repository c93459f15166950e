package com.lingguard.core.pipeline;

import com.lingguard.api.manifest.PluginManifest;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 默认打分：偏向专用插件与较新版本
 * <ul>
 *     <li>基础分 50</li>
 *     <li>id 或名称含 generic：-20</li>
 *     <li>只支持一种文件类型：+10</li>
 *     <li>版本号 MAJOR.MINOR.PATCH：+ MAJOR*5 + MINOR*2 + PATCH</li>
 *     <li>文件名包含插件 id 的首段（至少 3 个字符）：+30</li>
 * </ul>
 * 结果不低于 0。
 */
public class DefaultPluginScorer implements PluginScorer {

    static final int BASE_SCORE = 50;
    static final int GENERIC_PENALTY = 20;
    static final int SINGLE_TYPE_BONUS = 10;
    static final int FILENAME_HINT_BONUS = 30;

    private static final Pattern VERSION = Pattern.compile("v?(\\d{1,6})\\.(\\d{1,6})\\.(\\d{1,6})");
    private static final int MIN_HINT_LENGTH = 3;

    @Override
    public int score(PluginManifest manifest, String filename) {
        int score = BASE_SCORE;

        String id = manifest.getId() == null ? "" : manifest.getId().toLowerCase(Locale.ROOT);
        String name = manifest.getName() == null ? "" : manifest.getName().toLowerCase(Locale.ROOT);
        if (id.contains("generic") || name.contains("generic")) {
            score -= GENERIC_PENALTY;
        }

        if (manifest.getFileTypes().size() == 1) {
            score += SINGLE_TYPE_BONUS;
        }

        score += versionBonus(manifest.getVersion());

        String hint = leadingToken(id);
        if (filename != null && hint.length() >= MIN_HINT_LENGTH
                && filename.toLowerCase(Locale.ROOT).contains(hint)) {
            score += FILENAME_HINT_BONUS;
        }

        return Math.max(0, score);
    }

    static int versionBonus(String version) {
        if (version == null) {
            return 0;
        }
        Matcher matcher = VERSION.matcher(version);
        if (!matcher.find()) {
            return 0;
        }
        return Integer.parseInt(matcher.group(1)) * 5
                + Integer.parseInt(matcher.group(2)) * 2
                + Integer.parseInt(matcher.group(3));
    }

    private static String leadingToken(String id) {
        int end = 0;
        while (end < id.length() && Character.isLetterOrDigit(id.charAt(end))) {
            end++;
        }
        return id.substring(0, end);
    }
}
