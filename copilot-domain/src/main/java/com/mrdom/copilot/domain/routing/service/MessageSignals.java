package com.mrdom.copilot.domain.routing.service;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 消息文本信号工具：规整化、关键词匹配、邮箱提取。
 */
public final class MessageSignals {

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final String WORD_START = "(?<![\\p{L}\\p{N}])";
    private static final String WORD_END = "(?![\\p{L}\\p{N}])";

    private MessageSignals() {
    }

    /**
     * 小写、去重音、折叠空白。
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return StringUtils.normalizeSpace(StringUtils.stripAccents(text)).toLowerCase(Locale.ROOT);
    }

    public static Optional<String> extractEmail(String text) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        Matcher matcher = EMAIL_PATTERN.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group().toLowerCase(Locale.ROOT));
    }

    /**
     * 关键词按词首匹配（"campanha" 可以命中 "campanhas"）。
     */
    public static List<Pattern> compileKeywords(Collection<String> keywords) {
        List<Pattern> patterns = new ArrayList<>();
        if (keywords == null) {
            return patterns;
        }
        for (String keyword : keywords) {
            String normalized = normalize(keyword);
            if (!normalized.isEmpty()) {
                patterns.add(Pattern.compile(WORD_START + Pattern.quote(normalized)));
            }
        }
        return patterns;
    }

    /**
     * 问候模式按整词匹配，模式本身可以是正则片段。
     */
    public static List<Pattern> compileWholeWordPatterns(Collection<String> expressions) {
        List<Pattern> patterns = new ArrayList<>();
        if (expressions == null) {
            return patterns;
        }
        for (String expression : expressions) {
            String normalized = normalize(expression);
            if (!normalized.isEmpty()) {
                patterns.add(Pattern.compile(WORD_START + "(?:" + normalized + ")" + WORD_END));
            }
        }
        return patterns;
    }

    public static int countMatches(List<Pattern> patterns, String normalizedText) {
        int count = 0;
        for (Pattern pattern : patterns) {
            if (pattern.matcher(normalizedText).find()) {
                count++;
            }
        }
        return count;
    }

    public static List<String> matched(List<Pattern> patterns, String normalizedText) {
        List<String> matched = new ArrayList<>();
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(normalizedText);
            if (matcher.find()) {
                matched.add(matcher.group());
            }
        }
        return matched;
    }
}
