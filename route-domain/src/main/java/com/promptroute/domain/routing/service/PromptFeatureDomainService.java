package com.promptroute.domain.routing.service;

import com.promptroute.domain.routing.model.valobj.PromptFeatures;
import com.promptroute.types.enums.LengthBucketEnum;
import com.promptroute.types.enums.ResponseCode;
import com.promptroute.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prompt 特征提取领域服务：把原文转换为定长特征记录，原文不离开本方法。
 */
@Service
public class PromptFeatureDomainService {

    private static final Pattern FRESHNESS = Pattern.compile(
            "(today|latest|price|pricing|schedule|release|news|update|who\\s+is|20\\d{2}|policy|changelog|version|deprecat|breaking)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern IMPLEMENTATION_VERBS = Pattern.compile(
            "(implement|scaffold|integrate|deploy|refactor|migrate|benchmark|write tests|generate project|create pr|scrape|automate|pipeline|dataset)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern AMBIGUITY_MARKERS = Pattern.compile(
            "\\b(best|cheapest|fastest|quickest|near me|for my use case|recommend|not sure)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final double AMBIGUITY_PER_MARKER = 0.5D;
    private static final int MULTI_STEP_BULLETS = 2;

    public PromptFeatures extract(String promptText, boolean hasCodeSelection, boolean recentSession) {
        if (promptText == null || promptText.isBlank()) {
            throw new AppException(ResponseCode.INVALID_FEATURE_INPUT, "prompt 不能为空", null);
        }
        String normalized = promptText.trim().toLowerCase(Locale.ROOT);
        boolean freshness = FRESHNESS.matcher(normalized).find();
        boolean implementation = IMPLEMENTATION_VERBS.matcher(normalized).find();
        boolean multiStep = normalized.contains("step-by-step")
                || countOccurrences(normalized, "\n- ") >= MULTI_STEP_BULLETS;

        return PromptFeatures.builder()
                .mentionsFreshness(freshness)
                .mentionsComparison(normalized.contains("how much") || normalized.contains("compare"))
                .mentionsImplementationVerb(implementation)
                .multiStepStructure(multiStep)
                .questionAmbiguityScore(ambiguityScore(normalized))
                .singleQuestion(countOccurrences(normalized, "?") == 1)
                .lengthBucket(LengthBucketEnum.ofLength(normalized.length()))
                .hasCodeSelection(hasCodeSelection)
                .recentSession(recentSession)
                .contentHash(sha256(normalized))
                .build();
    }

    /**
     * 校验调用方直接提交的特征记录。
     */
    public PromptFeatures validate(PromptFeatures features) {
        if (features == null) {
            throw new AppException(ResponseCode.INVALID_FEATURE_INPUT, "特征记录不能为空", null);
        }
        if (features.getLengthBucket() == null) {
            throw new AppException(ResponseCode.INVALID_FEATURE_INPUT, "lengthBucket 不能为空", null);
        }
        double ambiguity = features.getQuestionAmbiguityScore();
        if (Double.isNaN(ambiguity) || ambiguity < 0D || ambiguity > 1D) {
            throw new AppException(ResponseCode.INVALID_FEATURE_INPUT,
                    "questionAmbiguityScore 必须位于 [0,1]: " + ambiguity, null);
        }
        return features;
    }

    private double ambiguityScore(String normalized) {
        Matcher matcher = AMBIGUITY_MARKERS.matcher(normalized);
        int hits = 0;
        while (matcher.find()) {
            hits++;
        }
        return Math.min(1D, hits * AMBIGUITY_PER_MARKER);
    }

    private int countOccurrences(String text, String token) {
        int count = 0;
        int index = text.indexOf(token);
        while (index >= 0) {
            count++;
            index = text.indexOf(token, index + token.length());
        }
        return count;
    }

    private String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
