package com.promptroute.test.domain;

import com.promptroute.domain.routing.model.valobj.PromptFeatures;
import com.promptroute.domain.routing.service.PromptFeatureDomainService;
import com.promptroute.types.enums.LengthBucketEnum;
import com.promptroute.types.enums.ResponseCode;
import com.promptroute.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class PromptFeatureDomainServiceTest {

    private final PromptFeatureDomainService service = new PromptFeatureDomainService();

    @Test
    public void shouldDetectFreshnessOnShortSingleQuestion() {
        PromptFeatures features = service.extract("What's the latest pricing for gpt-4o?", false, false);

        Assertions.assertTrue(features.isMentionsFreshness());
        Assertions.assertFalse(features.isMentionsImplementationVerb());
        Assertions.assertTrue(features.isSingleQuestion());
        Assertions.assertEquals(LengthBucketEnum.SHORT, features.getLengthBucket());
        Assertions.assertEquals(0D, features.getQuestionAmbiguityScore());
        Assertions.assertEquals(64, features.getContentHash().length());
    }

    @Test
    public void shouldHashNormalizedTextOnly() {
        PromptFeatures first = service.extract("What's the latest pricing for gpt-4o?", false, false);
        PromptFeatures second = service.extract("  WHAT'S THE LATEST PRICING FOR GPT-4O?  ", true, true);

        Assertions.assertEquals(first.getContentHash(), second.getContentHash());
        Assertions.assertTrue(second.isHasCodeSelection());
        Assertions.assertTrue(second.isRecentSession());
    }

    @Test
    public void shouldDetectImplementationAndMultiStep() {
        PromptFeatures features = service.extract("Implement a scraper for the docs site, step-by-step please", false, false);

        Assertions.assertTrue(features.isMentionsImplementationVerb());
        Assertions.assertTrue(features.isMultiStepStructure());
        Assertions.assertFalse(features.isSingleQuestion());
    }

    @Test
    public void shouldTreatBulletListAsMultiStep() {
        PromptFeatures features = service.extract("Plan this:\n- collect data\n- clean it\n- report", false, false);

        Assertions.assertTrue(features.isMultiStepStructure());
    }

    @Test
    public void shouldScoreAmbiguityPerMarkerAndCap() {
        Assertions.assertEquals(0.5D,
                service.extract("Can you recommend a logging library?", false, false).getQuestionAmbiguityScore());
        Assertions.assertEquals(1D,
                service.extract("What is the best and cheapest option? I'm not sure", false, false).getQuestionAmbiguityScore());
    }

    @Test
    public void shouldDetectComparison() {
        Assertions.assertTrue(service.extract("Compare Postgres and MySQL", false, false).isMentionsComparison());
        Assertions.assertTrue(service.extract("How much does it cost?", false, false).isMentionsComparison());
    }

    @Test
    public void shouldBucketByLength() {
        Assertions.assertEquals(LengthBucketEnum.SHORT, service.extract("a".repeat(279), false, false).getLengthBucket());
        Assertions.assertEquals(LengthBucketEnum.MEDIUM, service.extract("a".repeat(280), false, false).getLengthBucket());
        Assertions.assertEquals(LengthBucketEnum.LONG, service.extract("a".repeat(1200), false, false).getLengthBucket());
    }

    @Test
    public void shouldRejectBlankPrompt() {
        AppException ex = Assertions.assertThrows(AppException.class, () -> service.extract("   ", false, false));
        Assertions.assertEquals(ResponseCode.INVALID_FEATURE_INPUT.getCode(), ex.getCode());
    }

    @Test
    public void shouldRejectMalformedFeatureRecord() {
        PromptFeatures missingBucket = PromptFeatures.builder().questionAmbiguityScore(0.2D).build();
        PromptFeatures outOfRange = PromptFeatures.builder()
                .lengthBucket(LengthBucketEnum.SHORT)
                .questionAmbiguityScore(1.5D)
                .build();

        AppException first = Assertions.assertThrows(AppException.class, () -> service.validate(missingBucket));
        AppException second = Assertions.assertThrows(AppException.class, () -> service.validate(outOfRange));
        Assertions.assertEquals(ResponseCode.INVALID_FEATURE_INPUT.getCode(), first.getCode());
        Assertions.assertEquals(ResponseCode.INVALID_FEATURE_INPUT.getCode(), second.getCode());
        Assertions.assertFalse(second.isRetryable());
    }
}
