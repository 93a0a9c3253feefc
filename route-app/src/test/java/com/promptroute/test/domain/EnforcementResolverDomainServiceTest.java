package com.promptroute.test.domain;

import com.promptroute.domain.budget.model.valobj.BudgetDirective;
import com.promptroute.domain.budget.model.valobj.EnforcementResult;
import com.promptroute.domain.budget.service.EnforcementResolverDomainService;
import com.promptroute.types.enums.DirectiveTypeEnum;
import com.promptroute.types.enums.RouteChannelEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class EnforcementResolverDomainServiceTest {

    private final EnforcementResolverDomainService service = new EnforcementResolverDomainService();

    @Test
    public void shouldPassThroughOnAllow() {
        EnforcementResult result = service.resolve(directive(DirectiveTypeEnum.ALLOW, null, null),
                RouteChannelEnum.AGENT, "openai/gpt-4o");

        Assertions.assertEquals(RouteChannelEnum.AGENT, result.getChannel());
        Assertions.assertEquals("openai/gpt-4o", result.getModel());
        Assertions.assertFalse(result.isWasDowngraded());
        Assertions.assertFalse(result.isBlocked());
    }

    @Test
    public void shouldRefuseOnBlock() {
        EnforcementResult result = service.resolve(directive(DirectiveTypeEnum.BLOCK, null, null),
                RouteChannelEnum.AGENT, "openai/gpt-4o");

        Assertions.assertTrue(result.isBlocked());
        Assertions.assertNull(result.getChannel());
        Assertions.assertNull(result.getModel());
    }

    @Test
    public void shouldSubstituteModelAndChannelOnDowngrade() {
        EnforcementResult result = service.resolve(
                directive(DirectiveTypeEnum.DOWNGRADE, "openai/gpt-4o-mini", RouteChannelEnum.ASK),
                RouteChannelEnum.AGENT, "openai/gpt-4o");

        Assertions.assertEquals(RouteChannelEnum.ASK, result.getChannel());
        Assertions.assertEquals("openai/gpt-4o-mini", result.getModel());
        Assertions.assertTrue(result.isWasDowngraded());
    }

    @Test
    public void shouldNotFlagDowngradeWhenNothingChanges() {
        EnforcementResult result = service.resolve(directive(DirectiveTypeEnum.DOWNGRADE, "m", null),
                RouteChannelEnum.WEB, "m");

        Assertions.assertFalse(result.isWasDowngraded());
    }

    private BudgetDirective directive(DirectiveTypeEnum type, String targetModel, RouteChannelEnum targetChannel) {
        return BudgetDirective.builder()
                .type(type)
                .targetModel(targetModel)
                .targetChannel(targetChannel)
                .build();
    }
}
