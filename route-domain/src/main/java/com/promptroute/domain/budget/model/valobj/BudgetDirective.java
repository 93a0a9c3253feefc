package com.promptroute.domain.budget.model.valobj;

import com.promptroute.types.enums.BudgetModeEnum;
import com.promptroute.types.enums.BudgetStateEnum;
import com.promptroute.types.enums.DirectiveTypeEnum;
import com.promptroute.types.enums.RouteChannelEnum;
import lombok.Builder;
import lombok.Value;

/**
 * 预算账本给出的执行指令。block 是正常的策略结果，不是异常。
 */
@Value
@Builder
public class BudgetDirective {

    DirectiveTypeEnum type;
    /** downgrade 时替换的模型 */
    String targetModel;
    /** downgrade 时替换的通道，可为空 */
    RouteChannelEnum targetChannel;
    BudgetStateEnum state;
    BudgetModeEnum mode;
    boolean alert;
    /** 账本状态无法及时读取时给出的降级放行 */
    boolean degraded;
    boolean policyFound;
    String reason;

    /**
     * 持久化超时时的缺省指令，等价于 observe 模式放行。
     */
    public static BudgetDirective degradedAllow(String reason) {
        return BudgetDirective.builder()
                .type(DirectiveTypeEnum.ALLOW)
                .mode(BudgetModeEnum.OBSERVE)
                .degraded(true)
                .reason(reason)
                .build();
    }

    public boolean isBlock() {
        return type == DirectiveTypeEnum.BLOCK;
    }

    public boolean isDowngrade() {
        return type == DirectiveTypeEnum.DOWNGRADE;
    }
}
