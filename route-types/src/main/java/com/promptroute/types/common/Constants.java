package com.promptroute.types.common;

/**
 * 全局常量定义类。
 *
 * @author promptroute
 * @since 2026-10-01
 */
public class Constants {

    /** 逗号分隔符，用于字符串分割操作 */
    public final static String SPLIT = ",";

    /** 组织级权重单元使用的用户占位值 */
    public final static String ORG_LEVEL_USER = "";

    /** 权重缺省值 */
    public final static double DEFAULT_WEIGHT = 1.0D;

    /** 权重下界 */
    public final static double MIN_WEIGHT = 0.0D;

    /** 权重上界 */
    public final static double MAX_WEIGHT = 2.0D;

}
