package com.webhookretry.core.spi.failure;

import com.webhookretry.model.Outcome;

/**
 * 异常分类处理器 SPI
 */
public interface FailureCaseHandler<E extends Throwable> {

    /**
     *返回能够处理的异常类型
     */
    Class<E> exceptionType();

    /** 是否匹配 */
    default boolean supports(Throwable t) {
        return exceptionType().isInstance(t);
    }

    /** 产出分类结果 */
    <T> Outcome<T> classify(E ex);
}
