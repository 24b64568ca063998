package com.webhookretry.core.spi;

import com.webhookretry.model.Outcome;
import com.webhookretry.model.WebhookResponse;

/**
 * 结果分类器: 原始响应/异常 -> Outcome
 * 纯函数, 无副作用
 */
public interface OutcomeClassifier {

    Outcome<String> classify(WebhookResponse response);

    /** 传输层或操作本身抛出的异常 */
    <T> Outcome<T> classify(Throwable failure);
}
