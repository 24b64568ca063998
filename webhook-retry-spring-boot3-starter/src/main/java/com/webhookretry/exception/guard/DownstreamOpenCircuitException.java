package com.webhookretry.exception.guard;

/**
 * 本地熔断打开, 调用未发出
 * 用于分类器识别 系统性故障
 */
public class DownstreamOpenCircuitException extends RuntimeException {

    public DownstreamOpenCircuitException(String endpoint, Throwable cause) {
        super("circuit open for " + endpoint, cause);
    }
}
