package com.ryuqq.conductor.core.exception;

/**
 * 필수 설정 누락 또는 잘못된 설정.
 *
 * <p>생성 시점에 즉시 발생하며 기동을 중단시킵니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
