package com.my.relay.domain.exception;

/**
 * 왜: 리스너가 업데이트를 받아들이지 못했음을 처리기에 알려 재시도 예산을 소모하게 하기 위함.
 */
public class UpdateDispatchException extends RuntimeException {
    public UpdateDispatchException(String message) {
        super(message);
    }

    public UpdateDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
