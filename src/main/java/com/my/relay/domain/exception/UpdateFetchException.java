package com.my.relay.domain.exception;

/**
 * 왜: 업데이트 조회의 전송 실패를 명시적으로 구분해 확인 시퀀스를 그대로 둔 채 다음 주기에 재시도하기 위함.
 */
public class UpdateFetchException extends RuntimeException {
    public UpdateFetchException(String message) {
        super(message);
    }

    public UpdateFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
