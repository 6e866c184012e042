package com.my.relay.domain.exception;

/**
 * 왜: 소스가 보낸 업데이트가 계약(update_id, 필수 필드)을 위반했을 때 디코딩 단계에서 명확히 실패를 알리기 위함.
 */
public class InvalidUpdateException extends RuntimeException {
    public InvalidUpdateException(String message) {
        super(message);
    }

    public InvalidUpdateException(String message, Throwable cause) {
        super(message, cause);
    }
}
