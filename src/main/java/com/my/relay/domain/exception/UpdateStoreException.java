package com.my.relay.domain.exception;

/**
 * 왜: 영속 저장소를 사용할 수 없을 때 루프가 사이클 전체를 백오프하도록 하나의 예외로 수렴시키기 위함.
 */
public class UpdateStoreException extends RuntimeException {
    public UpdateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
