package com.my.relay.domain.model;

/**
 * 왜: 처리 대상이 아닌 업데이트도 큐와 확인 시퀀스를 통과시켜야 하므로 유형 이름만 보존한다.
 */
public record UnsupportedPayload(String type) implements UpdatePayload {
}
