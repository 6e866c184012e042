package com.my.relay.adapter.out.dispatch;

import com.my.relay.domain.model.TelegramUpdate;
import com.my.relay.domain.model.UpdateKind;
import com.my.relay.domain.port.out.UpdateDispatcher;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

/**
 * 왜: 리스너가 남기는 로그에도 updateId/updateKind가 따라가도록 전달 구간에 MDC를 걸기 위함.
 */
public class LoggingUpdateDispatcher implements UpdateDispatcher {

    private static final Logger log = Logger.getLogger(LoggingUpdateDispatcher.class);

    private final UpdateDispatcher delegate;

    public LoggingUpdateDispatcher(UpdateDispatcher delegate) {
        this.delegate = delegate;
    }

    @Override
    public void dispatch(TelegramUpdate update) {
        MDC.put("updateId", String.valueOf(update.updateId()));
        MDC.put("updateKind", update.kind().name());
        try {
            if (update.kind() == UpdateKind.UNSUPPORTED) {
                log.debugf("처리하지 않는 업데이트 유형입니다: %s", update.payload());
            } else {
                log.debugf("업데이트 %d 처리 시작 (%s)", update.updateId(), update.kind());
            }
            delegate.dispatch(update);
        } finally {
            MDC.remove("updateId");
            MDC.remove("updateKind");
        }
    }
}
