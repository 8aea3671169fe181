package io.github.hotbrkm.tenantmail.agent.email.audit;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingOperatorAlertSink implements OperatorAlertSink {

    @Override
    public void raise(OperatorAlert alert) {
        log.error("Operator alert. tenantId={}, jobId={}, domain={}, errorCode={}, message={}",
                alert.tenantId(), alert.jobId(), alert.domain(), alert.errorCode(), alert.message());
    }
}
