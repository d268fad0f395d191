package com.adaptiverisk.broker;

import com.adaptiverisk.domain.enums.ExecutionStatus;
import com.adaptiverisk.domain.model.ExecutionReport;
import com.adaptiverisk.domain.model.OrderIntent;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Paper trading implementation of {@link BrokerGateway}: every well-formed order fills in
 * full at its reference price.
 */
@Service
public class PaperBrokerGateway implements BrokerGateway {

    private static final Logger log = LoggerFactory.getLogger(PaperBrokerGateway.class);

    private final AtomicLong orderSequence = new AtomicLong();

    @Override
    public ExecutionReport submit(OrderIntent intent) {
        String orderId = "PAPER-" + orderSequence.incrementAndGet();

        if (intent.getQuantity() <= 0 || intent.getReferencePrice() == null || intent.getReferencePrice().signum() <= 0) {
            log.warn("Paper order {} rejected: {}", orderId, intent);
            return ExecutionReport.builder()
                    .brokerOrderId(orderId)
                    .status(ExecutionStatus.REJECTED)
                    .filledQuantity(0)
                    .message("Order needs a positive quantity and reference price")
                    .build();
        }

        log.debug(
                "Paper fill {}: {} {} x{} @ {}",
                orderId,
                intent.getSide(),
                intent.getSymbol(),
                intent.getQuantity(),
                intent.getReferencePrice());
        return ExecutionReport.builder()
                .brokerOrderId(orderId)
                .status(ExecutionStatus.FILLED)
                .fillPrice(intent.getReferencePrice())
                .filledQuantity(intent.getQuantity())
                .message("Filled")
                .build();
    }
}
