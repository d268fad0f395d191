package com.adaptiverisk.broker;

import com.adaptiverisk.domain.model.ExecutionReport;
import com.adaptiverisk.domain.model.OrderIntent;

/**
 * The brokerage collaborator as the engine sees it: an order intent goes in, a fill
 * report comes out. No broker wire protocol is spoken on this side of the interface.
 *
 * <p>Implementations report a refused order as a REJECTED {@link ExecutionReport}; they
 * throw only when the broker cannot be reached at all.
 */
public interface BrokerGateway {

    /**
     * Submits an order and waits for its outcome.
     *
     * @throws com.adaptiverisk.exception.BusinessException with COLLABORATOR_UNAVAILABLE if
     *     the broker cannot be reached
     */
    ExecutionReport submit(OrderIntent intent);
}
