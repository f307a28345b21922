package com.querysub.client;

import com.querysub.common.api.RowSequence;

/**
 * Push-mode delivery target, invoked by the {@link DeliveryScheduler} after
 * each cycle that produced rows.
 */
@FunctionalInterface
public interface SubscriptionCallback {

    /**
     * Process the rows and report the highest processed key per table with
     * {@link Subscription#updateProgress} before returning. The row sequence is
     * closed once this method returns.
     *
     * @param subscription Subscription the rows belong to
     * @param rows Rows produced by this cycle
     * @param param Argument supplied at subscribe time
     * @param code Always 0
     * @throws Exception if processing fails; logged, delivery continues
     */
    void onResult(Subscription subscription, RowSequence rows, Object param, int code) throws Exception;
}
