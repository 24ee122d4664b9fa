package com.flagship.gift_card_ledger.job;

import java.util.UUID;

/**
 * Durable queue of background jobs with at-least-once delivery.
 *
 * Handlers must tolerate duplicate execution. Attempts and backoff are
 * configured per deployment under {@code jobs.*}.
 */
public interface JobQueue {

    /**
     * Enqueues a job inside the caller's transaction: the job exists if and
     * only if the caller commits.
     *
     * @param kind    job kind, which selects the worker
     * @param key     partition key; jobs with the same key run in order
     * @param payload job payload, serialized as JSON
     */
    void enqueue(JobKind kind, UUID key, Object payload);
}
