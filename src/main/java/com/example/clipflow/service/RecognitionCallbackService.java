package com.example.clipflow.service;

public interface RecognitionCallbackService {

    enum DeliveryOutcome {
        ACCEPTED,
        ALREADY_DELIVERED
    }

    /**
     * Records a completion reported by the recognition service.
     *
     * @throws com.example.clipflow.exceptions.CallbackRejectedException 404 for an unknown correlation,
     *                                                                   410 for an expired one
     */
    DeliveryOutcome deliver(String correlationId, String status, String resultRef, String error);
}
