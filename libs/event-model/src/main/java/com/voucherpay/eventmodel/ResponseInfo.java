package com.voucherpay.eventmodel;

import java.time.Duration;

/**
 * Outbound response metadata captured for analytics.
 *
 * @param statusCode  final HTTP status
 * @param processTime time from request arrival to the finished response, serialized as decimal seconds
 * @param success     status in [200, 400)
 */
public record ResponseInfo(int statusCode, Duration processTime, boolean success) {

    public ResponseInfo {
        if (processTime == null || processTime.isNegative()) {
            processTime = Duration.ZERO;
        }
    }

    public static ResponseInfo of(int statusCode, Duration processTime) {
        return new ResponseInfo(statusCode, processTime, isSuccessStatus(statusCode));
    }

    public static boolean isSuccessStatus(int statusCode) {
        return statusCode >= 200 && statusCode < 400;
    }
}
