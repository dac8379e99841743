package com.seoanalyzer.core.capability;

/** 원격 capability 호출이 최종적으로 실패 (non-2xx, 응답 파싱 불가, 전송 오류) */
public class CapabilityException extends Exception {
    private final int statusCode;

    public CapabilityException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public CapabilityException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP 상태 코드. 전송 실패/파싱 실패는 -1 */
    public int getStatusCode() { return statusCode; }
}
