package com.geoinsights.metacatalog.application.harvest;

/**
 * 원격 하베스트 요청이 실패했을 때(전송 실패, 비정상 상태 코드, 예외 보고서 응답) 발생한다.
 */
public class RemoteHarvestException extends RuntimeException {

    public RemoteHarvestException(String message) {
        super(message);
    }

    public RemoteHarvestException(String message, Throwable cause) {
        super(message, cause);
    }
}
