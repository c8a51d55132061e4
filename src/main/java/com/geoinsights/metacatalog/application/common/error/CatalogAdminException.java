package com.geoinsights.metacatalog.application.common.error;

/**
 * 관리 명령을 중단시키는 설정 수준 오류(경로 없음, 출력 디렉터리 생성 불가, 스키마 생성 실패 등).
 *
 * <p>파일/레코드 단위 실패는 파이프라인에서 흡수되므로 이 예외로 올라오지 않는다.
 * 오류 분류를 위한 code 값을 함께 보관한다.</p>
 */
public class CatalogAdminException extends RuntimeException {
    private final String code;

    public CatalogAdminException(String message, String code) {
        super(message);
        this.code = code;
    }

    public CatalogAdminException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * 에러 코드를 반환한다.
     *
     * @return 에러 코드
     */
    public String code() {
        return code;
    }
}
