package com.geoinsights.metacatalog.infrastructure.input.document;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.text.Normalizer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 내보내기 파일명/문서 본문 처리 유틸리티입니다.
 * <p>
 * - 식별자를 파일시스템에 안전한 파일명으로 변환
 * - XML 선언 보정
 * - 파일명 대체용 해시 생성
 */
public class FileNameUtils {

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_.-]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern XML_DECLARATION = Pattern.compile("^\\s*<\\?xml\\s");
    private static final Pattern DECLARED_ENCODING =
            Pattern.compile("^\\s*<\\?xml[^>]*?\\sencoding\\s*=\\s*[\"']([A-Za-z0-9._:-]+)[\"']");

    public static final String XML_DECLARATION_LINE = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n";

    /**
     * 식별자를 경로 구분자/상위 경로 이동이 없는 파일명으로 변환합니다.
     * <p>
     * NFKD 정규화 후 ASCII만 남기고, 경로 구분자는 공백으로 바꾼 뒤
     * 단어를 {@code _}로 잇고 허용 문자({@code [A-Za-z0-9_.-]}) 외에는 제거합니다.
     * 앞뒤의 {@code .}/{@code _}는 잘라냅니다.
     * 결과가 비면 식별자의 SHA-256 해시를 사용합니다.
     *
     * @param identifier 레코드 식별자
     * @return 안전한 파일명(확장자 제외)
     */
    public static String secureFilename(String identifier) {
        String s = Normalizer.normalize(identifier == null ? "" : identifier, Normalizer.Form.NFKD)
                .replaceAll("[^\\p{ASCII}]", "");

        s = s.replace('/', ' ').replace('\\', ' ');
        s = String.join("_", WHITESPACE.split(s.trim()));
        s = UNSAFE.matcher(s).replaceAll("");
        s = trim(s, "._");

        return s.isEmpty() ? sha256Hex(identifier == null ? "" : identifier) : s;
    }

    /**
     * 문서가 XML 선언으로 시작하지 않으면 UTF-8 선언 줄을 앞에 붙입니다.
     *
     * @param xml XML 본문
     * @return 선언이 보장된 XML 본문
     */
    public static String withXmlDeclaration(String xml) {
        String body = xml.startsWith("\uFEFF") ? xml.substring(1) : xml;
        return XML_DECLARATION.matcher(body).find() ? body : XML_DECLARATION_LINE + body;
    }

    /**
     * XML 선언의 encoding 값에 해당하는 문자셋. 선언이 없거나 지원하지 않는 이름이면 UTF-8.
     *
     * @param xml XML 본문
     * @return 파일 기록에 쓸 문자셋
     */
    public static Charset declaredCharset(String xml) {
        String body = xml.startsWith("\uFEFF") ? xml.substring(1) : xml;
        Matcher m = DECLARED_ENCODING.matcher(body);
        if (!m.find()) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(m.group(1));
        } catch (IllegalArgumentException e) {
            return StandardCharsets.UTF_8;
        }
    }

    /**
     * 입력 문자열을 SHA-256으로 해시한 16진수 문자열을 반환합니다.
     *
     * @param input 해시할 원본 문자열
     * @return SHA-256 해시(hex)
     * @throws IllegalStateException 해시 알고리즘 사용에 실패한 경우
     */
    public static String sha256Hex(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(dig.length * 2);
            for (byte b : dig) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static String trim(String s, String chars) {
        int start = 0;
        int end = s.length();
        while (start < end && chars.indexOf(s.charAt(start)) >= 0) start++;
        while (end > start && chars.indexOf(s.charAt(end - 1)) >= 0) end--;
        return s.substring(start, end);
    }
}
