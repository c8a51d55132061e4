package com.geoinsights.metacatalog.infrastructure.input.document;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 적재 대상 메타데이터 문서 파일 목록을 만든다.
 *
 * <ul>
 *     <li>단일 파일: 그 파일 하나</li>
 *     <li>재귀 모드: 하위 트리 전체의 {@code .xml} 파일 (JSON은 포함하지 않음)</li>
 *     <li>비재귀 모드: 디렉터리 바로 아래의 {@code *.xml}, {@code *.json}</li>
 * </ul>
 *
 * <p>결과는 발견 순서가 아니라 전체 경로 문자열의 사전순으로 정렬된다.</p>
 */
@Component
public class DocumentSourceScanner {

    static final String XML_SUFFIX = ".xml";
    static final String JSON_SUFFIX = ".json";

    /**
     * @param path      파일 또는 디렉터리
     * @param recursive 하위 디렉터리까지 탐색할지 여부
     * @return 정렬된 파일 경로 목록
     * @throws NoSuchFileException 경로가 존재하지 않는 경우
     * @throws IOException         디렉터리 탐색 실패 시
     */
    public List<Path> scan(Path path, boolean recursive) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }

        if (recursive) {
            try (Stream<Path> walk = Files.walk(path)) {
                return sorted(walk
                        .filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().endsWith(XML_SUFFIX)));
            }
        }

        try (Stream<Path> list = Files.list(path)) {
            return sorted(list
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(XML_SUFFIX) || name.endsWith(JSON_SUFFIX);
                    }));
        }
    }

    private List<Path> sorted(Stream<Path> paths) {
        return paths
                .sorted(Comparator.comparing(Path::toString))
                .collect(Collectors.toList());
    }
}
