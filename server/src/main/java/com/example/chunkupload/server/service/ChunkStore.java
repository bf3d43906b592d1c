package com.example.chunkupload.server.service;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * 세션별 청크 저장소.
 * <p>
 * 청크는 (uploadId, index) 단위로 독립 저장되며, 같은 인덱스에 대한 재전송은 덮어쓰기입니다.
 * 읽는 쪽에서는 청크가 완전히 존재하거나 아예 없거나 둘 중 하나로만 보여야 합니다.
 * </p>
 */
public interface ChunkStore {

    /** 세션의 청크 저장 영역을 생성합니다. */
    void createArea(String uploadId) throws IOException;

    /**
     * 청크를 저장합니다. 스트림을 끝까지 읽어 임시 파일에 기록한 뒤 원자적으로 노출합니다.
     *
     * @param uploadId       세션 ID
     * @param index          청크 인덱스 (0부터)
     * @param data           청크 데이터
     * @param maxBytes       허용 최대 크기 (세션 청크 크기 또는 이 인덱스의 기대 길이)
     * @param exact          true이면 길이가 maxBytes와 정확히 같아야 함
     * @param expectedSha256 클라이언트가 보낸 SHA-256 (없으면 null, 검증 생략)
     * @return 저장된 청크 정보
     */
    StoredChunk writeChunk(String uploadId, int index, InputStream data, long maxBytes, boolean exact,
                           String expectedSha256) throws IOException;

    /** 저장 완료된 청크 인덱스를 오름차순으로 반환합니다. 영역이 없으면 빈 목록입니다. */
    List<Integer> listChunks(String uploadId) throws IOException;

    /** 저장된 청크의 바이트 크기 */
    long chunkLength(String uploadId, int index) throws IOException;

    /** 저장된 청크를 읽기 위한 스트림을 엽니다. 호출자가 닫아야 합니다. */
    InputStream openChunk(String uploadId, int index) throws IOException;

    /** 세션의 청크 저장 영역 전체를 삭제합니다. */
    void deleteArea(String uploadId) throws IOException;
}
